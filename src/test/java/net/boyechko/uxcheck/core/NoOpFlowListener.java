/*
 * UX-Check - UX Pattern Validation for UI Scaffolds
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uxcheck.core;

import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.ValidationSummary;

public class NoOpFlowListener implements FlowListener {
    @Override
    public void onPhaseStart(String phaseName) {}

    @Override
    public void onPatternResult(PatternResult result) {}

    @Override
    public void onSummary(ValidationSummary summary) {}
}
