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

import java.util.List;
import net.boyechko.uxcheck.patterns.CoverageResult;
import net.boyechko.uxcheck.patterns.PatternSuggestion;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.ValidationSummary;

/** Interface for reporting progress and results of a flow run. */
public interface FlowListener {
    void onPhaseStart(String phaseName);

    void onPatternResult(PatternResult result);

    void onSummary(ValidationSummary summary);

    default void onAutoSelected(List<PatternSuggestion> suggestions) {}

    default void onPatternAdded(String patternName, String reason) {}

    default void onCoverage(CoverageResult coverage) {}

    /** Called once after everything else for the run has been reported. */
    default void onFinish() {}
}
