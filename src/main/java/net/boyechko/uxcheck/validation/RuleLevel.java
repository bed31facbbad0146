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
package net.boyechko.uxcheck.validation;

import net.boyechko.uxcheck.issue.IssueSev;

/** Whether a failing rule blocks (MUST) or only advises (SHOULD). */
public enum RuleLevel {
    MUST(IssueSev.ERROR),
    SHOULD(IssueSev.WARN);

    private final IssueSev severity;

    RuleLevel(IssueSev severity) {
        this.severity = severity;
    }

    /** Severity of the issues a rule at this level emits. */
    public IssueSev severity() {
        return severity;
    }
}
