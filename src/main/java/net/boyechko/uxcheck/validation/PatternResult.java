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

import java.util.List;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSource;

/**
 * Outcome of validating one pattern. Each rule contributes exactly one pass or fail, however many
 * issues it emitted.
 */
public record PatternResult(
        String pattern,
        IssueSource source,
        int mustPassed,
        int mustFailed,
        int shouldPassed,
        int shouldFailed,
        List<Issue> issues) {

    public PatternResult {
        issues = List.copyOf(issues);
    }

    public boolean hasMustFailures() {
        return mustFailed > 0;
    }

    public IssueList issueList() {
        return new IssueList(issues);
    }
}
