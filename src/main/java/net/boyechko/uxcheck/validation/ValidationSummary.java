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
import java.util.Optional;

/** Aggregated outcome of validating several patterns against one tree. */
public record ValidationSummary(
        List<PatternResult> patterns, boolean hasMustFailures, int totalIssues) {

    public ValidationSummary {
        patterns = List.copyOf(patterns);
    }

    /** Aggregates results in the order given; any MUST failure marks the whole summary. */
    public static ValidationSummary of(List<PatternResult> results) {
        boolean hasMustFailures = results.stream().anyMatch(PatternResult::hasMustFailures);
        int totalIssues = results.stream().mapToInt(r -> r.issues().size()).sum();
        return new ValidationSummary(results, hasMustFailures, totalIssues);
    }

    public Optional<PatternResult> resultFor(String patternName) {
        return patterns.stream().filter(p -> p.pattern().equals(patternName)).findFirst();
    }
}
