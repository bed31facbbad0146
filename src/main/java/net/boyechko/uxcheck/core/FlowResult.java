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
import java.util.Optional;
import net.boyechko.uxcheck.patterns.CoverageResult;
import net.boyechko.uxcheck.patterns.PatternSuggestion;
import net.boyechko.uxcheck.validation.ValidationSummary;

/**
 * Outcome of a flow run.
 *
 * @param summary validation results for the activated patterns
 * @param activatedPatterns canonical names of the validated patterns, in validation order
 * @param autoSelected suggestions that caused a pattern to be activated without being requested
 * @param suggestions every suggestion derived from the tree
 * @param coverage coverage against the registry, or null when it was not requested
 */
public record FlowResult(
        ValidationSummary summary,
        List<String> activatedPatterns,
        List<PatternSuggestion> autoSelected,
        List<PatternSuggestion> suggestions,
        CoverageResult coverage) {

    public FlowResult {
        activatedPatterns = List.copyOf(activatedPatterns);
        autoSelected = List.copyOf(autoSelected);
        suggestions = List.copyOf(suggestions);
    }

    public Optional<CoverageResult> coverageResult() {
        return Optional.ofNullable(coverage);
    }

    public boolean hasMustFailures() {
        return summary.hasMustFailures();
    }
}
