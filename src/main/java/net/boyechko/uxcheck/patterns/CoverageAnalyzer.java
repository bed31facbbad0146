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
package net.boyechko.uxcheck.patterns;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.uxcheck.patterns.PatternSuggestion.Confidence;

/** Compares suggested patterns with the ones a run actually activated. */
public final class CoverageAnalyzer {
    private CoverageAnalyzer() {}

    public static CoverageResult computeCoverage(
            List<PatternSuggestion> suggestions,
            Collection<String> activatedNames,
            PatternRegistry registry) {
        Set<String> activated = new LinkedHashSet<>(activatedNames);
        int total = registry.size();
        double percent = total == 0 ? 0.0 : percentOf(activated.size(), total);

        List<CoverageResult.Gap> gaps =
                suggestions.stream()
                        .filter(s -> s.confidence().isAtLeast(Confidence.MEDIUM))
                        .filter(s -> !activated.contains(s.pattern()))
                        .map(s -> new CoverageResult.Gap(s.pattern(), s.reason()))
                        .toList();
        return new CoverageResult(activated.size(), total, percent, gaps);
    }

    private static double percentOf(int part, int total) {
        return BigDecimal.valueOf(part)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
