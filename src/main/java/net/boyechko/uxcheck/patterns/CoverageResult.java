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

import java.util.List;

/**
 * How many of the registered patterns a run activated, and which suggested ones it left out.
 *
 * @param activated number of distinct activated pattern names
 * @param total number of registered patterns
 * @param percent activated share of total, rounded to two decimals
 * @param gaps medium or high confidence suggestions that were not activated
 */
public record CoverageResult(int activated, int total, double percent, List<Gap> gaps) {

    public record Gap(String pattern, String reason) {}

    public CoverageResult {
        gaps = List.copyOf(gaps);
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }
}
