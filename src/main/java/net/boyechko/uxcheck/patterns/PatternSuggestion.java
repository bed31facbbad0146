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

import java.util.Objects;

/**
 * A pattern that a tree's structure suggests should be validated.
 *
 * @param pattern canonical pattern name
 * @param confidence categorical confidence band
 * @param confidenceScore numeric confidence, 0 to 100
 * @param reason what in the tree triggered the suggestion
 */
public record PatternSuggestion(
        String pattern, Confidence confidence, int confidenceScore, String reason) {

    public enum Confidence {
        LOW,
        MEDIUM,
        HIGH;

        public boolean isAtLeast(Confidence other) {
            return compareTo(other) >= 0;
        }
    }

    public PatternSuggestion {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(reason, "reason");
        if (confidenceScore < 0 || confidenceScore > 100) {
            throw new IllegalArgumentException("confidenceScore out of range: " + confidenceScore);
        }
    }
}
