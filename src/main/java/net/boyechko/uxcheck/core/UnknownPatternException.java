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

/** Thrown when a requested pattern name matches no registered pattern or alias. */
public class UnknownPatternException extends Exception {
    private final String patternName;
    private final List<String> availableNames;

    public UnknownPatternException(String patternName, List<String> availableNames) {
        super(
                "Unknown pattern: "
                        + patternName
                        + " (available: "
                        + String.join(", ", availableNames)
                        + ")");
        this.patternName = patternName;
        this.availableNames = List.copyOf(availableNames);
    }

    public String getPatternName() {
        return patternName;
    }

    public List<String> getAvailableNames() {
        return availableNames;
    }
}
