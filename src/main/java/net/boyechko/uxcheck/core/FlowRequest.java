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

/**
 * What a flow run should validate.
 *
 * @param patternNames canonical names or aliases requested explicitly; may be empty
 * @param autoSelect whether patterns may be chosen or added from the tree's structure
 * @param includeCoverage whether to compute coverage against the registry
 */
public record FlowRequest(List<String> patternNames, boolean autoSelect, boolean includeCoverage) {

    public FlowRequest {
        patternNames =
                patternNames != null
                        ? patternNames.stream()
                                .map(String::trim)
                                .filter(name -> !name.isEmpty())
                                .toList()
                        : List.of();
    }

    /** Validates whatever the tree's structure suggests with high confidence. */
    public static FlowRequest auto() {
        return new FlowRequest(List.of(), true, false);
    }

    /** Validates the named patterns, plus disclosure and wizard patterns the tree hints at. */
    public static FlowRequest of(String... patternNames) {
        return new FlowRequest(List.of(patternNames), true, false);
    }

    /** Parses a comma-separated list such as "form, pd". */
    public static FlowRequest parse(String commaSeparatedNames) {
        if (commaSeparatedNames == null) {
            return auto();
        }
        return new FlowRequest(List.of(commaSeparatedNames.split(",")), true, false);
    }

    public FlowRequest withCoverage() {
        return new FlowRequest(patternNames, autoSelect, true);
    }

    public FlowRequest withoutAutoSelect() {
        return new FlowRequest(patternNames, false, includeCoverage);
    }

    public boolean hasExplicitPatterns() {
        return !patternNames.isEmpty();
    }
}
