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
import java.util.Objects;
import java.util.stream.Stream;
import net.boyechko.uxcheck.issue.IssueSource;

/**
 * A named bundle of MUST and SHOULD rules embodying one UX heuristic. Immutable.
 *
 * @param name canonical name, e.g. "Progressive.Disclosure"
 * @param source attribution for the pattern as a whole
 */
public record Pattern(String name, IssueSource source, List<Rule> must, List<Rule> should) {

    public Pattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        must = List.copyOf(must);
        should = List.copyOf(should);
        requireLevel(name, must, RuleLevel.MUST);
        requireLevel(name, should, RuleLevel.SHOULD);
    }

    private static void requireLevel(String name, List<Rule> rules, RuleLevel expected) {
        for (Rule r : rules) {
            if (r.level() != expected) {
                throw new IllegalArgumentException(
                        "Rule "
                                + r.id()
                                + " of pattern "
                                + name
                                + " is "
                                + r.level()
                                + " but was registered as "
                                + expected);
            }
        }
    }

    /** All rules, MUST first. */
    public List<Rule> rules() {
        return Stream.concat(must.stream(), should.stream()).toList();
    }
}
