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

import java.util.Objects;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.node.Node;

/**
 * A named check belonging to a pattern. Rules are values: a check function plus its metadata.
 *
 * @param id stable identifier, also used as the id of the issues the rule emits
 * @param level MUST or SHOULD
 * @param description one-line statement of what the rule requires
 * @param checker the check itself
 */
public record Rule(String id, RuleLevel level, String description, RuleCheck checker) {

    public Rule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(checker, "checker");
    }

    public static Rule must(String id, String description, RuleCheck checker) {
        return new Rule(id, RuleLevel.MUST, description, checker);
    }

    public static Rule should(String id, String description, RuleCheck checker) {
        return new Rule(id, RuleLevel.SHOULD, description, checker);
    }

    /** Runs the check; a null result from the checker counts as no issues. */
    public IssueList check(Node root) {
        IssueList found = checker.check(root);
        return found != null ? found : new IssueList();
    }
}
