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
import java.util.Set;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.node.SiblingMap;
import net.boyechko.uxcheck.node.TableNode;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.Rule;

/** Rules for simple data tables: a title and a declared small-screen strategy. */
public final class TableSimple {
    public static final String NAME = "Table.Simple";

    private static final IssueSource CARBON =
            new IssueSource(
                    NAME,
                    "IBM Carbon Design System",
                    "https://carbondesignsystem.com/components/data-table/usage/");

    static final Set<String> RESPONSIVE_STRATEGIES = Set.of("wrap", "scroll", "cards");

    private TableSimple() {}

    public static Pattern pattern(IssueSource source) {
        return new Pattern(
                NAME,
                source,
                List.of(
                        Rule.must(
                                "title-exists",
                                "Table.title must be non-empty",
                                TableSimple::checkTitleExists),
                        Rule.must(
                                "responsive-strategy",
                                "Table.responsive.strategy must be one of: wrap, scroll, cards",
                                TableSimple::checkResponsiveStrategy),
                        Rule.must(
                                "min-width-fit-or-scroll",
                                "At the smallest viewport the table must not overflow"
                                        + " horizontally",
                                TableSimple::checkMinWidth)),
                List.of(
                        Rule.should(
                                "controls-adjacent",
                                "Filters and controls should be adjacent to the table",
                                TableSimple::checkControlsAdjacent)));
    }

    static IssueList checkTitleExists(Node root) {
        IssueList issues = new IssueList();
        for (TableNode table : tables(root)) {
            if (table.title() == null || table.title().isBlank()) {
                issues.add(
                        issue(
                                "title-exists",
                                "Table \"" + table.id() + "\" has empty or missing title",
                                table.id()));
            }
        }
        return issues;
    }

    static IssueList checkResponsiveStrategy(Node root) {
        IssueList issues = new IssueList();
        for (TableNode table : tables(root)) {
            String strategy = table.responsiveStrategy();
            if (strategy == null || strategy.isEmpty()) {
                issues.add(
                        issue(
                                "responsive-strategy",
                                "Table \"" + table.id() + "\" is missing responsive.strategy",
                                table.id()));
            } else if (!RESPONSIVE_STRATEGIES.contains(strategy)) {
                issues.add(
                        issue(
                                "responsive-strategy",
                                "Table \""
                                        + table.id()
                                        + "\" has invalid responsive.strategy \""
                                        + strategy
                                        + "\" (must be: wrap, scroll, or cards)",
                                table.id()));
            }
        }
        return issues;
    }

    /** Only a table with no strategy at all can be shown to overflow without layout data. */
    static IssueList checkMinWidth(Node root) {
        IssueList issues = new IssueList();
        for (TableNode table : tables(root)) {
            String strategy = table.responsiveStrategy();
            if (strategy == null || strategy.isEmpty()) {
                issues.add(
                        issue(
                                "min-width-fit-or-scroll",
                                "Table \""
                                        + table.id()
                                        + "\" has no responsive strategy; may overflow on small"
                                        + " viewports",
                                table.id()));
            }
        }
        return issues;
    }

    static IssueList checkControlsAdjacent(Node root) {
        IssueList issues = new IssueList();
        SiblingMap siblingMap = SiblingMap.of(root);
        for (TableNode table : tables(root)) {
            List<Node> siblings = siblingMap.siblingsOf(table);
            int tableIndex = -1;
            for (int i = 0; i < siblings.size(); i++) {
                if (siblings.get(i) == table) {
                    tableIndex = i;
                }
            }
            if (tableIndex < 0) {
                continue;
            }
            boolean hasControls = false;
            boolean adjacent = false;
            for (int i = 0; i < siblings.size(); i++) {
                Node sibling = siblings.get(i);
                if (i == tableIndex || !isControl(sibling)) {
                    continue;
                }
                hasControls = true;
                if (Math.abs(i - tableIndex) == 1) {
                    adjacent = true;
                }
            }
            if (hasControls && !adjacent) {
                issues.add(
                        Issue.builder(
                                        "controls-adjacent",
                                        IssueSev.WARN,
                                        "Controls for table \""
                                                + table.id()
                                                + "\" are not placed next to it")
                                .nodeId(table.id())
                                .source(CARBON)
                                .suggestion(
                                        RemediationSuggestions.getSuggestion(
                                                "controls-adjacent", table.id()))
                                .build());
            }
        }
        return issues;
    }

    private static boolean isControl(Node n) {
        return n.visible() && (n instanceof ButtonNode || n instanceof FieldNode);
    }

    private static List<TableNode> tables(Node root) {
        return NodeTree.preOrder(root).stream()
                .filter(TableNode.class::isInstance)
                .map(TableNode.class::cast)
                .toList();
    }

    private static Issue issue(String ruleId, String message, String nodeId) {
        return Issue.builder(ruleId, IssueSev.ERROR, message)
                .nodeId(nodeId)
                .source(CARBON)
                .suggestion(RemediationSuggestions.getSuggestion(ruleId, nodeId))
                .build();
    }
}
