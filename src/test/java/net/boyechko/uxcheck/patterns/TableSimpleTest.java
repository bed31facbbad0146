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

import static net.boyechko.uxcheck.ScaffoldFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.StackNode;
import net.boyechko.uxcheck.node.TableNode;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.PatternValidator;
import org.junit.jupiter.api.Test;

class TableSimpleTest {
    private static final IssueSource SOURCE =
            new IssueSource(TableSimple.NAME, "Test source", "https://example.org/");

    private static TableNode table(String id, String title, String strategy) {
        return TableNode.of(id, title, List.of("Name", "Email"), strategy);
    }

    @Test
    void titledResponsiveTableWithAdjacentFilterPasses() {
        StackNode root =
                stack("root", field("filter", "Filter users"), table("users", "Users", "scroll"));

        PatternResult result =
                new PatternValidator().validatePattern(TableSimple.pattern(SOURCE), root);

        assertTrue(result.issues().isEmpty());
        assertEquals(3, result.mustPassed());
        assertEquals(1, result.shouldPassed());
    }

    @Test
    void missingTitleIsAnError() {
        IssueList issues = TableSimple.checkTitleExists(stack("root", table("t", " ", "wrap")));

        assertEquals(1, issues.size());
        assertEquals(IssueSev.ERROR, issues.get(0).severity());
        assertEquals("t", issues.get(0).nodeId());
    }

    @Test
    void strategyMustBeDeclaredAndKnown() {
        StackNode root =
                stack(
                        "root",
                        table("none", "None", null),
                        table("bogus", "Bogus", "shrink"),
                        table("cards", "Cards", "cards"));

        IssueList issues = TableSimple.checkResponsiveStrategy(root);

        assertEquals(2, issues.size());
        assertTrue(issues.get(0).message().contains("missing responsive.strategy"));
        assertTrue(issues.get(1).message().contains("invalid responsive.strategy \"shrink\""));
    }

    @Test
    void onlyUndeclaredStrategyMayOverflow() {
        StackNode root =
                stack("root", table("none", "None", ""), table("bogus", "Bogus", "shrink"));

        IssueList issues = TableSimple.checkMinWidth(root);

        assertEquals(1, issues.size());
        assertEquals("none", issues.get(0).nodeId());
    }

    @Test
    void distantControlsAreAWarning() {
        StackNode root =
                stack(
                        "root",
                        button("export", "Export"),
                        text("caption", "All users"),
                        table("users", "Users", "scroll"));

        IssueList issues = TableSimple.checkControlsAdjacent(root);

        assertEquals(1, issues.size());
        assertEquals(IssueSev.WARN, issues.get(0).severity());
        assertEquals("users", issues.get(0).nodeId());
    }

    @Test
    void tableWithoutSiblingControlsHasNothingToPlace() {
        StackNode root = stack("root", text("caption", "All users"), table("u", "Users", "wrap"));

        assertTrue(TableSimple.checkControlsAdjacent(root).isEmpty());
        assertTrue(TableSimple.checkControlsAdjacent(table("alone", "Alone", "wrap")).isEmpty());
    }

    @Test
    void hiddenControlsAreNotCounted() {
        StackNode root =
                stack(
                        "root",
                        hiddenButton("export", "Export"),
                        text("caption", "All users"),
                        table("users", "Users", "scroll"));

        assertTrue(TableSimple.checkControlsAdjacent(root).isEmpty());
    }
}
