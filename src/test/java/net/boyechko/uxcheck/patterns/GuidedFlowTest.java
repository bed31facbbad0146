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
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.GuidedFlowBehavior;
import net.boyechko.uxcheck.node.StackNode;
import net.boyechko.uxcheck.patterns.GuidedFlowScopes.ButtonKind;
import net.boyechko.uxcheck.patterns.GuidedFlowScopes.Scope;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.PatternValidator;
import org.junit.jupiter.api.Test;

class GuidedFlowTest {
    private static final IssueSource SOURCE =
            new IssueSource(GuidedFlow.NAME, "Test source", "https://example.org/");

    private final PatternValidator validator = new PatternValidator();

    @Test
    void wellFormedWizardPassesEveryRule() {
        PatternResult result =
                validator.validatePattern(GuidedFlow.pattern(SOURCE), threeStepWizard());

        assertTrue(result.issues().isEmpty(), () -> "Unexpected: " + result.issues());
        assertEquals(7, result.mustPassed());
        assertEquals(3, result.shouldPassed());
    }

    @Test
    void gapInStepIndicesIsReportedOnTheWizard() {
        StackNode root =
                wizard(
                        "wizard",
                        3,
                        step("s1", 1, null, text("t1", "One"), row("r1", primary("n1", "Next"))),
                        step("s3", 3, null, text("t3", "Three"), row("r3", primary("f", "Done"))));

        IssueList issues = GuidedFlow.checkStepsContiguous(root);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals("wizard", issue.nodeId());
        assertEquals(List.of(1, 2, 3), issue.detail("expectedRange"));
        assertEquals(List.of(1, 3), issue.detail("foundIndices"));
        assertEquals(3, issue.detail("totalSteps"));
    }

    @Test
    void duplicateStepIndexIsNotContiguous() {
        StackNode root =
                wizard(
                        "wizard",
                        2,
                        step("a", 1, null, row("ra", primary("na", "Next"))),
                        step("b", 1, null, row("rb", primary("nb", "Next"))));

        assertEquals(1, GuidedFlow.checkStepsContiguous(root).size());
    }

    @Test
    void stepBeforeLastNeedsNext() {
        StackNode root =
                wizard(
                        "wizard",
                        2,
                        step("s1", 1, null, text("t1", "One"), row("r1", button("c", "Cancel"))),
                        step(
                                "s2",
                                2,
                                null,
                                text("t2", "Two"),
                                row("r2", button("b", "Back"), primary("f", "Submit"))));

        IssueList issues = GuidedFlow.checkNextPresent(root);

        assertEquals(1, issues.size());
        assertEquals("s1", issues.get(0).nodeId());
        assertEquals("r1", issues.get(0).detail("actionsRowNodeId"));
        assertEquals(IssueSev.ERROR, issues.get(0).severity());
    }

    @Test
    void lastStepNeedsFinish() {
        StackNode root =
                wizard(
                        "wizard",
                        2,
                        step("s1", 1, null, row("r1", primary("n", "Continue"))),
                        step(
                                "s2",
                                2,
                                null,
                                row("r2", button("b", "Previous"), primary("x", "Next"))));

        IssueList issues = GuidedFlow.checkFinishPresent(root);

        assertEquals(1, issues.size());
        assertEquals("s2", issues.get(0).nodeId());
        assertEquals("Last step 2 missing Finish action", issues.get(0).message());
    }

    @Test
    void backOnFirstStepIsIllegal() {
        StackNode root =
                wizard(
                        "wizard",
                        2,
                        step("s1", 1, null, row("r1", button("b", "Back"), primary("n", "Next"))),
                        step("s2", 2, null, row("r2", button("b2", "Back"), primary("f", "Done"))));

        IssueList issues = GuidedFlow.checkNoBackOnFirstStep(root);

        assertEquals(1, issues.size());
        assertEquals("s1", issues.get(0).nodeId());
        assertEquals(1, issues.get(0).detail("stepIndex"));
    }

    @Test
    void intermediateStepNeedsBack() {
        StackNode root =
                wizard(
                        "wizard",
                        3,
                        step("s1", 1, null, row("r1", primary("n1", "Next"))),
                        step("s2", 2, null, row("r2", primary("n2", "Next"))),
                        step(
                                "s3",
                                3,
                                null,
                                row("r3", button("b3", "Back"), primary("f", "Finish"))));

        IssueList issues = GuidedFlow.checkBackPresent(root);

        assertEquals(List.of("s2"), issues.stream().map(Issue::nodeId).toList());
    }

    @Test
    void fieldBelowActionRowIsReported() {
        StackNode root =
                wizard(
                        "wizard",
                        1,
                        step(
                                "s1",
                                1,
                                null,
                                field("early", "Full name"),
                                row("actions", primary("f", "Finish")),
                                field("late", "Nickname")));

        IssueList issues = GuidedFlow.checkFieldsBeforeActions(root);

        assertEquals(1, issues.size());
        assertEquals(List.of("late"), issues.get(0).detail("misplacedFieldIds"));
        assertEquals("actions", issues.get(0).detail("actionsRowId"));
    }

    @Test
    void twoPrimaryActionsInOneStep() {
        StackNode root =
                wizard(
                        "wizard",
                        1,
                        step(
                                "s1",
                                1,
                                null,
                                row("r", primary("a", "Save"), primary("f", "Finish"))));

        IssueList issues = GuidedFlow.checkSinglePrimary(root);

        assertEquals(1, issues.size());
        assertEquals(List.of("a", "f"), issues.get(0).detail("primaryButtonIds"));
    }

    @Test
    void promisedProgressIndicatorMustExist() {
        StackNode missing =
                wizard(
                        "wizard",
                        GuidedFlowBehavior.wizardWithProgress(1, null),
                        step("s1", 1, null, text("t", "Details"), row("r", primary("f", "Done"))));
        StackNode textual =
                wizard(
                        "wizard",
                        GuidedFlowBehavior.wizardWithProgress(1, null),
                        text("progress", "Step 1 of 1"),
                        step("s1", 1, null, text("t", "Details"), row("r", primary("f", "Done"))));
        StackNode byId =
                stack(
                        "root",
                        text("crumbs", "Checkout"),
                        wizard(
                                "wizard",
                                GuidedFlowBehavior.wizardWithProgress(1, "crumbs"),
                                step("s1", 1, null, row("r", primary("f", "Done")))));

        IssueList issues = GuidedFlow.checkProgress(missing);
        assertEquals(1, issues.size());
        assertEquals(IssueSev.WARN, issues.get(0).severity());
        assertEquals("wizard", issues.get(0).nodeId());

        assertTrue(GuidedFlow.checkProgress(textual).isEmpty());
        assertTrue(GuidedFlow.checkProgress(byId).isEmpty());
        assertTrue(GuidedFlow.checkProgress(threeStepWizard()).isEmpty());
    }

    @Test
    void backShouldComeBeforeForwardAction() {
        StackNode root =
                wizard(
                        "wizard",
                        2,
                        step("s1", 1, null, text("t1", "One"), row("r1", primary("n", "Next"))),
                        step(
                                "s2",
                                2,
                                null,
                                text("t2", "Two"),
                                row("r2", primary("f", "Finish"), button("b", "Back"))));

        IssueList issues = GuidedFlow.checkActionsOrder(root);

        assertEquals(1, issues.size());
        assertEquals(List.of("FINISH", "BACK"), issues.get(0).detail("order"));
    }

    @Test
    void stepWithoutHeadingBeforeActions() {
        StackNode root =
                wizard(
                        "wizard",
                        1,
                        step(
                                "s1",
                                1,
                                null,
                                field("f1", "Full name"),
                                row("r", primary("f", "Finish")),
                                text("footnote", "Thanks")));

        IssueList issues = GuidedFlow.checkStepTitle(root);

        assertEquals(1, issues.size());
        assertEquals("Step 1 missing title/heading", issues.get(0).message());
    }

    @Test
    void strayStepsFormOneGlobalScope() {
        StackNode root =
                stack(
                        "root",
                        step("s2", 2, 2, row("r2", button("b", "Back"), primary("f", "Finish"))),
                        step("s1", 1, 2, row("r1", primary("n", "Next"))));

        List<Scope> scopes = GuidedFlowScopes.resolve(root);

        assertEquals(1, scopes.size());
        assertNull(scopes.get(0).container());
        assertEquals(List.of(1, 2), scopes.get(0).indices());
        assertEquals(2, scopes.get(0).totalSteps());
        PatternResult result = validator.validatePattern(GuidedFlow.pattern(SOURCE), root);
        assertFalse(result.hasMustFailures());
    }

    @Test
    void treeWithoutWizardHasOneEmptyScope() {
        List<Scope> scopes = GuidedFlowScopes.resolve(stack("root", text("t", "Hello")));

        assertEquals(1, scopes.size());
        assertTrue(scopes.get(0).steps().isEmpty());
        assertTrue(
                validator
                        .validatePattern(GuidedFlow.pattern(SOURCE), stack("root"))
                        .issues()
                        .isEmpty());
    }

    @Test
    void buttonsAreClassifiedByWholeText() {
        assertEquals(ButtonKind.BACK, GuidedFlowScopes.classify(button("a", "Previous")));
        assertEquals(ButtonKind.NEXT, GuidedFlowScopes.classify(button("b", "CONTINUE")));
        assertEquals(ButtonKind.FINISH, GuidedFlowScopes.classify(button("c", "Submit")));
        assertEquals(
                ButtonKind.OTHER, GuidedFlowScopes.classify(button("d", "Save and continue")));
        assertEquals(ButtonKind.OTHER, GuidedFlowScopes.classify(iconButton("e", "chevron")));
    }

    @Test
    void actionRowPrefersLastButtonOnlyRow() {
        StackNode step =
                step(
                        "s",
                        1,
                        null,
                        row("toolbar", button("help", "Help")),
                        stack("body", field("f", "Full name"), button("inline", "Check")),
                        row("actions", button("b", "Back"), primary("n", "Next")));

        assertEquals("actions", GuidedFlowScopes.detectActionsRow(step).id());
    }

    @Test
    void actionRowFallsBackToLeafStackWithButton() {
        StackNode step =
                step(
                        "s",
                        1,
                        null,
                        text("title", "Details"),
                        stack("footer", text("note", "Almost done"), primary("n", "Next")));

        assertEquals("footer", GuidedFlowScopes.detectActionsRow(step).id());
        assertNull(GuidedFlowScopes.detectActionsRow(step("empty", 1, null, text("t", "T"))));
    }
}
