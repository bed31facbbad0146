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
package net.boyechko.uxcheck;

import java.util.List;
import net.boyechko.uxcheck.node.Behaviors;
import net.boyechko.uxcheck.node.BoxNode;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.DisclosureBehavior;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.GuidedFlowBehavior;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.StackNode;
import net.boyechko.uxcheck.node.TextNode;

/** Small builders for the scaffold trees used across tests. */
public final class ScaffoldFixtures {
    private ScaffoldFixtures() {}

    public static StackNode stack(String id, Node... children) {
        return StackNode.vertical(id, children);
    }

    public static StackNode row(String id, Node... children) {
        return StackNode.horizontal(id, children);
    }

    public static TextNode text(String id, String text) {
        return TextNode.of(id, text);
    }

    public static TextNode hiddenText(String id, String text) {
        return new TextNode(id, false, List.of(), Behaviors.NONE, text);
    }

    public static ButtonNode button(String id, String text) {
        return ButtonNode.of(id, text);
    }

    public static ButtonNode primary(String id, String text) {
        return ButtonNode.primary(id, text);
    }

    public static ButtonNode hiddenButton(String id, String text) {
        return new ButtonNode(id, false, List.of(), Behaviors.NONE, text, null);
    }

    public static ButtonNode iconButton(String id, String... affordances) {
        return new ButtonNode(id, true, List.of(affordances), Behaviors.NONE, null, null);
    }

    public static FieldNode field(String id, String label) {
        return FieldNode.of(id, label);
    }

    public static FieldNode requiredField(String id, String label) {
        return FieldNode.required(id, label);
    }

    public static BoxNode collapsible(String id, Node child) {
        return BoxNode.collapsible(id, DisclosureBehavior.collapsed(), child);
    }

    public static BoxNode collapsible(String id, String controlsId, Node child) {
        return BoxNode.collapsible(id, DisclosureBehavior.collapsed(controlsId), child);
    }

    public static BoxNode collapsibleWithAffordances(String id, List<String> affordances) {
        return new BoxNode(
                id, true, affordances, Behaviors.of(DisclosureBehavior.collapsed()), null);
    }

    public static StackNode wizard(String id, Integer totalSteps, Node... children) {
        return wizard(id, GuidedFlowBehavior.wizard(totalSteps), children);
    }

    public static StackNode wizard(String id, GuidedFlowBehavior behavior, Node... children) {
        return new StackNode(
                id,
                true,
                List.of(),
                Behaviors.of(behavior),
                StackNode.Direction.VERTICAL,
                List.of(children));
    }

    public static StackNode step(String id, int index, Integer total, Node... children) {
        return new StackNode(
                id,
                true,
                List.of(),
                Behaviors.of(GuidedFlowBehavior.step(index, total)),
                StackNode.Direction.VERTICAL,
                List.of(children));
    }

    /**
     * A required field, a "Show advanced" toggle, and a collapsed section referencing the toggle
     * that holds the primary Submit button.
     */
    public static StackNode primaryHiddenScenario() {
        return stack(
                "root",
                requiredField("email", "Email address"),
                button("toggle", "Show advanced"),
                collapsible("advanced", "toggle", primary("submit", "Submit")));
    }

    /** A collapsed section with no controlsId and no toggle anywhere near it. */
    public static StackNode missingControlScenario() {
        return stack(
                "root",
                text("intro", "Account settings"),
                collapsible("advanced", primary("submit", "Submit")));
    }

    /** A collapsed section whose controlsId points at nothing, with no label source. */
    public static StackNode danglingControlScenario() {
        return stack(
                "root",
                field("name", "Full name"),
                collapsible("advanced", "missing-toggle", field("nickname", "Nickname")));
    }

    /** A well-formed three-step wizard. */
    public static StackNode threeStepWizard() {
        return wizard(
                "wizard",
                3,
                step(
                        "step-1",
                        1,
                        null,
                        text("step-1-title", "Your details"),
                        field("name", "Full name"),
                        row("step-1-actions", primary("next-1", "Next"))),
                step(
                        "step-2",
                        2,
                        null,
                        text("step-2-title", "Address"),
                        field("street", "Street address"),
                        row("step-2-actions", button("back-2", "Back"), primary("next-2", "Next"))),
                step(
                        "step-3",
                        3,
                        null,
                        text("step-3-title", "Review"),
                        row(
                                "step-3-actions",
                                button("back-3", "Back"),
                                primary("finish", "Finish"))));
    }
}
