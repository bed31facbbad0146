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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.FormNode;
import net.boyechko.uxcheck.node.GuidedFlowBehavior;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.node.StackNode;

/**
 * Groups wizard steps into scopes and finds each step's action row.
 *
 * <p>Every wizard container forms a scope over the steps in its subtree. Steps that belong to no
 * wizard form one extra global scope, which also exists (empty) when the tree has no wizard at
 * all.
 */
public final class GuidedFlowScopes {

    /** What a wizard button does, judged from its whole text. */
    public enum ButtonKind {
        BACK,
        NEXT,
        FINISH,
        OTHER
    }

    /**
     * @param node the step node
     * @param index 1-based step index
     * @param actionsRow the detected action row, or null when the step has none
     * @param buttons buttons of the action row in order
     */
    public record Step(Node node, int index, Node actionsRow, List<ButtonNode> buttons) {
        public Step {
            buttons = List.copyOf(buttons);
        }

        public List<ButtonKind> kinds() {
            return buttons.stream().map(GuidedFlowScopes::classify).toList();
        }

        public boolean has(ButtonKind kind) {
            return kinds().contains(kind);
        }

        public String actionsRowId() {
            return actionsRow != null ? actionsRow.id() : null;
        }
    }

    /**
     * @param container the wizard node, or null for the global scope
     * @param steps visible steps sorted by index
     * @param totalSteps the declared or derived number of steps
     */
    public record Scope(Node container, List<Step> steps, int totalSteps) {
        public Scope {
            steps = List.copyOf(steps);
        }

        public List<Integer> indices() {
            return steps.stream().map(Step::index).toList();
        }

        public boolean isLast(Step step) {
            return totalSteps > 0 && step.index() == totalSteps;
        }

        public Optional<GuidedFlowBehavior> wizard() {
            return container != null ? container.guidedFlow() : Optional.empty();
        }
    }

    private GuidedFlowScopes() {}

    public static List<Scope> resolve(Node root) {
        List<Node> all = NodeTree.preOrder(root, false);
        List<Node> wizards = all.stream().filter(GuidedFlowScopes::isWizard).toList();

        List<Node> strays = new ArrayList<>();
        for (Node n : all) {
            if (isStep(n) && wizards.stream().noneMatch(w -> NodeTree.contains(w, n))) {
                strays.add(n);
            }
        }

        List<Scope> scopes = new ArrayList<>();
        for (Node wizard : wizards) {
            List<Node> candidates =
                    NodeTree.preOrder(wizard, false).stream()
                            .filter(GuidedFlowScopes::isStep)
                            .toList();
            scopes.add(scopeOf(wizard, candidates));
        }
        if (wizards.isEmpty() || !strays.isEmpty()) {
            scopes.add(scopeOf(null, strays));
        }
        return scopes;
    }

    private static Scope scopeOf(Node container, List<Node> candidates) {
        List<Step> steps = new ArrayList<>();
        Integer declaredTotal = null;
        if (container != null) {
            declaredTotal = positive(container.guidedFlow().get().totalSteps());
        }
        for (Node candidate : candidates) {
            if (!candidate.visible()) {
                continue;
            }
            GuidedFlowBehavior flow = candidate.guidedFlow().get();
            if (flow.stepIndex() == null || flow.stepIndex() < 1) {
                continue;
            }
            if (declaredTotal == null) {
                declaredTotal = positive(flow.totalSteps());
            }
            Node row = detectActionsRow(candidate);
            steps.add(new Step(candidate, flow.stepIndex(), row, buttonsOf(candidate, row)));
        }

        int total =
                declaredTotal != null
                        ? declaredTotal
                        : steps.stream().mapToInt(Step::index).max().orElse(0);
        steps.sort(Comparator.comparingInt(Step::index));
        return new Scope(container, steps, total);
    }

    /**
     * Finds the row holding a step's navigation buttons. A Form step uses its own actions;
     * otherwise the last horizontal Stack made only of Buttons wins, then the last Stack whose
     * children are all leaves and include a Button.
     */
    static Node detectActionsRow(Node step) {
        if (step instanceof FormNode) {
            return step;
        }
        List<StackNode> stacks =
                NodeTree.preOrder(step, false).stream()
                        .filter(StackNode.class::isInstance)
                        .map(StackNode.class::cast)
                        .toList();

        StackNode chosen = null;
        for (StackNode stack : stacks) {
            if (stack.isHorizontal() && allButtons(stack.children())) {
                chosen = stack;
            }
        }
        if (chosen != null) {
            return chosen;
        }
        for (StackNode stack : stacks) {
            List<Node> kids = stack.children();
            boolean leavesOnly = kids.stream().noneMatch(k -> k.type().isContainer());
            boolean hasButton = kids.stream().anyMatch(ButtonNode.class::isInstance);
            if (leavesOnly && hasButton) {
                chosen = stack;
            }
        }
        return chosen;
    }

    public static ButtonKind classify(ButtonNode button) {
        String text = button.text() != null ? button.text().toLowerCase(Locale.ROOT) : "";
        return switch (text) {
            case "back", "previous" -> ButtonKind.BACK;
            case "next", "continue" -> ButtonKind.NEXT;
            case "finish", "submit", "done" -> ButtonKind.FINISH;
            default -> ButtonKind.OTHER;
        };
    }

    private static List<ButtonNode> buttonsOf(Node step, Node row) {
        if (row == null) {
            return List.of();
        }
        if (row == step && step instanceof FormNode form) {
            return form.actions();
        }
        return row.children().stream()
                .filter(ButtonNode.class::isInstance)
                .map(ButtonNode.class::cast)
                .toList();
    }

    private static boolean allButtons(List<Node> nodes) {
        return !nodes.isEmpty() && nodes.stream().allMatch(ButtonNode.class::isInstance);
    }

    private static boolean isWizard(Node n) {
        return n.guidedFlow().map(GuidedFlowBehavior::isWizard).orElse(false);
    }

    private static boolean isStep(Node n) {
        return n.guidedFlow().map(GuidedFlowBehavior::isStep).orElse(false);
    }

    private static Integer positive(Integer value) {
        return value != null && value > 0 ? value : null;
    }
}
