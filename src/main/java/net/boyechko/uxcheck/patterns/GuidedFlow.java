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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.GuidedFlowBehavior;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.node.TextNode;
import net.boyechko.uxcheck.patterns.GuidedFlowScopes.ButtonKind;
import net.boyechko.uxcheck.patterns.GuidedFlowScopes.Scope;
import net.boyechko.uxcheck.patterns.GuidedFlowScopes.Step;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.Rule;

/**
 * Rules for multi-step wizards: contiguous steps, Back/Next/Finish navigation in the right places,
 * fields above the action row, a single primary action, and a visible progress indicator.
 */
public final class GuidedFlow {
    public static final String NAME = "Guided.Flow";

    private static final IssueSource NNG_WIZARDS =
            new IssueSource(
                    NAME,
                    "Nielsen Norman Group — Wizards",
                    "https://www.nngroup.com/articles/wizard-design/");

    private static final java.util.regex.Pattern STEP_OF_TOTAL =
            java.util.regex.Pattern.compile(
                    "step\\s+\\d+\\s+of\\s+\\d+", java.util.regex.Pattern.CASE_INSENSITIVE);
    private static final String PROGRESS_AFFORDANCE = "progress-indicator";
    private static final int PROGRESS_SEARCH_DEPTH = 6;

    private GuidedFlow() {}

    public static Pattern pattern(IssueSource source) {
        return new Pattern(
                NAME,
                source,
                List.of(
                        Rule.must(
                                "wizard-steps-missing",
                                "Steps must form a contiguous 1..N sequence",
                                GuidedFlow::checkStepsContiguous),
                        Rule.must(
                                "wizard-next-missing",
                                "Each step before the last must have a Next action",
                                GuidedFlow::checkNextPresent),
                        Rule.must(
                                "wizard-finish-missing",
                                "Last step must provide a finish/submit action",
                                GuidedFlow::checkFinishPresent),
                        Rule.must(
                                "wizard-back-illegal",
                                "Back action must not appear on the first step",
                                GuidedFlow::checkNoBackOnFirstStep),
                        Rule.must(
                                "wizard-back-missing",
                                "Intermediate steps must include a Back action",
                                GuidedFlow::checkBackPresent),
                        Rule.must(
                                "wizard-field-after-actions",
                                "Fields must appear before the actions row in a step",
                                GuidedFlow::checkFieldsBeforeActions),
                        Rule.must(
                                "wizard-multiple-primary",
                                "Only one primary action per step",
                                GuidedFlow::checkSinglePrimary)),
                List.of(
                        Rule.should(
                                "wizard-progress-missing",
                                "Progress indicator should exist when hasProgress is set",
                                GuidedFlow::checkProgress),
                        Rule.should(
                                "wizard-actions-order",
                                "Back should precede Next/Finish in the action row",
                                GuidedFlow::checkActionsOrder),
                        Rule.should(
                                "wizard-step-title-missing",
                                "Each step should expose a visible title",
                                GuidedFlow::checkStepTitle)));
    }

    static IssueList checkStepsContiguous(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            if (scope.steps().isEmpty()) {
                continue;
            }
            List<Integer> expected =
                    IntStream.rangeClosed(1, scope.totalSteps()).boxed().toList();
            List<Integer> found = scope.indices();
            boolean unique = new LinkedHashSet<>(found).size() == found.size();
            boolean contiguous = found.size() == expected.size() && found.containsAll(expected);
            if (!unique || !contiguous) {
                Node at =
                        scope.container() != null
                                ? scope.container()
                                : scope.steps().get(0).node();
                issues.add(
                        issue(
                                        "wizard-steps-missing",
                                        IssueSev.ERROR,
                                        at,
                                        "Step indices must be unique & contiguous 1..N")
                                .detail("expectedRange", expected)
                                .detail("foundIndices", found)
                                .detail("totalSteps", scope.totalSteps())
                                .detail("scopeNodeId", idOf(scope.container()))
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkNextPresent(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                if (!scope.isLast(step) && !step.has(ButtonKind.NEXT)) {
                    issues.add(
                            navigationIssue(
                                    "wizard-next-missing",
                                    scope,
                                    step,
                                    "Step " + step.index() + " missing Next action"));
                }
            }
        }
        return issues;
    }

    static IssueList checkFinishPresent(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                if (scope.isLast(step) && !step.has(ButtonKind.FINISH)) {
                    issues.add(
                            navigationIssue(
                                    "wizard-finish-missing",
                                    scope,
                                    step,
                                    "Last step " + step.index() + " missing Finish action"));
                }
            }
        }
        return issues;
    }

    static IssueList checkNoBackOnFirstStep(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            Optional<Step> first = scope.steps().stream().filter(s -> s.index() == 1).findFirst();
            if (first.isPresent() && first.get().has(ButtonKind.BACK)) {
                issues.add(
                        issue(
                                        "wizard-back-illegal",
                                        IssueSev.ERROR,
                                        first.get().node(),
                                        "Back button not allowed on first step")
                                .detail("stepIndex", 1)
                                .detail("actionsRowNodeId", first.get().actionsRowId())
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkBackPresent(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                boolean intermediate = step.index() > 1 && step.index() < scope.totalSteps();
                if (intermediate && !step.has(ButtonKind.BACK)) {
                    issues.add(
                            navigationIssue(
                                    "wizard-back-missing",
                                    scope,
                                    step,
                                    "Step " + step.index() + " missing Back action"));
                }
            }
        }
        return issues;
    }

    static IssueList checkFieldsBeforeActions(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                if (step.actionsRow() == null) {
                    continue;
                }
                List<Node> subtree = NodeTree.preOrder(step.node(), false);
                int rowIndex = indexOf(subtree, step.actionsRow());
                List<String> misplaced = new ArrayList<>();
                for (int i = rowIndex + 1; i < subtree.size(); i++) {
                    if (subtree.get(i) instanceof FieldNode field) {
                        misplaced.add(field.id());
                    }
                }
                if (!misplaced.isEmpty()) {
                    issues.add(
                            issue(
                                            "wizard-field-after-actions",
                                            IssueSev.ERROR,
                                            step.node(),
                                            "Fields appear after actions row in step "
                                                    + step.index())
                                    .detail("stepIndex", step.index())
                                    .detail("actionsRowId", step.actionsRowId())
                                    .detail("misplacedFieldIds", misplaced)
                                    .build());
                }
            }
        }
        return issues;
    }

    static IssueList checkSinglePrimary(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                List<String> primaries =
                        step.buttons().stream()
                                .filter(ButtonNode::isPrimary)
                                .map(ButtonNode::id)
                                .toList();
                if (primaries.size() > 1) {
                    issues.add(
                            issue(
                                            "wizard-multiple-primary",
                                            IssueSev.ERROR,
                                            step.node(),
                                            "Multiple primary actions in step " + step.index())
                                    .detail("stepIndex", step.index())
                                    .detail("primaryButtonIds", primaries)
                                    .build());
                }
            }
        }
        return issues;
    }

    static IssueList checkProgress(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            Optional<GuidedFlowBehavior> wizard = scope.wizard();
            if (wizard.isEmpty() || !wizard.get().hasProgress()) {
                continue;
            }
            if (findProgressNode(root, scope.container(), wizard.get()).isEmpty()) {
                issues.add(
                        issue(
                                        "wizard-progress-missing",
                                        IssueSev.WARN,
                                        scope.container(),
                                        "Progress indicator missing for wizard")
                                .detail("scopeNodeId", scope.container().id())
                                .detail("hasProgress", true)
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkActionsOrder(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                List<ButtonKind> order = step.kinds();
                int back = order.indexOf(ButtonKind.BACK);
                int finish = order.indexOf(ButtonKind.FINISH);
                int forward = finish >= 0 ? finish : order.indexOf(ButtonKind.NEXT);
                if (back >= 0 && forward >= 0 && back > forward) {
                    issues.add(
                            issue(
                                            "wizard-actions-order",
                                            IssueSev.WARN,
                                            step.node(),
                                            "Back action appears after Next/Finish in step "
                                                    + step.index())
                                    .detail("stepIndex", step.index())
                                    .detail("order", order.stream().map(Enum::name).toList())
                                    .build());
                }
            }
        }
        return issues;
    }

    static IssueList checkStepTitle(Node root) {
        IssueList issues = new IssueList();
        for (Scope scope : GuidedFlowScopes.resolve(root)) {
            for (Step step : scope.steps()) {
                if (!hasTitleBeforeActions(step)) {
                    issues.add(
                            issue(
                                            "wizard-step-title-missing",
                                            IssueSev.WARN,
                                            step.node(),
                                            "Step " + step.index() + " missing title/heading")
                                    .detail("stepIndex", step.index())
                                    .build());
                }
            }
        }
        return issues;
    }

    private static boolean hasTitleBeforeActions(Step step) {
        for (Node n : NodeTree.preOrder(step.node(), false)) {
            if (n == step.actionsRow()) {
                return false;
            }
            if (n instanceof TextNode) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Node> findProgressNode(
            Node root, Node container, GuidedFlowBehavior wizard) {
        String progressId = wizard.progressNodeId();
        if (progressId != null) {
            return NodeTree.preOrder(root, false).stream()
                    .filter(n -> n.visible() && progressId.equals(n.id()))
                    .findFirst();
        }
        List<Node> top = NodeTree.preOrder(container, false);
        top = top.subList(0, Math.min(PROGRESS_SEARCH_DEPTH, top.size()));
        for (Node n : top) {
            if (n instanceof TextNode text
                    && text.text() != null
                    && STEP_OF_TOTAL.matcher(text.text()).find()) {
                return Optional.of(n);
            }
        }
        return top.stream().filter(n -> n.affordances().contains(PROGRESS_AFFORDANCE)).findFirst();
    }

    private static Issue navigationIssue(String ruleId, Scope scope, Step step, String message) {
        return issue(ruleId, IssueSev.ERROR, step.node(), message)
                .detail("stepIndex", step.index())
                .detail("totalSteps", scope.totalSteps())
                .detail("actionsRowNodeId", step.actionsRowId())
                .build();
    }

    private static Issue.Builder issue(String ruleId, IssueSev severity, Node at, String message) {
        return Issue.builder(ruleId, severity, message)
                .nodeId(idOf(at))
                .source(NNG_WIZARDS)
                .suggestion(RemediationSuggestions.getSuggestion(ruleId, idOf(at)));
    }

    private static int indexOf(List<Node> nodes, Node target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    private static String idOf(Node n) {
        return n != null ? n.id() : null;
    }
}
