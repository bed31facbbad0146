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

import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.appearsBefore;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.calculateSiblingDistance;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.extractAffordanceTokens;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.findCollapsibles;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.findFirstRequiredField;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.hasLabel;
import static net.boyechko.uxcheck.patterns.disclosure.DisclosurePredicates.hasPrimaryHidden;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.SiblingMap;
import net.boyechko.uxcheck.patterns.disclosure.DisclosureInference;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.Rule;

/**
 * Rules for collapsible sections: every section needs a control and a label, must not hide the
 * primary action, and should sit next to its control, share affordances with its neighbours and
 * follow the required fields.
 */
public final class ProgressiveDisclosure {
    public static final String NAME = "Progressive.Disclosure";

    static final IssueSource NNG =
            new IssueSource(
                    NAME,
                    "Nielsen Norman Group — Progressive Disclosure",
                    "https://www.nngroup.com/articles/progressive-disclosure/");
    static final IssueSource GOV_UK_DETAILS =
            new IssueSource(
                    NAME,
                    "GOV.UK Design System — Details",
                    "https://design-system.service.gov.uk/components/details/");
    static final IssueSource USWDS_ACCORDION =
            new IssueSource(
                    NAME,
                    "USWDS — Accordion",
                    "https://designsystem.digital.gov/components/accordion/");

    private ProgressiveDisclosure() {}

    /** Builds the pattern, attributing it as a whole to {@code source}. */
    public static Pattern pattern(IssueSource source) {
        return new Pattern(
                NAME,
                source,
                List.of(
                        Rule.must(
                                "disclosure-no-control",
                                "Collapsible section must have an associated control",
                                ProgressiveDisclosure::checkNoControl),
                        Rule.must(
                                "disclosure-hides-primary",
                                "Primary action must not be hidden by default in collapsed"
                                        + " section",
                                ProgressiveDisclosure::checkHidesPrimary),
                        Rule.must(
                                "disclosure-missing-label",
                                "Collapsible section must have a visible label or summary",
                                ProgressiveDisclosure::checkMissingLabel)),
                List.of(
                        Rule.should(
                                "disclosure-control-far",
                                "Control should be adjacent to collapsible section",
                                ProgressiveDisclosure::checkControlFar),
                        Rule.should(
                                "disclosure-inconsistent-affordance",
                                "Multiple collapsibles should use consistent affordances",
                                ProgressiveDisclosure::checkInconsistentAffordance),
                        Rule.should(
                                "disclosure-early-section",
                                "Collapsible content should follow primary content",
                                ProgressiveDisclosure::checkEarlySection)));
    }

    static IssueList checkNoControl(Node root) {
        IssueList issues = new IssueList();
        SiblingMap siblings = SiblingMap.of(root);
        for (Node node : findCollapsibles(root)) {
            Optional<ButtonNode> control =
                    DisclosureInference.findControl(node, siblings.siblingsOf(node));
            if (control.isEmpty()) {
                issues.add(
                        Issue.builder(
                                        "disclosure-no-control",
                                        IssueSev.ERROR,
                                        "Collapsible section \""
                                                + node.id()
                                                + "\" has no associated control")
                                .nodeId(node.id())
                                .source(NNG)
                                .suggestion(
                                        RemediationSuggestions.getSuggestion(
                                                "disclosure-no-control", node.id()))
                                .detail(
                                        "expected",
                                        "controlsId referencing a Button or nearby Button with"
                                                + " disclosure keywords")
                                .detail("found", node.disclosure().get().controlsId())
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkHidesPrimary(Node root) {
        IssueList issues = new IssueList();
        for (Node node : findCollapsibles(root)) {
            if (hasPrimaryHidden(node)) {
                issues.add(
                        Issue.builder(
                                        "disclosure-hides-primary",
                                        IssueSev.ERROR,
                                        "Primary action is hidden by default within collapsed"
                                                + " section \""
                                                + node.id()
                                                + "\"")
                                .nodeId(node.id())
                                .source(GOV_UK_DETAILS)
                                .suggestion(
                                        RemediationSuggestions.getSuggestion(
                                                "disclosure-hides-primary"))
                                .detail(
                                        "expected",
                                        "Primary action outside collapsed section or"
                                                + " defaultState expanded")
                                .detail("found", "defaultState: collapsed, primary inside section")
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkMissingLabel(Node root) {
        IssueList issues = new IssueList();
        SiblingMap siblingMap = SiblingMap.of(root);
        for (Node node : findCollapsibles(root)) {
            List<Node> siblings = siblingMap.siblingsOf(node);
            ButtonNode control = DisclosureInference.findControl(node, siblings).orElse(null);
            if (!hasLabel(node, siblings, control)) {
                issues.add(
                        Issue.builder(
                                        "disclosure-missing-label",
                                        IssueSev.ERROR,
                                        "Collapsible section \""
                                                + node.id()
                                                + "\" lacks a visible label or summary")
                                .nodeId(node.id())
                                .source(USWDS_ACCORDION)
                                .suggestion(
                                        RemediationSuggestions.getSuggestion(
                                                "disclosure-missing-label", node.id()))
                                .detail(
                                        "expected",
                                        "Sibling Text label, child Text summary, or control"
                                                + " button with meaningful text")
                                .detail("found", null)
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkControlFar(Node root) {
        IssueList issues = new IssueList();
        SiblingMap siblingMap = SiblingMap.of(root);
        for (Node node : findCollapsibles(root)) {
            List<Node> siblings = siblingMap.siblingsOf(node);
            Optional<ButtonNode> control = DisclosureInference.findControl(node, siblings);
            if (control.isEmpty()) {
                continue;
            }
            String controlId = control.get().id();
            int distance = calculateSiblingDistance(controlId, node.id(), siblings);
            if (distance > 1) {
                issues.add(
                        Issue.builder(
                                        "disclosure-control-far",
                                        IssueSev.WARN,
                                        "Control \""
                                                + controlId
                                                + "\" is not adjacent to collapsible section \""
                                                + node.id()
                                                + "\" (distance: "
                                                + distance
                                                + " siblings)")
                                .nodeId(node.id())
                                .source(NNG)
                                .suggestion(
                                        RemediationSuggestions.getSuggestion(
                                                "disclosure-control-far"))
                                .detail(
                                        "expected",
                                        "Control adjacent to collapsible (distance <= 1)")
                                .detail("found", "Control at distance " + distance)
                                .detail("controlId", controlId)
                                .build());
            }
        }
        return issues;
    }

    static IssueList checkInconsistentAffordance(Node root) {
        IssueList issues = new IssueList();
        SiblingMap siblingMap = SiblingMap.of(root);

        // keyed by parent id; the root itself has no parent
        Map<String, List<Node>> byParent = new LinkedHashMap<>();
        for (Node node : findCollapsibles(root)) {
            String parentId = siblingMap.parentOf(node).map(Node::id).orElse(null);
            byParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(node);
        }

        for (List<Node> group : byParent.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<Set<String>> tokenSets = new ArrayList<>();
            for (Node n : group) {
                tokenSets.add(new LinkedHashSet<>(extractAffordanceTokens(n)));
            }
            List<Set<String>> nonEmpty = tokenSets.stream().filter(s -> !s.isEmpty()).toList();
            if (nonEmpty.size() < 2) {
                continue;
            }

            Set<String> common = new LinkedHashSet<>(nonEmpty.get(0));
            for (Set<String> tokens : nonEmpty) {
                common.retainAll(tokens);
            }
            if (!common.isEmpty()) {
                continue;
            }

            List<String> described = new ArrayList<>();
            for (int i = 0; i < group.size(); i++) {
                described.add(
                        "\""
                                + group.get(i).id()
                                + "\": ["
                                + tokenSets.get(i).stream()
                                        .map(t -> "\"" + t + "\"")
                                        .collect(Collectors.joining(", "))
                                + "]");
            }
            String summary = String.join("; ", described);
            issues.add(
                    Issue.builder(
                                    "disclosure-inconsistent-affordance",
                                    IssueSev.WARN,
                                    "Multiple collapsibles use inconsistent affordances: "
                                            + summary)
                            .nodeId(group.get(0).id())
                            .source(GOV_UK_DETAILS)
                            .suggestion(
                                    RemediationSuggestions.getSuggestion(
                                            "disclosure-inconsistent-affordance"))
                            .detail("expected", "Common affordance token across all collapsibles")
                            .detail("found", "No intersection: " + summary)
                            .detail("collapsibleIds", group.stream().map(Node::id).toList())
                            .build());
        }
        return issues;
    }

    static IssueList checkEarlySection(Node root) {
        IssueList issues = new IssueList();
        Optional<FieldNode> firstRequired = findFirstRequiredField(root);
        if (firstRequired.isEmpty()) {
            return issues;
        }
        String fieldId = firstRequired.get().id();
        for (Node node : findCollapsibles(root)) {
            if (!appearsBefore(node.id(), fieldId, root)) {
                continue;
            }
            issues.add(
                    Issue.builder(
                                    "disclosure-early-section",
                                    IssueSev.WARN,
                                    "Collapsible section \""
                                            + node.id()
                                            + "\" appears before the first required field \""
                                            + fieldId
                                            + "\"")
                            .nodeId(node.id())
                            .source(USWDS_ACCORDION)
                            .suggestion(
                                    RemediationSuggestions.getSuggestion(
                                            "disclosure-early-section"))
                            .detail(
                                    "expected",
                                    "Collapsible after primary content (required fields)")
                            .detail(
                                    "found",
                                    "Collapsible \""
                                            + node.id()
                                            + "\" before required field \""
                                            + fieldId
                                            + "\"")
                            .detail("firstRequiredFieldId", fieldId)
                            .build());
        }
        return issues;
    }
}
