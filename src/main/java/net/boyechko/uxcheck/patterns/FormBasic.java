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
import java.util.Locale;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.issue.IssueSev;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.FormNode;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.Rule;

/** Rules for single-page forms: labelled fields, an action row after the fields, error state. */
public final class FormBasic {
    public static final String NAME = "Form.Basic";

    private static final IssueSource TEXT_INPUT =
            new IssueSource(
                    NAME,
                    "GOV.UK Design System",
                    "https://design-system.service.gov.uk/components/text-input/");
    private static final IssueSource QUESTION_PAGES =
            new IssueSource(
                    NAME,
                    "GOV.UK Design System",
                    "https://design-system.service.gov.uk/patterns/question-pages/");
    private static final IssueSource ERROR_MESSAGE =
            new IssueSource(
                    NAME,
                    "GOV.UK Design System",
                    "https://design-system.service.gov.uk/components/error-message/");

    private static final int SHORT_LABEL_LENGTH = 5;
    private static final List<String> TECHNICAL_TERMS =
            List.of("id", "uuid", "api", "url", "uri", "ssn", "ein");

    private FormBasic() {}

    public static Pattern pattern(IssueSource source) {
        return new Pattern(
                NAME,
                source,
                List.of(
                        Rule.must(
                                "field-has-label",
                                "Every Field.label must be non-empty",
                                FormBasic::checkFieldHasLabel),
                        Rule.must(
                                "actions-exist",
                                "Form.actions.length must be at least 1",
                                FormBasic::checkActionsExist),
                        Rule.must(
                                "actions-after-fields",
                                "Actions must appear after all fields in the same Form",
                                FormBasic::checkActionsAfterFields),
                        Rule.must(
                                "has-error-state",
                                "If any Field.errorText exists, Form.states must include"
                                        + " \"error\"",
                                FormBasic::checkHasErrorState)),
                List.of(
                        Rule.should(
                                "help-text",
                                "Provide helpText for ambiguous labels",
                                FormBasic::checkHelpText)));
    }

    static IssueList checkFieldHasLabel(Node root) {
        IssueList issues = new IssueList();
        for (Node node : NodeTree.preOrder(root)) {
            if (node instanceof FieldNode field
                    && (field.label() == null || field.label().isBlank())) {
                issues.add(
                        issue(
                                "field-has-label",
                                IssueSev.ERROR,
                                "Field \"" + field.id() + "\" has empty or missing label",
                                field.id(),
                                TEXT_INPUT));
            }
        }
        return issues;
    }

    static IssueList checkActionsExist(Node root) {
        IssueList issues = new IssueList();
        for (Node node : NodeTree.preOrder(root)) {
            if (node instanceof FormNode form && form.actions().isEmpty()) {
                issues.add(
                        issue(
                                "actions-exist",
                                IssueSev.ERROR,
                                "Form \"" + form.id() + "\" has no action buttons",
                                form.id(),
                                QUESTION_PAGES));
            }
        }
        return issues;
    }

    static IssueList checkActionsAfterFields(Node root) {
        IssueList issues = new IssueList();
        for (Node node : NodeTree.preOrder(root)) {
            if (!(node instanceof FormNode form)) {
                continue;
            }
            List<Node> formNodes = NodeTree.preOrder(form);
            int lastField = -1;
            int firstAction = -1;
            for (int i = 0; i < formNodes.size(); i++) {
                Node n = formNodes.get(i);
                if (n instanceof FieldNode) {
                    lastField = i;
                }
                if (firstAction < 0 && isAction(form, n)) {
                    firstAction = i;
                }
            }
            if (firstAction >= 0 && lastField > firstAction) {
                issues.add(
                        issue(
                                "actions-after-fields",
                                IssueSev.ERROR,
                                "Form \"" + form.id() + "\" has fields appearing after action"
                                        + " buttons",
                                form.id(),
                                QUESTION_PAGES));
            }
        }
        return issues;
    }

    static IssueList checkHasErrorState(Node root) {
        IssueList issues = new IssueList();
        for (Node node : NodeTree.preOrder(root)) {
            if (!(node instanceof FormNode form)) {
                continue;
            }
            boolean anyError = form.fields().stream().anyMatch(FieldNode::hasErrorText);
            if (anyError && !form.hasState("error")) {
                issues.add(
                        issue(
                                "has-error-state",
                                IssueSev.ERROR,
                                "Form \""
                                        + form.id()
                                        + "\" has fields with errorText but states does not"
                                        + " include \"error\"",
                                form.id(),
                                ERROR_MESSAGE));
            }
        }
        return issues;
    }

    static IssueList checkHelpText(Node root) {
        IssueList issues = new IssueList();
        for (Node node : NodeTree.preOrder(root)) {
            if (!(node instanceof FieldNode field)) {
                continue;
            }
            String label = field.label() != null ? field.label() : "";
            if (isAmbiguous(label) && (field.helpText() == null || field.helpText().isEmpty())) {
                issues.add(
                        issue(
                                "help-text",
                                IssueSev.WARN,
                                "Field \""
                                        + field.id()
                                        + "\" with label \""
                                        + label
                                        + "\" should have helpText for clarity",
                                field.id(),
                                TEXT_INPUT));
            }
        }
        return issues;
    }

    private static boolean isAmbiguous(String label) {
        if (label.length() <= SHORT_LABEL_LENGTH) {
            return true;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        return TECHNICAL_TERMS.stream().anyMatch(lower::contains);
    }

    private static boolean isAction(FormNode form, Node n) {
        return form.actions().stream().anyMatch(a -> a.id().equals(n.id()));
    }

    private static Issue issue(
            String ruleId, IssueSev severity, String message, String nodeId, IssueSource source) {
        return Issue.builder(ruleId, severity, message)
                .nodeId(nodeId)
                .source(source)
                .suggestion(RemediationSuggestions.getSuggestion(ruleId, nodeId))
                .build();
    }
}
