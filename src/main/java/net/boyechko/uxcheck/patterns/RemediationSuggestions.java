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

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Deterministic remediation text keyed by rule id.
 *
 * <p>Output depends only on the arguments, so repeated calls return identical strings.
 */
public final class RemediationSuggestions {
    private static final String DEFAULT_SECTION_ID = "advanced";
    private static final String DEFAULT_LABEL_ID = "section";

    private static final Map<String, Function<String, String>> TEMPLATES =
            Map.ofEntries(
                    // Progressive.Disclosure
                    Map.entry(
                            "disclosure-no-control",
                            nodeId -> {
                                String id = nodeId != null ? nodeId : DEFAULT_SECTION_ID;
                                return "Add a control Button near the section and reference it:\n"
                                        + "\"behaviors\": { \"disclosure\": {"
                                        + " \"collapsible\": true, \"controlsId\": \"toggle-"
                                        + id
                                        + "\", \"defaultState\": \"collapsed\" } }\n"
                                        + "...and define the control:\n"
                                        + "{ \"id\": \"toggle-"
                                        + id
                                        + "\", \"type\": \"Button\", \"text\": \"Show details\" }";
                            }),
                    Map.entry(
                            "disclosure-hides-primary",
                            nodeId ->
                                    "Move the primary action outside the collapsible section OR"
                                            + " set:\n"
                                            + "\"behaviors\": { \"disclosure\": { \"defaultState\":"
                                            + " \"expanded\" } }"),
                    Map.entry(
                            "disclosure-missing-label",
                            nodeId -> {
                                String id = nodeId != null ? nodeId : DEFAULT_LABEL_ID;
                                return "Add a sibling Text label before the section:\n"
                                        + "{ \"type\":\"Text\", \"id\":\""
                                        + id
                                        + "-label\", \"text\":\"Section title\" }";
                            }),
                    Map.entry(
                            "disclosure-control-far",
                            nodeId ->
                                    "Place the control as a preceding sibling or within a header"
                                            + " row next to the section."),
                    Map.entry(
                            "disclosure-inconsistent-affordance",
                            nodeId ->
                                    "Align affordances across collapsible sections, e.g."
                                            + " \"affordances\":[\"chevron\"]."),
                    Map.entry(
                            "disclosure-early-section",
                            nodeId ->
                                    "Move collapsible sections after required fields and before"
                                            + " the action row."),
                    // Form.Basic
                    Map.entry(
                            "field-has-label",
                            nodeId ->
                                    "Give the field a visible label, e.g. { \"id\":\""
                                            + (nodeId != null ? nodeId : "field")
                                            + "\", \"type\":\"Field\", \"label\":\"Email address\""
                                            + " }"),
                    Map.entry(
                            "actions-exist",
                            nodeId ->
                                    "Add a submit action to the form: { \"type\":\"Button\","
                                            + " \"text\":\"Continue\", \"roleHint\":\"primary\" }"),
                    Map.entry(
                            "actions-after-fields",
                            nodeId -> "Move every Field above the form's action buttons."),
                    Map.entry(
                            "has-error-state",
                            nodeId ->
                                    "Add \"error\" to the form's states, e.g. \"states\":"
                                            + " [\"default\", \"error\"]"),
                    Map.entry(
                            "help-text",
                            nodeId ->
                                    "Add helpText that explains the expected input, e.g."
                                            + " \"helpText\": \"The 12-digit number on your"
                                            + " card\""),
                    // Table.Simple
                    Map.entry(
                            "title-exists",
                            nodeId -> "Give the table a short descriptive \"title\"."),
                    Map.entry(
                            "responsive-strategy",
                            nodeId ->
                                    "Declare how the table adapts to narrow screens:"
                                            + " \"responsive\": { \"strategy\": \"scroll\" }"
                                            + " (wrap, scroll or cards)"),
                    Map.entry(
                            "min-width-fit-or-scroll",
                            nodeId ->
                                    "Use the \"scroll\" or \"cards\" responsive strategy so the"
                                            + " table cannot overflow small viewports."),
                    Map.entry(
                            "controls-adjacent",
                            nodeId ->
                                    "Place filters and table controls directly above or below"
                                            + " the table."),
                    // Guided.Flow
                    Map.entry(
                            "wizard-steps-missing",
                            nodeId ->
                                    "Define contiguous stepIndex values 1..N. Example:"
                                            + " {\"behaviors\":{\"guidedFlow\":{\"role\":\"step\","
                                            + "\"stepIndex\":2,\"totalSteps\":4}}}"),
                    Map.entry(
                            "wizard-next-missing",
                            nodeId ->
                                    "Add a Next button: {\"id\":\"next-<i>\",\"type\":\"Button\","
                                            + "\"text\":\"Next\",\"roleHint\":\"primary\"}"),
                    Map.entry(
                            "wizard-back-missing",
                            nodeId ->
                                    "Add a Back button before Next: {\"id\":\"back-<i>\","
                                            + "\"type\":\"Button\",\"text\":\"Back\"}"),
                    Map.entry(
                            "wizard-back-illegal",
                            nodeId -> "Remove Back from the first step or move it to step 2."),
                    Map.entry(
                            "wizard-finish-missing",
                            nodeId ->
                                    "Add a Finish action: {\"id\":\"finish\",\"type\":\"Button\","
                                            + "\"text\":\"Finish\",\"roleHint\":\"primary\"}"),
                    Map.entry(
                            "wizard-field-after-actions",
                            nodeId ->
                                    "Ensure fields appear before the actions row. Move the"
                                            + " actions Stack below all Field nodes."),
                    Map.entry(
                            "wizard-multiple-primary",
                            nodeId ->
                                    "Keep only one primary action per step; remove roleHint or"
                                            + " demote extras."),
                    Map.entry(
                            "wizard-progress-missing",
                            nodeId ->
                                    "Add a visible progress indicator: {\"id\":\"progress-1\","
                                            + "\"type\":\"Text\",\"text\":\"Step 1 of 4\"} and"
                                            + " reference it via"
                                            + " behaviors.guidedFlow.progressNodeId."),
                    Map.entry(
                            "wizard-actions-order",
                            nodeId ->
                                    "Order actions as Back then Next/Finish inside the actions"
                                            + " row."),
                    Map.entry(
                            "wizard-step-title-missing",
                            nodeId ->
                                    "Add a heading Text near the top of each step:"
                                            + " {\"id\":\"step-<i>-title\",\"type\":\"Text\","
                                            + "\"text\":\"Step <i>: Details\"}"));

    private RemediationSuggestions() {}

    /**
     * Returns the remediation text for an issue.
     *
     * @param issueId rule id of the issue
     * @param nodeId offending node, used by templates that name new nodes; may be null
     * @return the text, or empty for rule ids without a template
     */
    public static Optional<String> getSuggestion(String issueId, String nodeId) {
        Function<String, String> template = issueId != null ? TEMPLATES.get(issueId) : null;
        return template != null ? Optional.of(template.apply(nodeId)) : Optional.empty();
    }

    public static Optional<String> getSuggestion(String issueId) {
        return getSuggestion(issueId, null);
    }

    public static Set<String> knownIssueIds() {
        return TEMPLATES.keySet();
    }
}
