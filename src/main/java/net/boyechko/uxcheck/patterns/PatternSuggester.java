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
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.FormNode;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.node.TableNode;
import net.boyechko.uxcheck.patterns.PatternSuggestion.Confidence;

/**
 * Guesses which patterns apply to a tree from its structure alone. All nodes are considered,
 * hidden ones included, since a hidden section still shapes the design.
 */
public final class PatternSuggester {
    /** Scores at or above this are {@link Confidence#HIGH}. */
    public static final int HIGH_CONFIDENCE_THRESHOLD = 80;

    /** Scores at or above this and below the high threshold are {@link Confidence#MEDIUM}. */
    public static final int MEDIUM_CONFIDENCE_THRESHOLD = 50;

    static final int FORM_SCORE = 95;
    static final int TABLE_SCORE = 90;
    static final int TABLE_WITHOUT_COLUMNS_SCORE = 60;
    static final int DISCLOSURE_SCORE = 92;
    static final int FLOW_STRONG_SCORE = 88;
    static final int FLOW_SCORE = 70;
    static final int FLOW_SINGLE_HINT_SCORE = 40;

    private static final List<String> NAVIGATION_WORDS =
            List.of("next", "previous", "prev", "back");
    private static final Pattern STEP_NUMBER =
            Pattern.compile("step\\s*\\d+", Pattern.CASE_INSENSITIVE);
    private static final int MAX_REASON_INDICATORS = 5;

    private PatternSuggester() {}

    public static List<PatternSuggestion> suggestPatterns(Node root) {
        boolean hasForm = false;
        int formFields = 0;
        int formActions = 0;
        boolean hasTable = false;
        int tableColumns = 0;
        String tableStrategy = null;
        boolean hasDisclosure = false;
        List<String> flowIndicators = new ArrayList<>();

        for (Node n : NodeTree.preOrder(root, false)) {
            if (n instanceof FormNode form) {
                hasForm = true;
                formFields += form.fields().size();
                formActions += form.actions().size();
            } else if (n instanceof TableNode table) {
                hasTable = true;
                tableColumns += table.columns().size();
                tableStrategy = table.responsiveStrategy();
            } else if (n.isCollapsible()) {
                hasDisclosure = true;
            } else if (n instanceof ButtonNode button) {
                String text = button.text() != null ? button.text().toLowerCase(Locale.ROOT) : "";
                if (isNavigationText(text)) {
                    flowIndicators.add(text);
                }
            } else if (n.guidedFlow().isPresent()) {
                flowIndicators.add(n.id());
            }
        }

        List<PatternSuggestion> suggestions = new ArrayList<>();
        if (hasForm) {
            suggestions.add(
                    new PatternSuggestion(
                            FormBasic.NAME,
                            Confidence.HIGH,
                            FORM_SCORE,
                            "Detected Form node with "
                                    + formFields
                                    + " field(s) and "
                                    + formActions
                                    + " action(s)"));
        }
        if (hasTable) {
            int score = tableColumns > 0 ? TABLE_SCORE : TABLE_WITHOUT_COLUMNS_SCORE;
            suggestions.add(
                    new PatternSuggestion(
                            TableSimple.NAME,
                            bandOf(score),
                            score,
                            "Detected Table node ("
                                    + tableColumns
                                    + " columns, responsive.strategy="
                                    + (tableStrategy != null ? tableStrategy : "none")
                                    + ")"));
        }
        if (hasDisclosure) {
            suggestions.add(
                    new PatternSuggestion(
                            ProgressiveDisclosure.NAME,
                            Confidence.HIGH,
                            DISCLOSURE_SCORE,
                            "Found collapsible disclosure behavior on one or more nodes"));
        }
        if (flowIndicators.size() >= 2) {
            int score = flowIndicators.size() > 3 ? FLOW_STRONG_SCORE : FLOW_SCORE;
            int shown = Math.min(MAX_REASON_INDICATORS, flowIndicators.size());
            suggestions.add(
                    new PatternSuggestion(
                            GuidedFlow.NAME,
                            bandOf(score),
                            score,
                            "Found multi-step indicators ("
                                    + String.join(", ", flowIndicators.subList(0, shown))
                                    + ") suggesting a wizard flow"));
        } else if (flowIndicators.size() == 1) {
            suggestions.add(
                    new PatternSuggestion(
                            GuidedFlow.NAME,
                            Confidence.LOW,
                            FLOW_SINGLE_HINT_SCORE,
                            "Single guided-flow hint (" + flowIndicators.get(0) + ") detected"));
        }
        return suggestions;
    }

    /** Returns true if any node, hidden or not, is a collapsible section. */
    public static boolean hasDisclosureHints(Node root) {
        return NodeTree.preOrder(root, false).stream().anyMatch(Node::isCollapsible);
    }

    /** Returns true if any node, hidden or not, is a wizard container or a wizard step. */
    public static boolean hasGuidedFlowHints(Node root) {
        return NodeTree.preOrder(root, false).stream()
                .anyMatch(n -> n.guidedFlow().map(f -> f.role() != null).orElse(false));
    }

    static Confidence bandOf(int score) {
        if (score >= HIGH_CONFIDENCE_THRESHOLD) {
            return Confidence.HIGH;
        }
        return score >= MEDIUM_CONFIDENCE_THRESHOLD ? Confidence.MEDIUM : Confidence.LOW;
    }

    private static boolean isNavigationText(String text) {
        return NAVIGATION_WORDS.stream().anyMatch(text::contains)
                || STEP_NUMBER.matcher(text).find();
    }
}
