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
package net.boyechko.uxcheck.patterns.disclosure;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.DisclosureBehavior;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;

/**
 * Locates the Button that toggles a collapsible section.
 *
 * <p>An explicit {@code controlsId} always wins. Without one, the control is inferred from
 * proximity with a fixed search order:
 *
 * <ol>
 *   <li>preceding siblings, nearest first;
 *   <li>following siblings, nearest first;
 *   <li>the section's own first child (a header row).
 * </ol>
 */
public final class DisclosureInference {

    private static final Pattern CONTROL_KEYWORDS =
            Pattern.compile(
                    "\\b(show|hide|expand|collapse|advanced|details|more)\\b",
                    Pattern.CASE_INSENSITIVE);

    private static final Set<String> CONTROL_AFFORDANCES = Set.of("chevron", "details");

    private DisclosureInference() {}

    /**
     * Finds the control for {@code node} by proximity.
     *
     * @param node the collapsible section
     * @param siblings children of the section's parent in container order, including the section
     * @return the first candidate in search order, or empty
     */
    public static Optional<ButtonNode> findDisclosureControl(Node node, List<Node> siblings) {
        int index = DisclosurePredicates.indexOf(node.id(), siblings);
        if (index < 0) {
            return Optional.empty();
        }

        for (int i = index - 1; i >= 0; i--) {
            if (isControlCandidate(siblings.get(i))) {
                return Optional.of((ButtonNode) siblings.get(i));
            }
        }

        for (int i = index + 1; i < siblings.size(); i++) {
            if (isControlCandidate(siblings.get(i))) {
                return Optional.of((ButtonNode) siblings.get(i));
            }
        }

        List<Node> children = node.children();
        if (!children.isEmpty() && isControlCandidate(children.get(0))) {
            return Optional.of((ButtonNode) children.get(0));
        }

        return Optional.empty();
    }

    /**
     * Finds the control for {@code node}, honoring an explicit {@code controlsId}.
     *
     * <p>When {@code controlsId} is set, the section's own subtree and then each sibling's subtree
     * are searched for a visible Button with that id. If none exists the result is empty; proximity
     * inference is not attempted.
     */
    public static Optional<ButtonNode> findControl(Node node, List<Node> siblings) {
        Optional<DisclosureBehavior> disclosure = node.disclosure();
        if (disclosure.isPresent() && disclosure.get().hasControlsId()) {
            String controlsId = disclosure.get().controlsId();
            Optional<ButtonNode> own = findVisibleButton(node, controlsId);
            if (own.isPresent()) {
                return own;
            }
            for (Node sibling : siblings) {
                Optional<ButtonNode> found = findVisibleButton(sibling, controlsId);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        return findDisclosureControl(node, siblings);
    }

    /**
     * Returns true if {@code n} is a visible Button that looks like a disclosure toggle, either by
     * a keyword in its text or by a chevron/details affordance.
     */
    public static boolean isControlCandidate(Node n) {
        if (!(n instanceof ButtonNode button) || !n.visible()) {
            return false;
        }
        String text = button.trimmedText();
        if (!text.isEmpty() && CONTROL_KEYWORDS.matcher(text).find()) {
            return true;
        }
        return button.affordances().stream().anyMatch(CONTROL_AFFORDANCES::contains);
    }

    private static Optional<ButtonNode> findVisibleButton(Node subtreeRoot, String id) {
        for (Node n : NodeTree.preOrder(subtreeRoot)) {
            if (n instanceof ButtonNode button && button.visible() && id.equals(button.id())) {
                return Optional.of(button);
            }
        }
        return Optional.empty();
    }
}
