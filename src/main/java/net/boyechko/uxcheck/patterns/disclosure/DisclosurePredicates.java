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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.uxcheck.node.ButtonNode;
import net.boyechko.uxcheck.node.DisclosureBehavior;
import net.boyechko.uxcheck.node.FieldNode;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.node.NodeTree;
import net.boyechko.uxcheck.node.TextNode;

/** Small pure checks over collapsible sections, shared by the disclosure rules. */
public final class DisclosurePredicates {
    private static final int MIN_CONTROL_LABEL_LENGTH = 2;

    private DisclosurePredicates() {}

    /**
     * Returns true if the section starts collapsed and contains a primary Button anywhere in its
     * visible subtree.
     */
    public static boolean hasPrimaryHidden(Node node) {
        Optional<DisclosureBehavior> disclosure = node.disclosure();
        if (disclosure.isEmpty() || !disclosure.get().collapsible()) {
            return false;
        }
        if (disclosure.get().effectiveDefaultState() != DisclosureBehavior.State.COLLAPSED) {
            return false;
        }
        for (Node n : NodeTree.preOrder(node)) {
            if (n instanceof ButtonNode button && button.isPrimary()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the section is labelled by any of, in order: a control whose trimmed text has
     * at least two characters; a visible, non-empty Text immediately before the section; a
     * visible, non-empty Text among the section's direct children.
     *
     * @param control the section's control, or null when none was found
     */
    public static boolean hasLabel(Node node, List<Node> siblings, ButtonNode control) {
        if (control != null && control.trimmedText().length() >= MIN_CONTROL_LABEL_LENGTH) {
            return true;
        }

        int index = indexOf(node.id(), siblings);
        if (index > 0 && isVisibleText(siblings.get(index - 1))) {
            return true;
        }

        for (Node child : node.children()) {
            if (isVisibleText(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the absolute difference between the positions of two ids in {@code siblings}, or -1
     * if either id is missing.
     */
    public static int calculateSiblingDistance(String aId, String bId, List<Node> siblings) {
        int a = indexOf(aId, siblings);
        int b = indexOf(bId, siblings);
        if (a < 0 || b < 0) {
            return -1;
        }
        return Math.abs(a - b);
    }

    /** Returns the node's affordances lower-cased and trimmed, dropping blanks. */
    public static List<String> extractAffordanceTokens(Node node) {
        List<String> tokens = new ArrayList<>();
        for (String token : node.affordances()) {
            if (!token.isBlank()) {
                tokens.add(token.trim().toLowerCase());
            }
        }
        return tokens;
    }

    /** Returns every visible collapsible section in document order. */
    public static List<Node> findCollapsibles(Node root) {
        return NodeTree.preOrder(root).stream().filter(Node::isCollapsible).toList();
    }

    public static Optional<FieldNode> findFirstRequiredField(Node root) {
        for (Node n : NodeTree.preOrder(root)) {
            if (n instanceof FieldNode field && field.isRequired()) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true if {@code aId} is visited before {@code bId} in document order. False when
     * {@code bId} is not in the visible tree.
     */
    public static boolean appearsBefore(String aId, String bId, Node root) {
        boolean seenA = false;
        for (Node n : NodeTree.preOrder(root)) {
            if (n.id().equals(aId)) {
                seenA = true;
            }
            if (n.id().equals(bId)) {
                return seenA && !aId.equals(bId);
            }
        }
        return false;
    }

    static int indexOf(String id, List<Node> siblings) {
        if (id == null || siblings == null) {
            return -1;
        }
        for (int i = 0; i < siblings.size(); i++) {
            if (id.equals(siblings.get(i).id())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isVisibleText(Node n) {
        return n instanceof TextNode text && text.visible() && text.hasText();
    }
}
