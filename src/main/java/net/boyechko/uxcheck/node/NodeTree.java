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
package net.boyechko.uxcheck.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Static helpers for walking a scaffold tree in document order. */
public final class NodeTree {
    private NodeTree() {}

    /** Returns the visible nodes of the tree in pre-order. */
    public static List<Node> preOrder(Node root) {
        return preOrder(root, true);
    }

    /**
     * Returns the nodes of the tree in pre-order: a parent first, then its children left to right.
     *
     * @param root node to start from; included in the result
     * @param visibleOnly if true, an invisible node and its entire subtree are skipped
     * @return a fresh list, so each call restarts the traversal
     */
    public static List<Node> preOrder(Node root, boolean visibleOnly) {
        List<Node> out = new ArrayList<>();
        if (root != null) {
            collect(root, visibleOnly, out);
        }
        return out;
    }

    private static void collect(Node node, boolean visibleOnly, List<Node> out) {
        if (visibleOnly && !node.visible()) {
            return;
        }
        out.add(node);
        for (Node child : node.children()) {
            collect(child, visibleOnly, out);
        }
    }

    public static List<String> collectIds(Node root, boolean visibleOnly) {
        return preOrder(root, visibleOnly).stream().map(Node::id).toList();
    }

    /** Finds the first visible node with the given id, searching {@code root}'s subtree. */
    public static Optional<Node> findById(Node root, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return preOrder(root).stream().filter(n -> id.equals(n.id())).findFirst();
    }

    /** Returns true if {@code candidate} is {@code ancestor} itself or lies in its subtree. */
    public static boolean contains(Node ancestor, Node candidate) {
        if (ancestor == candidate) {
            return true;
        }
        for (Node child : ancestor.children()) {
            if (contains(child, candidate)) {
                return true;
            }
        }
        return false;
    }
}
