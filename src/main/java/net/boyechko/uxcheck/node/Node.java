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

import java.util.List;
import java.util.Optional;

/**
 * A single element of a scaffold tree.
 *
 * <p>The hierarchy is sealed: every consumer that switches over {@link #type()} must handle all
 * node kinds, so adding a kind is a compile-time change for each of them. Structural children are
 * exposed uniformly through {@link #children()}.
 */
public sealed interface Node
        permits StackNode, GridNode, BoxNode, TextNode, ButtonNode, FieldNode, FormNode, TableNode {

    String id();

    NodeType type();

    /** False when the node is hidden; hidden nodes and their subtrees are skipped by traversal. */
    boolean visible();

    /** Free-form visual or interaction cues, e.g. "chevron". Never null. */
    List<String> affordances();

    /** Non-visual behavior hints. Never null. */
    Behaviors behaviors();

    /** Structural children in document order. Form returns its fields followed by its actions. */
    List<Node> children();

    default Optional<DisclosureBehavior> disclosure() {
        return Optional.ofNullable(behaviors().disclosure());
    }

    default Optional<GuidedFlowBehavior> guidedFlow() {
        return Optional.ofNullable(behaviors().guidedFlow());
    }

    /** Returns true if the node is marked as a collapsible section. */
    default boolean isCollapsible() {
        return disclosure().map(DisclosureBehavior::collapsible).orElse(false);
    }

    default boolean hasType(NodeType t) {
        return type() == t;
    }
}
