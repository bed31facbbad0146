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
import java.util.Objects;

/** Wraps at most one child. */
public record BoxNode(
        String id, boolean visible, List<String> affordances, Behaviors behaviors, Node child)
        implements Node {

    public BoxNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
    }

    public static BoxNode of(String id, Node child) {
        return new BoxNode(id, true, List.of(), Behaviors.NONE, child);
    }

    /** Returns a box marked as a collapsible section. */
    public static BoxNode collapsible(String id, DisclosureBehavior disclosure, Node child) {
        return new BoxNode(id, true, List.of(), Behaviors.of(disclosure), child);
    }

    @Override
    public NodeType type() {
        return NodeType.BOX;
    }

    @Override
    public List<Node> children() {
        return child != null ? List.of(child) : List.of();
    }
}
