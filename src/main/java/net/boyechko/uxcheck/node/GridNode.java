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

/** Lays out its children in a fixed number of columns. */
public record GridNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        int columns,
        List<Node> children)
        implements Node {

    public GridNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static GridNode of(String id, int columns, Node... children) {
        return new GridNode(id, true, List.of(), Behaviors.NONE, columns, List.of(children));
    }

    @Override
    public NodeType type() {
        return NodeType.GRID;
    }
}
