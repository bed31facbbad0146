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

/** Lays out its children along one axis. */
public record StackNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        Direction direction,
        List<Node> children)
        implements Node {

    public enum Direction {
        VERTICAL,
        HORIZONTAL
    }

    public StackNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
        direction = direction != null ? direction : Direction.VERTICAL;
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static StackNode vertical(String id, Node... children) {
        return new StackNode(
                id, true, List.of(), Behaviors.NONE, Direction.VERTICAL, List.of(children));
    }

    public static StackNode horizontal(String id, Node... children) {
        return new StackNode(
                id, true, List.of(), Behaviors.NONE, Direction.HORIZONTAL, List.of(children));
    }

    @Override
    public NodeType type() {
        return NodeType.STACK;
    }

    public boolean isHorizontal() {
        return direction == Direction.HORIZONTAL;
    }
}
