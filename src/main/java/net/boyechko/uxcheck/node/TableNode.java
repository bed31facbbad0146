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

/**
 * A tabular data display.
 *
 * @param responsiveStrategy how the table adapts to narrow viewports ("wrap", "scroll", "cards");
 *     null when not declared
 */
public record TableNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        String title,
        List<String> columns,
        String responsiveStrategy)
        implements Node {

    public TableNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public static TableNode of(String id, String title, List<String> columns, String strategy) {
        return new TableNode(id, true, List.of(), Behaviors.NONE, title, columns, strategy);
    }

    @Override
    public NodeType type() {
        return NodeType.TABLE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
