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

public record TextNode(
        String id, boolean visible, List<String> affordances, Behaviors behaviors, String text)
        implements Node {

    public TextNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
    }

    public static TextNode of(String id, String text) {
        return new TextNode(id, true, List.of(), Behaviors.NONE, text);
    }

    @Override
    public NodeType type() {
        return NodeType.TEXT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    /** Returns true if the text has at least one non-whitespace character. */
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
