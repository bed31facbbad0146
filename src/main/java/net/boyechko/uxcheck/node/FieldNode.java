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

/** A labelled input. {@code required} is null when the scaffold leaves it unspecified. */
public record FieldNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        String label,
        Boolean required,
        String helpText,
        String errorText)
        implements Node {

    public FieldNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
    }

    public static FieldNode of(String id, String label) {
        return new FieldNode(id, true, List.of(), Behaviors.NONE, label, null, null, null);
    }

    public static FieldNode required(String id, String label) {
        return new FieldNode(id, true, List.of(), Behaviors.NONE, label, true, null, null);
    }

    @Override
    public NodeType type() {
        return NodeType.FIELD;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    public boolean isRequired() {
        return Boolean.TRUE.equals(required);
    }

    public boolean hasErrorText() {
        return errorText != null && !errorText.isBlank();
    }
}
