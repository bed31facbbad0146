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
 * An actionable control.
 *
 * @param text visible label; null for icon-only buttons
 * @param roleHint visual emphasis; null when unspecified
 */
public record ButtonNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        String text,
        RoleHint roleHint)
        implements Node {

    public enum RoleHint {
        PRIMARY,
        SECONDARY,
        DANGER,
        LINK
    }

    public ButtonNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
    }

    public static ButtonNode of(String id, String text) {
        return new ButtonNode(id, true, List.of(), Behaviors.NONE, text, null);
    }

    public static ButtonNode primary(String id, String text) {
        return new ButtonNode(id, true, List.of(), Behaviors.NONE, text, RoleHint.PRIMARY);
    }

    @Override
    public NodeType type() {
        return NodeType.BUTTON;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    public boolean isPrimary() {
        return roleHint == RoleHint.PRIMARY;
    }

    /** Returns the text with surrounding whitespace removed, or an empty string. */
    public String trimmedText() {
        return text != null ? text.trim() : "";
    }
}
