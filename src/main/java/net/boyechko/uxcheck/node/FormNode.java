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
import java.util.Objects;

/** Groups input fields with the actions that submit them. */
public record FormNode(
        String id,
        boolean visible,
        List<String> affordances,
        Behaviors behaviors,
        String title,
        List<FieldNode> fields,
        List<ButtonNode> actions,
        List<String> states)
        implements Node {

    public FormNode {
        Objects.requireNonNull(id, "id");
        affordances = affordances != null ? List.copyOf(affordances) : List.of();
        behaviors = Behaviors.orNone(behaviors);
        fields = fields != null ? List.copyOf(fields) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        states = states != null ? List.copyOf(states) : List.of();
    }

    public static FormNode of(
            String id, List<FieldNode> fields, List<ButtonNode> actions, String... states) {
        return new FormNode(
                id, true, List.of(), Behaviors.NONE, null, fields, actions, List.of(states));
    }

    @Override
    public NodeType type() {
        return NodeType.FORM;
    }

    @Override
    public List<Node> children() {
        List<Node> out = new ArrayList<>(fields.size() + actions.size());
        out.addAll(fields);
        out.addAll(actions);
        return List.copyOf(out);
    }

    public boolean hasState(String state) {
        return states.contains(state);
    }
}
