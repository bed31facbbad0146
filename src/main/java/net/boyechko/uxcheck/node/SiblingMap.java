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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index from node id to the node's parent and to the ordered children of that parent.
 *
 * <p>Built once per tree. Invisible nodes are indexed too, so a hidden sibling still occupies its
 * position when distances are measured.
 */
public final class SiblingMap {
    private final Map<String, Node> parents = new HashMap<>();
    private final Map<String, List<Node>> siblings = new HashMap<>();

    private SiblingMap() {}

    public static SiblingMap of(Node root) {
        SiblingMap map = new SiblingMap();
        if (root != null) {
            map.index(root);
        }
        return map;
    }

    private void index(Node parent) {
        List<Node> kids = parent.children();
        for (Node kid : kids) {
            parents.put(kid.id(), parent);
            siblings.put(kid.id(), kids);
            index(kid);
        }
    }

    /**
     * Returns the children of the node's parent, including the node itself, in container order.
     * The root, or a node not in this tree, has no siblings and gets an empty list.
     */
    public List<Node> siblingsOf(Node node) {
        return siblings.getOrDefault(node.id(), List.of());
    }

    public Optional<Node> parentOf(Node node) {
        return Optional.ofNullable(parents.get(node.id()));
    }
}
