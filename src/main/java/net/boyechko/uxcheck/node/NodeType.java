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

/** Discriminator for the closed set of scaffold node kinds. */
public enum NodeType {
    STACK("Stack"),
    GRID("Grid"),
    BOX("Box"),
    TEXT("Text"),
    BUTTON("Button"),
    FIELD("Field"),
    FORM("Form"),
    TABLE("Table");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    /** Returns the type tag as it appears in scaffold documents. */
    public String label() {
        return label;
    }

    /** Returns true for node kinds that hold other nodes. */
    public boolean isContainer() {
        return switch (this) {
            case STACK, GRID, BOX, FORM -> true;
            case TEXT, BUTTON, FIELD, TABLE -> false;
        };
    }
}
