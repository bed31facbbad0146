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

/**
 * Marks a node as a section that can be toggled between collapsed and expanded.
 *
 * @param collapsible true marks the node as a collapsible section
 * @param defaultState initial state; null means collapsed
 * @param controlsId id of the Button that toggles the section, if declared explicitly
 * @param targetId id of the content the section reveals, if different from the node itself
 */
public record DisclosureBehavior(
        boolean collapsible, State defaultState, String controlsId, String targetId) {

    public enum State {
        COLLAPSED,
        EXPANDED
    }

    public static DisclosureBehavior collapsed() {
        return new DisclosureBehavior(true, State.COLLAPSED, null, null);
    }

    public static DisclosureBehavior collapsed(String controlsId) {
        return new DisclosureBehavior(true, State.COLLAPSED, controlsId, null);
    }

    public static DisclosureBehavior expanded(String controlsId) {
        return new DisclosureBehavior(true, State.EXPANDED, controlsId, null);
    }

    public State effectiveDefaultState() {
        return defaultState != null ? defaultState : State.COLLAPSED;
    }

    public boolean hasControlsId() {
        return controlsId != null && !controlsId.isEmpty();
    }
}
