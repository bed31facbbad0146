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

/** Optional behavior hints attached to a node. Either member may be null. */
public record Behaviors(DisclosureBehavior disclosure, GuidedFlowBehavior guidedFlow) {

    public static final Behaviors NONE = new Behaviors(null, null);

    public static Behaviors of(DisclosureBehavior disclosure) {
        return new Behaviors(disclosure, null);
    }

    public static Behaviors of(GuidedFlowBehavior guidedFlow) {
        return new Behaviors(null, guidedFlow);
    }

    static Behaviors orNone(Behaviors behaviors) {
        return behaviors != null ? behaviors : NONE;
    }
}
