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
 * Hints identifying a multi-step wizard container or one of its steps.
 *
 * @param role whether the node is the wizard container or a step
 * @param stepIndex 1-based index of a step; null on containers
 * @param totalSteps declared number of steps; null when it should be derived
 * @param nextId explicit id of the step's Next button
 * @param prevId explicit id of the step's Back button
 * @param hasProgress true when the wizard promises a progress indicator
 * @param progressNodeId id of the progress indicator node
 */
public record GuidedFlowBehavior(
        Role role,
        Integer stepIndex,
        Integer totalSteps,
        String nextId,
        String prevId,
        boolean hasProgress,
        String progressNodeId) {

    public enum Role {
        WIZARD,
        STEP
    }

    public static GuidedFlowBehavior wizard(Integer totalSteps) {
        return new GuidedFlowBehavior(Role.WIZARD, null, totalSteps, null, null, false, null);
    }

    public static GuidedFlowBehavior wizardWithProgress(Integer totalSteps, String progressNodeId) {
        return new GuidedFlowBehavior(
                Role.WIZARD, null, totalSteps, null, null, true, progressNodeId);
    }

    public static GuidedFlowBehavior step(int stepIndex, Integer totalSteps) {
        return new GuidedFlowBehavior(Role.STEP, stepIndex, totalSteps, null, null, false, null);
    }

    public boolean isWizard() {
        return role == Role.WIZARD;
    }

    public boolean isStep() {
        return role == Role.STEP;
    }
}
