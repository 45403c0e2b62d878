package com.leadscoring.service;

import com.leadscoring.lifecycle.StageTransition;

import java.util.List;

/**
 * What a recompute changed. A replayed recompute reports no changes.
 */
public record RecomputeOutcome(
    ScoreView score,
    AssignmentView assignment,
    List<StageTransition> stageTransitions,
    boolean scoreChanged,
    boolean assignmentChanged
) {
    public boolean changedAnything() {
        return scoreChanged || assignmentChanged || !stageTransitions.isEmpty();
    }
}
