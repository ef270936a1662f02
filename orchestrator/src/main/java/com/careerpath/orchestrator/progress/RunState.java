package com.careerpath.orchestrator.progress;

import java.time.Instant;

/**
 * Immutable view of one run. The tracker replaces entries rather than
 * mutating them, so a snapshot is simply the current instance.
 *
 * generation identifies the admission that owns the entry; 0 means no run
 * was ever admitted.
 */
public record RunState(long transitionId,
                       long generation,
                       RunStatus status,
                       AnalysisPhase phase,
                       RunData data,
                       Instant updatedAt) {

    public boolean inProgress() {
        return status == RunStatus.IN_PROGRESS;
    }

    boolean ownedBy(RunLease lease) {
        return generation == lease.generation();
    }

    RunState with(RunStatus status, AnalysisPhase phase, RunData data) {
        return new RunState(transitionId, generation, status, phase, data, Instant.now());
    }
}
