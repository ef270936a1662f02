package com.careerpath.orchestrator.progress;

/**
 * Lifecycle of one analysis run as seen by the tracker.
 *
 * Transitions:
 *   IDLE        → IN_PROGRESS (admitted by tryAcquire)
 *   IN_PROGRESS → COMPLETE    (pipeline finalized)
 *   IN_PROGRESS → FAILED      (fatal error, or released without a terminal state)
 *   COMPLETE / FAILED → IN_PROGRESS (re-run)
 */
public enum RunStatus {
    IDLE,
    IN_PROGRESS,
    COMPLETE,
    FAILED
}
