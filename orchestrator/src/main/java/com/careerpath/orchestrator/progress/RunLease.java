package com.careerpath.orchestrator.progress;

/**
 * Proof of admission handed out by {@link ProgressTracker#tryAcquire}.
 * Only the holder of the current generation may move its entry forward.
 */
public record RunLease(long transitionId, long generation) {
}
