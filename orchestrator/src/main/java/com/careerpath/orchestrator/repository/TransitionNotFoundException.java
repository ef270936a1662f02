package com.careerpath.orchestrator.repository;

/**
 * No transitions row for the given id. Fatal for a pipeline run.
 */
public class TransitionNotFoundException extends RuntimeException {

    private final long transitionId;

    public TransitionNotFoundException(long transitionId) {
        super("Transition " + transitionId + " not found");
        this.transitionId = transitionId;
    }

    public long transitionId() { return transitionId; }
}
