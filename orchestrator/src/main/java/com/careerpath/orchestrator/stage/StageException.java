package com.careerpath.orchestrator.stage;

/**
 * A stage could not produce a usable result. The orchestrator replaces the
 * result with the stage fallback.
 */
public class StageException extends RuntimeException {

    public StageException(String message) {
        super(message);
    }

    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
