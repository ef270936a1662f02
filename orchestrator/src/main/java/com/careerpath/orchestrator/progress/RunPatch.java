package com.careerpath.orchestrator.progress;

/**
 * A partial update for {@link ProgressTracker#update}. Null members are left untouched.
 */
public record RunPatch(RunData data, RunStatus status, AnalysisPhase phase) {

    public static RunPatch phase(AnalysisPhase phase) {
        return new RunPatch(null, null, phase);
    }

    public static RunPatch data(AnalysisPhase phase, RunData data) {
        return new RunPatch(data, null, phase);
    }

    public static RunPatch terminal(RunStatus status, AnalysisPhase phase) {
        return new RunPatch(null, status, phase);
    }
}
