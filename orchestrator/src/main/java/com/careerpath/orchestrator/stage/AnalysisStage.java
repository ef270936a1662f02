package com.careerpath.orchestrator.stage;

/**
 * One step of the analysis pipeline.
 *
 * @param <O> the stage output
 */
public interface AnalysisStage<O> {

    StageName name();

    /**
     * Produce (and persist) this stage's output. May call providers and the
     * store; may throw anything.
     */
    O execute(AnalysisContext ctx, PriorOutputs prior);

    /**
     * Deterministic substitute for {@link #execute}. No I/O, never throws.
     */
    O fallback(AnalysisContext ctx, PriorOutputs prior);
}
