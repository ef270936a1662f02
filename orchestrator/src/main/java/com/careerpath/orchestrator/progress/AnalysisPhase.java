package com.careerpath.orchestrator.progress;

/**
 * Where an admitted run currently is in the pipeline.
 *
 * Happy path:
 *   ADMITTED → RESEARCHING → ANALYZING_GAPS → GENERATING_INSIGHTS → PLANNING → FINALIZING → COMPLETE
 *
 * Any phase can move to FAILED on a fatal error. Stage failures do not;
 * they are replaced by the stage fallback and the run continues.
 */
public enum AnalysisPhase {
    ADMITTED,
    RESEARCHING,
    ANALYZING_GAPS,
    GENERATING_INSIGHTS,
    PLANNING,
    FINALIZING,
    COMPLETE,
    FAILED
}
