package com.careerpath.orchestrator.pipeline;

import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.TransitionInsights;

import java.util.List;

/**
 * What a run hands back to its caller. Always complete: any part a stage
 * could not produce is its fallback. The development plan travels inside
 * {@code insights}.
 */
public record AnalysisResult(List<SkillGapFinding> skillGaps,
                             TransitionInsights insights,
                             int scrapedCount) {

    public AnalysisResult {
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
    }
}
