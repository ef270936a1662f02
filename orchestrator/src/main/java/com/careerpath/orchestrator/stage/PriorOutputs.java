package com.careerpath.orchestrator.stage;

import java.util.List;

/**
 * Outputs of the stages that already ran (real or fallback). Lists are never
 * null; insights is null until the insight stage has run.
 */
public record PriorOutputs(List<Story> stories,
                           List<SkillGapFinding> skillGaps,
                           TransitionInsights insights) {

    public PriorOutputs {
        stories   = stories == null ? List.of() : List.copyOf(stories);
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
    }

    public static PriorOutputs none() {
        return new PriorOutputs(List.of(), List.of(), null);
    }

    public PriorOutputs withStories(List<Story> stories) {
        return new PriorOutputs(stories, skillGaps, insights);
    }

    public PriorOutputs withSkillGaps(List<SkillGapFinding> skillGaps) {
        return new PriorOutputs(stories, skillGaps, insights);
    }

    public PriorOutputs withInsights(TransitionInsights insights) {
        return new PriorOutputs(stories, skillGaps, insights);
    }
}
