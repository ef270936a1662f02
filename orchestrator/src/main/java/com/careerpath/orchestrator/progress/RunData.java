package com.careerpath.orchestrator.progress;

import com.careerpath.orchestrator.stage.DevelopmentPlan;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.Story;
import com.careerpath.orchestrator.stage.TransitionInsights;

import java.util.List;

/**
 * Intermediate stage outputs of a run. Every field may be null (not produced yet).
 */
public record RunData(List<Story> stories,
                      List<SkillGapFinding> skillGaps,
                      TransitionInsights insights,
                      DevelopmentPlan plan) {

    public static final RunData EMPTY = new RunData(null, null, null, null);

    public RunData {
        stories   = stories == null ? null : List.copyOf(stories);
        skillGaps = skillGaps == null ? null : List.copyOf(skillGaps);
    }

    public static RunData ofStories(List<Story> stories) {
        return new RunData(stories, null, null, null);
    }

    public static RunData ofSkillGaps(List<SkillGapFinding> skillGaps) {
        return new RunData(null, skillGaps, null, null);
    }

    public static RunData ofInsights(TransitionInsights insights) {
        return new RunData(null, null, insights, null);
    }

    public static RunData ofPlan(DevelopmentPlan plan) {
        return new RunData(null, null, null, plan);
    }

    /** Shallow merge: each field present in the patch replaces ours wholesale. */
    public RunData merge(RunData patch) {
        if (patch == null) {
            return this;
        }
        return new RunData(
                patch.stories   != null ? patch.stories   : stories,
                patch.skillGaps != null ? patch.skillGaps : skillGaps,
                patch.insights  != null ? patch.insights  : insights,
                patch.plan      != null ? patch.plan      : plan);
    }
}
