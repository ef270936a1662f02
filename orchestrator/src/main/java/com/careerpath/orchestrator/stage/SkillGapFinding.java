package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.model.GapLevel;

/**
 * A normalized skill gap: confidence in 0-100, mention count at least 1.
 */
public record SkillGapFinding(String skillName,
                              GapLevel gapLevel,
                              int confidenceScore,
                              int mentionCount,
                              String contextSummary) {

    public static final int DEFAULT_CONFIDENCE = 70;

    public SkillGapFinding {
        confidenceScore = Math.max(0, Math.min(100, confidenceScore));
        mentionCount = Math.max(1, mentionCount);
    }
}
