package com.careerpath.orchestrator.stage;

import java.util.List;

/**
 * Immutable inputs shared by every stage of one run.
 */
public record AnalysisContext(long transitionId,
                              String currentRole,
                              String targetRole,
                              List<String> existingSkills) {

    public AnalysisContext {
        existingSkills = existingSkills == null ? List.of() : List.copyOf(existingSkills);
    }
}
