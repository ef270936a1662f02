package com.careerpath.orchestrator.api.dto;

import com.careerpath.orchestrator.model.Transition;

import java.time.Instant;
import java.util.List;

/**
 * Response body for every /transitions endpoint.
 * Contains enough information for the caller to poll analysis progress.
 */
public record TransitionResponse(
        Long             id,
        String           currentRole,
        String           targetRole,
        List<String>     existingSkills,
        boolean          complete,
        Instant          createdAt,
        ProgressResponse progress
) {
    public static TransitionResponse from(Transition t, ProgressResponse progress) {
        return new TransitionResponse(
                t.getId(),
                t.getCurrentRole(),
                t.getTargetRole(),
                t.getExistingSkills(),
                t.isComplete(),
                t.getCreatedAt(),
                progress
        );
    }
}
