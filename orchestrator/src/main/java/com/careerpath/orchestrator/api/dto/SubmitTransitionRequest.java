package com.careerpath.orchestrator.api.dto;

import java.util.List;

/**
 * Request body for POST /transitions.
 *
 * Required: currentRole, targetRole
 * Optional: existingSkills (defaults to an empty list)
 */
public record SubmitTransitionRequest(String currentRole, String targetRole, List<String> existingSkills) {

    public SubmitTransitionRequest {
        if (existingSkills == null) existingSkills = List.of();
    }
}
