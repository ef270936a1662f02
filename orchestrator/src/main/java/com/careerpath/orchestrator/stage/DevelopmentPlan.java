package com.careerpath.orchestrator.stage;

import java.util.List;

/**
 * Ordered milestones towards the target role. Never empty once it leaves
 * the plan stage.
 */
public record DevelopmentPlan(String overview, String estimatedTimeframe, List<PlannedMilestone> milestones) {

    public DevelopmentPlan {
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
    }
}
