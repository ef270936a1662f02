package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.model.Priority;

import java.util.List;

/**
 * A plan step. order is 1-based and contiguous within its plan.
 */
public record PlannedMilestone(String title,
                               String description,
                               Priority priority,
                               int durationWeeks,
                               int order,
                               List<PlannedResource> resources) {

    public PlannedMilestone {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public PlannedMilestone withOrder(int order) {
        return new PlannedMilestone(title, description, priority, durationWeeks, order, resources);
    }
}
