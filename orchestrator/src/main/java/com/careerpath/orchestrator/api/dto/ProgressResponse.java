package com.careerpath.orchestrator.api.dto;

import com.careerpath.orchestrator.progress.RunData;
import com.careerpath.orchestrator.progress.RunState;

import java.time.Instant;

/**
 * Progress of the latest analysis run, with counts of what it has produced
 * so far. status is IDLE and phase null when no run was ever admitted.
 */
public record ProgressResponse(
        String  status,
        String  phase,
        int     stories,
        int     skillGaps,
        int     insights,
        int     milestones,
        Instant updatedAt
) {
    public static ProgressResponse idle() {
        return new ProgressResponse("IDLE", null, 0, 0, 0, 0, null);
    }

    public static ProgressResponse from(RunState state) {
        RunData d = state.data();
        return new ProgressResponse(
                state.status().name(),
                state.phase().name(),
                d.stories()   == null ? 0 : d.stories().size(),
                d.skillGaps() == null ? 0 : d.skillGaps().size(),
                d.insights()  == null ? 0
                        : d.insights().keyObservations().size() + d.insights().commonChallenges().size(),
                d.plan()      == null ? 0 : d.plan().milestones().size(),
                state.updatedAt()
        );
    }
}
