package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.*;
import com.careerpath.orchestrator.stage.PlannedMilestone;
import com.careerpath.orchestrator.stage.PlannedResource;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.Story;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port used by the pipeline.
 *
 * Every create is its own unit of work: one failed write never rolls back
 * rows written before it. Implementations throw unchecked exceptions on failure.
 */
public interface AnalysisStore {

    Transition createTransition(String currentRole, String targetRole, List<String> existingSkills);

    Optional<Transition> getTransition(long transitionId);

    /** @throws TransitionNotFoundException if the row does not exist */
    void updateTransitionStatus(long transitionId, boolean complete);

    /**
     * Delete every stored story, skill gap, insight and plan of the transition
     * and reset its completion flag. The transition row itself stays.
     */
    void clearTransitionData(long transitionId);

    ScrapedData createScrapedData(long transitionId, Story story);

    List<ScrapedData> getScrapedDataByTransitionId(long transitionId);

    SkillGap createSkillGap(long transitionId, SkillGapFinding finding);

    List<SkillGap> getSkillGapsByTransitionId(long transitionId);

    Insight createInsight(long transitionId, InsightType type, String content, String source, String date);

    List<Insight> getInsightsByTransitionId(long transitionId);

    Plan createPlan(long transitionId);

    Milestone createMilestone(long planId, PlannedMilestone milestone);

    Resource createResource(long milestoneId, PlannedResource resource);

    /** The most recently created plan of the transition, if any. */
    Optional<Plan> getLatestPlanByTransitionId(long transitionId);

    /** Milestones of a plan in plan order. */
    List<Milestone> getMilestonesByPlanId(long planId);

    List<Resource> getResourcesByMilestoneId(long milestoneId);

    /** Known skill names for a role; empty when the role is not in the reference data. */
    List<String> findRoleSkills(String roleName);
}
