package com.careerpath.orchestrator.service;

import com.careerpath.orchestrator.model.Insight;
import com.careerpath.orchestrator.model.Milestone;
import com.careerpath.orchestrator.model.Plan;
import com.careerpath.orchestrator.model.Resource;
import com.careerpath.orchestrator.model.ScrapedData;
import com.careerpath.orchestrator.model.SkillGap;
import com.careerpath.orchestrator.model.Transition;
import com.careerpath.orchestrator.stage.TransitionInsights;

import java.util.List;

/**
 * Everything stored for one transition, read back in one go.
 *
 * plan is null until a plan stage has stored one. outlook comes from the
 * latest run in this process (success rate, timeframe, success factors are
 * not persisted) and is null when no run has produced insights yet.
 */
public record StoredAnalysis(Transition transition,
                             List<ScrapedData> stories,
                             List<SkillGap> skillGaps,
                             List<Insight> insights,
                             Plan plan,
                             List<PlanStep> milestones,
                             TransitionInsights outlook) {

    public record PlanStep(Milestone milestone, List<Resource> resources) {
    }
}
