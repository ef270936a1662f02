package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.*;
import com.careerpath.orchestrator.stage.PlannedMilestone;
import com.careerpath.orchestrator.stage.PlannedResource;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.Story;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link AnalysisStore} over the Spring Data repositories.
 *
 * Each public method runs in its own transaction, so the stages' per-record
 * writes commit (or fail) independently.
 */
@Component
public class JpaAnalysisStore implements AnalysisStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAnalysisStore.class);

    private final TransitionRepository  transitionRepo;
    private final ScrapedDataRepository scrapedRepo;
    private final SkillGapRepository    skillGapRepo;
    private final InsightRepository     insightRepo;
    private final PlanRepository        planRepo;
    private final MilestoneRepository   milestoneRepo;
    private final ResourceRepository    resourceRepo;
    private final RoleSkillRepository   roleSkillRepo;

    public JpaAnalysisStore(TransitionRepository transitionRepo,
                            ScrapedDataRepository scrapedRepo,
                            SkillGapRepository skillGapRepo,
                            InsightRepository insightRepo,
                            PlanRepository planRepo,
                            MilestoneRepository milestoneRepo,
                            ResourceRepository resourceRepo,
                            RoleSkillRepository roleSkillRepo) {
        this.transitionRepo = transitionRepo;
        this.scrapedRepo    = scrapedRepo;
        this.skillGapRepo   = skillGapRepo;
        this.insightRepo    = insightRepo;
        this.planRepo       = planRepo;
        this.milestoneRepo  = milestoneRepo;
        this.resourceRepo   = resourceRepo;
        this.roleSkillRepo  = roleSkillRepo;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Transition createTransition(String currentRole, String targetRole, List<String> existingSkills) {
        return transitionRepo.save(new Transition(currentRole, targetRole, existingSkills));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transition> getTransition(long transitionId) {
        return transitionRepo.findById(transitionId);
    }

    @Override
    @Transactional
    public void updateTransitionStatus(long transitionId, boolean complete) {
        Transition t = transitionRepo.findById(transitionId)
                .orElseThrow(() -> new TransitionNotFoundException(transitionId));
        t.setComplete(complete);
        transitionRepo.save(t);
    }

    /** Children first: resources, milestones, plans, then the flat tables. */
    @Override
    @Transactional
    public void clearTransitionData(long transitionId) {
        int resources  = resourceRepo.deleteByTransition(transitionId);
        int milestones = milestoneRepo.deleteByTransition(transitionId);
        int plans      = planRepo.deleteByTransition(transitionId);
        int insights   = insightRepo.deleteByTransition(transitionId);
        int gaps       = skillGapRepo.deleteByTransition(transitionId);
        int scraped    = scrapedRepo.deleteByTransition(transitionId);
        transitionRepo.findById(transitionId).ifPresent(t -> {
            t.setComplete(false);
            transitionRepo.save(t);
        });
        log.info("Cleared transition {}: {} stories, {} gaps, {} insights, {} plans, {} milestones, {} resources",
                transitionId, scraped, gaps, insights, plans, milestones, resources);
    }

    // ------------------------------------------------------------------
    // Stage outputs
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public ScrapedData createScrapedData(long transitionId, Story story) {
        return scrapedRepo.save(new ScrapedData(
                transitionId, story.source(), story.content(), story.url(), story.date()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScrapedData> getScrapedDataByTransitionId(long transitionId) {
        return scrapedRepo.findByTransitionIdOrderByIdAsc(transitionId);
    }

    @Override
    @Transactional
    public SkillGap createSkillGap(long transitionId, SkillGapFinding finding) {
        return skillGapRepo.save(new SkillGap(transitionId, finding.skillName(), finding.gapLevel(),
                finding.confidenceScore(), finding.mentionCount(), finding.contextSummary()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SkillGap> getSkillGapsByTransitionId(long transitionId) {
        return skillGapRepo.findByTransitionIdOrderByIdAsc(transitionId);
    }

    @Override
    @Transactional
    public Insight createInsight(long transitionId, InsightType type, String content, String source, String date) {
        return insightRepo.save(new Insight(transitionId, type, content, source, date));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Insight> getInsightsByTransitionId(long transitionId) {
        return insightRepo.findByTransitionIdOrderByIdAsc(transitionId);
    }

    @Override
    @Transactional
    public Plan createPlan(long transitionId) {
        return planRepo.save(new Plan(transitionId));
    }

    @Override
    @Transactional
    public Milestone createMilestone(long planId, PlannedMilestone m) {
        Plan plan = planRepo.getReferenceById(planId);
        return milestoneRepo.save(new Milestone(
                plan, m.title(), m.description(), m.priority(), m.durationWeeks(), m.order()));
    }

    @Override
    @Transactional
    public Resource createResource(long milestoneId, PlannedResource r) {
        Milestone milestone = milestoneRepo.getReferenceById(milestoneId);
        return resourceRepo.save(new Resource(milestone, r.title(), r.url(), r.type()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Plan> getLatestPlanByTransitionId(long transitionId) {
        return planRepo.findFirstByTransitionIdOrderByIdDesc(transitionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Milestone> getMilestonesByPlanId(long planId) {
        return milestoneRepo.findByPlan(planId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Resource> getResourcesByMilestoneId(long milestoneId) {
        return resourceRepo.findByMilestone(milestoneId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findRoleSkills(String roleName) {
        return roleSkillRepo.findByRoleNameIgnoreCase(roleName).stream()
                .map(RoleSkill::getSkillName)
                .toList();
    }
}
