package com.careerpath.orchestrator.support;

import com.careerpath.orchestrator.model.*;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.careerpath.orchestrator.repository.TransitionNotFoundException;
import com.careerpath.orchestrator.stage.PlannedMilestone;
import com.careerpath.orchestrator.stage.PlannedResource;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.Story;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link AnalysisStore} held in maps, for pipeline tests without a database.
 *
 * Ids are assigned the way the database would (one sequence per table) and
 * set on the entities by reflection. Individual writes can be made to fail.
 */
public class InMemoryAnalysisStore implements AnalysisStore {

    private final AtomicLong ids = new AtomicLong(100);

    private final Map<Long, Transition> transitions = new LinkedHashMap<>();
    private final List<ScrapedData>     scraped     = new ArrayList<>();
    private final List<SkillGap>        skillGaps   = new ArrayList<>();
    private final List<Insight>         insights    = new ArrayList<>();
    private final Map<Long, Plan>       plans       = new LinkedHashMap<>();
    private final Map<Long, Milestone>  milestones  = new LinkedHashMap<>();
    private final List<Resource>        resources   = new ArrayList<>();
    private final Map<String, List<String>> roleSkills = new HashMap<>();

    private final Set<String> failingSkillGaps = new HashSet<>();
    private final Set<String> failingMilestones = new HashSet<>();
    private boolean failPlanWrites;
    private boolean failStatusWrites;
    private int clearCalls;

    // ------------------------------------------------------------------
    // Fixture setup
    // ------------------------------------------------------------------

    /** Store a transition under a chosen id. */
    public synchronized Transition addTransition(long id, String currentRole, String targetRole) {
        Transition t = new Transition(currentRole, targetRole, List.of());
        setId(t, id);
        transitions.put(id, t);
        return t;
    }

    public synchronized void addRoleSkills(String role, String... skills) {
        roleSkills.put(role.toLowerCase(), List.of(skills));
    }

    public synchronized void failSkillGapWrite(String skillName) {
        failingSkillGaps.add(skillName);
    }

    public synchronized void failMilestoneWrite(String title) {
        failingMilestones.add(title);
    }

    public synchronized void failPlanWrites() {
        failPlanWrites = true;
    }

    public synchronized void failStatusWrites() {
        failStatusWrites = true;
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    public synchronized List<Plan> plansOf(long transitionId) {
        return plans.values().stream().filter(p -> p.getTransitionId() == transitionId).toList();
    }

    public synchronized List<Milestone> milestonesOf(long planId) {
        return milestones.values().stream().filter(m -> m.getPlan().getId() == planId).toList();
    }

    public synchronized List<Resource> resourcesOf(long milestoneId) {
        return resources.stream().filter(r -> r.getMilestone().getId() == milestoneId).toList();
    }

    public synchronized int clearCalls() {
        return clearCalls;
    }

    // ------------------------------------------------------------------
    // AnalysisStore
    // ------------------------------------------------------------------

    @Override
    public synchronized Transition createTransition(String currentRole, String targetRole, List<String> existingSkills) {
        Transition t = new Transition(currentRole, targetRole, existingSkills);
        long id = ids.incrementAndGet();
        setId(t, id);
        transitions.put(id, t);
        return t;
    }

    @Override
    public synchronized Optional<Transition> getTransition(long transitionId) {
        return Optional.ofNullable(transitions.get(transitionId));
    }

    @Override
    public synchronized void updateTransitionStatus(long transitionId, boolean complete) {
        if (failStatusWrites) {
            throw new IllegalStateException("status write failed");
        }
        Transition t = transitions.get(transitionId);
        if (t == null) {
            throw new TransitionNotFoundException(transitionId);
        }
        t.setComplete(complete);
    }

    @Override
    public synchronized void clearTransitionData(long transitionId) {
        clearCalls++;
        scraped.removeIf(s -> s.getTransitionId() == transitionId);
        skillGaps.removeIf(g -> g.getTransitionId() == transitionId);
        insights.removeIf(i -> i.getTransitionId() == transitionId);
        Set<Long> planIds = new HashSet<>();
        plans.values().removeIf(p -> p.getTransitionId() == transitionId && planIds.add(p.getId()));
        milestones.values().removeIf(m -> planIds.contains(m.getPlan().getId()));
        resources.removeIf(r -> !milestones.containsKey(r.getMilestone().getId()));
        Transition t = transitions.get(transitionId);
        if (t != null) {
            t.setComplete(false);
        }
    }

    @Override
    public synchronized ScrapedData createScrapedData(long transitionId, Story story) {
        ScrapedData row = new ScrapedData(transitionId, story.source(), story.content(), story.url(), story.date());
        setId(row, ids.incrementAndGet());
        scraped.add(row);
        return row;
    }

    @Override
    public synchronized List<ScrapedData> getScrapedDataByTransitionId(long transitionId) {
        return scraped.stream().filter(s -> s.getTransitionId() == transitionId).toList();
    }

    @Override
    public synchronized SkillGap createSkillGap(long transitionId, SkillGapFinding f) {
        if (failingSkillGaps.contains(f.skillName())) {
            throw new IllegalStateException("skill gap write failed: " + f.skillName());
        }
        SkillGap row = new SkillGap(transitionId, f.skillName(), f.gapLevel(),
                f.confidenceScore(), f.mentionCount(), f.contextSummary());
        setId(row, ids.incrementAndGet());
        skillGaps.add(row);
        return row;
    }

    @Override
    public synchronized List<SkillGap> getSkillGapsByTransitionId(long transitionId) {
        return skillGaps.stream().filter(g -> g.getTransitionId() == transitionId).toList();
    }

    @Override
    public synchronized Insight createInsight(long transitionId, InsightType type, String content,
                                              String source, String date) {
        Insight row = new Insight(transitionId, type, content, source, date);
        setId(row, ids.incrementAndGet());
        insights.add(row);
        return row;
    }

    @Override
    public synchronized List<Insight> getInsightsByTransitionId(long transitionId) {
        return insights.stream().filter(i -> i.getTransitionId() == transitionId).toList();
    }

    @Override
    public synchronized Plan createPlan(long transitionId) {
        if (failPlanWrites) {
            throw new IllegalStateException("plan write failed");
        }
        Plan row = new Plan(transitionId);
        long id = ids.incrementAndGet();
        setId(row, id);
        plans.put(id, row);
        return row;
    }

    @Override
    public synchronized Milestone createMilestone(long planId, PlannedMilestone m) {
        if (failingMilestones.contains(m.title())) {
            throw new IllegalStateException("milestone write failed: " + m.title());
        }
        Milestone row = new Milestone(plans.get(planId), m.title(), m.description(),
                m.priority(), m.durationWeeks(), m.order());
        long id = ids.incrementAndGet();
        setId(row, id);
        milestones.put(id, row);
        return row;
    }

    @Override
    public synchronized Resource createResource(long milestoneId, PlannedResource r) {
        Resource row = new Resource(milestones.get(milestoneId), r.title(), r.url(), r.type());
        setId(row, ids.incrementAndGet());
        resources.add(row);
        return row;
    }

    @Override
    public synchronized Optional<Plan> getLatestPlanByTransitionId(long transitionId) {
        List<Plan> all = plansOf(transitionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public synchronized List<Milestone> getMilestonesByPlanId(long planId) {
        return milestonesOf(planId);
    }

    @Override
    public synchronized List<Resource> getResourcesByMilestoneId(long milestoneId) {
        return resourcesOf(milestoneId);
    }

    @Override
    public synchronized List<String> findRoleSkills(String roleName) {
        return roleSkills.getOrDefault(roleName.toLowerCase(), List.of());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void setId(Object entity, long id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
