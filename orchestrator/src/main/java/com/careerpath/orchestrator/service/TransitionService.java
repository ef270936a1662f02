package com.careerpath.orchestrator.service;

import com.careerpath.orchestrator.model.Plan;
import com.careerpath.orchestrator.model.Transition;
import com.careerpath.orchestrator.pipeline.AnalysisDispatcher;
import com.careerpath.orchestrator.progress.ProgressTracker;
import com.careerpath.orchestrator.progress.RunData;
import com.careerpath.orchestrator.progress.RunState;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.careerpath.orchestrator.repository.TransitionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Transition lifecycle as seen by API callers: create, (re)analyze, poll.
 *
 * Analyses run in the background; callers poll {@link #progress}.
 */
@Service
public class TransitionService {

    private static final Logger log = LoggerFactory.getLogger(TransitionService.class);

    private final AnalysisStore      store;
    private final AnalysisDispatcher dispatcher;
    private final ProgressTracker    tracker;

    public TransitionService(AnalysisStore store,
                             AnalysisDispatcher dispatcher,
                             ProgressTracker tracker) {
        this.store      = store;
        this.dispatcher = dispatcher;
        this.tracker    = tracker;
    }

    /** Store a new transition and queue its first analysis. */
    public Transition submit(String currentRole, String targetRole, List<String> existingSkills) {
        List<String> skills = existingSkills == null ? List.of() : existingSkills.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::strip)
                .toList();
        Transition transition = store.createTransition(currentRole.strip(), targetRole.strip(), skills);
        log.info("Transition {} created: {} -> {}",
                transition.getId(), transition.getCurrentRole(), transition.getTargetRole());
        dispatcher.dispatch(transition, false);
        return transition;
    }

    /**
     * Queue another analysis of an existing transition. With forceRefresh the
     * stored results are cleared first and an in-flight run is superseded.
     *
     * @throws TransitionNotFoundException if the transition does not exist
     */
    public Transition reanalyze(long transitionId, boolean forceRefresh) {
        Transition transition = store.getTransition(transitionId)
                .orElseThrow(() -> new TransitionNotFoundException(transitionId));
        log.info("Re-analysis of transition {} requested (forceRefresh={})", transitionId, forceRefresh);
        dispatcher.dispatch(transition, forceRefresh);
        return transition;
    }

    public Optional<Transition> findById(long transitionId) {
        return store.getTransition(transitionId);
    }

    public Optional<RunState> progress(long transitionId) {
        return tracker.snapshot(transitionId);
    }

    /**
     * Stored results of the transition: stories, skill gaps, insights and the
     * latest plan with its milestones and resources. Empty for an unknown id.
     */
    public Optional<StoredAnalysis> results(long transitionId) {
        return store.getTransition(transitionId).map(transition -> {
            Plan plan = store.getLatestPlanByTransitionId(transitionId).orElse(null);
            List<StoredAnalysis.PlanStep> steps = plan == null ? List.of()
                    : store.getMilestonesByPlanId(plan.getId()).stream()
                            .map(m -> new StoredAnalysis.PlanStep(m, store.getResourcesByMilestoneId(m.getId())))
                            .toList();
            return new StoredAnalysis(
                    transition,
                    store.getScrapedDataByTransitionId(transitionId),
                    store.getSkillGapsByTransitionId(transitionId),
                    store.getInsightsByTransitionId(transitionId),
                    plan,
                    steps,
                    tracker.snapshot(transitionId).map(RunState::data).map(RunData::insights).orElse(null));
        });
    }
}
