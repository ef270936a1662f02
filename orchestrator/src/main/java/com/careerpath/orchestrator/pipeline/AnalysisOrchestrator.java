package com.careerpath.orchestrator.pipeline;

import com.careerpath.orchestrator.progress.AnalysisPhase;
import com.careerpath.orchestrator.progress.ProgressTracker;
import com.careerpath.orchestrator.progress.RunData;
import com.careerpath.orchestrator.progress.RunLease;
import com.careerpath.orchestrator.progress.RunPatch;
import com.careerpath.orchestrator.progress.RunState;
import com.careerpath.orchestrator.progress.RunStatus;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.careerpath.orchestrator.repository.TransitionNotFoundException;
import com.careerpath.orchestrator.stage.AnalysisContext;
import com.careerpath.orchestrator.stage.AnalysisStage;
import com.careerpath.orchestrator.stage.DevelopmentPlan;
import com.careerpath.orchestrator.stage.InsightStage;
import com.careerpath.orchestrator.stage.PlanStage;
import com.careerpath.orchestrator.stage.PriorOutputs;
import com.careerpath.orchestrator.stage.ResearchStage;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.SkillGapStage;
import com.careerpath.orchestrator.stage.StageException;
import com.careerpath.orchestrator.stage.Story;
import com.careerpath.orchestrator.stage.TransitionInsights;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs one analysis: research, skill gaps, insights, plan.
 *
 * A failing stage never stops the run. Its output is replaced by the stage
 * fallback and the next stage sees that instead. Only a missing transition
 * or a failure outside the stages (finalizing) aborts the run, and even then
 * the caller gets a complete result assembled from what was produced plus
 * fallbacks.
 *
 * Concurrent requests for the same transition are deduplicated by
 * {@link ProgressTracker#tryAcquire}: the loser is answered from the
 * in-flight snapshot without touching any provider. Every tracker write goes
 * through the run's lease, so a run superseded by a forced re-run cannot
 * overwrite the state of the run that replaced it.
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    static final String MDC_TRANSITION = "transitionId";
    static final String MDC_STAGE      = "stage";

    static final String STAGE_DURATION  = "careerpath.stage.duration";
    static final String STAGE_FALLBACKS = "careerpath.stage.fallbacks";

    private final AnalysisStore   store;
    private final ProgressTracker tracker;
    private final ResearchStage   research;
    private final SkillGapStage   skillGaps;
    private final InsightStage    insights;
    private final PlanStage       plan;
    private final MeterRegistry   meters;

    public AnalysisOrchestrator(AnalysisStore store,
                                ProgressTracker tracker,
                                ResearchStage research,
                                SkillGapStage skillGaps,
                                InsightStage insights,
                                PlanStage plan,
                                MeterRegistry meters) {
        this.store     = store;
        this.tracker   = tracker;
        this.research  = research;
        this.skillGaps = skillGaps;
        this.insights  = insights;
        this.plan      = plan;
        this.meters    = meters;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public AnalysisResult run(String currentRole,
                              String targetRole,
                              long transitionId,
                              List<String> existingSkills,
                              boolean forceRefresh) {
        AnalysisContext ctx = new AnalysisContext(transitionId, currentRole, targetRole, existingSkills);
        MDC.put(MDC_TRANSITION, String.valueOf(transitionId));
        try {
            if (forceRefresh) {
                try {
                    store.clearTransitionData(transitionId);
                } catch (RuntimeException e) {
                    log.warn("Could not clear stored data for transition {}: {}", transitionId, e.getMessage());
                }
            }

            Optional<RunLease> lease = tracker.tryAcquire(transitionId, forceRefresh);
            if (lease.isEmpty()) {
                RunData inFlight = tracker.snapshot(transitionId).map(RunState::data).orElse(RunData.EMPTY);
                log.info("Transition {} already running, answering from snapshot", transitionId);
                return assemble(ctx, inFlight);
            }

            try {
                return execute(ctx, lease.get());
            } finally {
                tracker.release(lease.get());
            }
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_TRANSITION);
        }
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private AnalysisResult execute(AnalysisContext ctx, RunLease lease) {
        long id = ctx.transitionId();
        RunData produced = RunData.EMPTY;
        try {
            if (store.getTransition(id).isEmpty()) {
                throw new TransitionNotFoundException(id);
            }
            log.info("Analysis started: {} -> {}", ctx.currentRole(), ctx.targetRole());
            PriorOutputs prior = PriorOutputs.none();

            tracker.update(lease, RunPatch.phase(AnalysisPhase.RESEARCHING));
            List<Story> stories = runStage(research, ctx, prior);
            prior = prior.withStories(stories);
            produced = advance(lease, produced, AnalysisPhase.ANALYZING_GAPS, RunData.ofStories(stories));

            List<SkillGapFinding> gaps = runStage(skillGaps, ctx, prior);
            prior = prior.withSkillGaps(gaps);
            produced = advance(lease, produced, AnalysisPhase.GENERATING_INSIGHTS, RunData.ofSkillGaps(gaps));

            TransitionInsights found = runStage(insights, ctx, prior);
            prior = prior.withInsights(found);
            produced = advance(lease, produced, AnalysisPhase.PLANNING, RunData.ofInsights(found));

            DevelopmentPlan developmentPlan = runStage(plan, ctx, prior);
            produced = advance(lease, produced, AnalysisPhase.FINALIZING, RunData.ofPlan(developmentPlan));

            store.updateTransitionStatus(id, true);
            tracker.update(lease, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));
            log.info("Analysis complete: {} stories, {} skill gaps, {} milestones",
                    stories.size(), gaps.size(), developmentPlan.milestones().size());
            return new AnalysisResult(gaps, found.withPlan(developmentPlan), stories.size());

        } catch (RuntimeException e) {
            log.error("Analysis of transition {} failed: {}", id, e.getMessage(), e);
            tracker.update(lease, RunPatch.terminal(RunStatus.FAILED, AnalysisPhase.FAILED));
            try {
                store.updateTransitionStatus(id, true);
            } catch (RuntimeException statusError) {
                log.warn("Could not mark transition {} complete after failure: {}", id, statusError.getMessage());
            }
            return assemble(ctx, produced);
        }
    }

    /** Record a stage output locally and in the tracker, then move to the next phase. */
    private RunData advance(RunLease lease, RunData produced, AnalysisPhase next, RunData output) {
        tracker.update(lease, RunPatch.data(next, output));
        return produced.merge(output);
    }

    /**
     * Execute one stage, substituting its fallback on any exception. Timed
     * per stage and outcome; fallbacks are counted.
     */
    private <O> O runStage(AnalysisStage<O> stage, AnalysisContext ctx, PriorOutputs prior) {
        String tag = stage.name().tag();
        MDC.put(MDC_STAGE, tag);
        Timer.Sample sample = Timer.start(meters);
        String outcome = "success";
        try {
            O output = stage.execute(ctx, prior);
            if (output == null) {
                throw new StageException("Stage returned no output");
            }
            return output;
        } catch (RuntimeException e) {
            outcome = "fallback";
            log.warn("Stage {} failed for transition {}, using fallback: {}",
                    tag, ctx.transitionId(), e.getMessage());
            meters.counter(STAGE_FALLBACKS, "stage", tag).increment();
            return stage.fallback(ctx, prior);
        } finally {
            sample.stop(meters.timer(STAGE_DURATION, "stage", tag, "outcome", outcome));
            MDC.remove(MDC_STAGE);
        }
    }

    // ------------------------------------------------------------------
    // Result assembly
    // ------------------------------------------------------------------

    /**
     * Build a full result from partial data. Missing parts come from the
     * stage fallbacks (pure, so safe here). scrapedCount counts only real
     * stories.
     */
    private AnalysisResult assemble(AnalysisContext ctx, RunData data) {
        PriorOutputs prior = PriorOutputs.none();

        List<Story> stories = data.stories() != null ? data.stories() : research.fallback(ctx, prior);
        prior = prior.withStories(stories);

        List<SkillGapFinding> gaps = data.skillGaps() != null ? data.skillGaps() : skillGaps.fallback(ctx, prior);
        prior = prior.withSkillGaps(gaps);

        TransitionInsights found = data.insights() != null ? data.insights() : insights.fallback(ctx, prior);
        prior = prior.withInsights(found);

        DevelopmentPlan developmentPlan = data.plan() != null ? data.plan() : plan.fallback(ctx, prior);

        int scraped = data.stories() != null ? data.stories().size() : 0;
        return new AnalysisResult(gaps, found.withPlan(developmentPlan), scraped);
    }
}
