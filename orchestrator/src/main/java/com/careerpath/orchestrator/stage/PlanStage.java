package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.extract.Extraction;
import com.careerpath.orchestrator.extract.ExtractionIntent;
import com.careerpath.orchestrator.extract.JsonFields;
import com.careerpath.orchestrator.extract.ResponseExtractor;
import com.careerpath.orchestrator.extract.Shape;
import com.careerpath.orchestrator.model.Milestone;
import com.careerpath.orchestrator.model.Plan;
import com.careerpath.orchestrator.model.Priority;
import com.careerpath.orchestrator.provider.completion.CompletionService;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the development plan and stores it as plan, milestones, resources.
 *
 * When the provider returns no usable milestone the plan is synthesized from
 * the skill gaps instead, so a stored plan is never empty.
 */
@Component
public class PlanStage implements AnalysisStage<DevelopmentPlan> {

    private static final Logger log = LoggerFactory.getLogger(PlanStage.class);

    static final int DEFAULT_WEEKS        = 4;
    static final int MAX_SYNTHESIZED      = 5;
    static final int MAX_WEEKS            = 520;
    static final String SEARCH_URL        = "https://www.google.com/search?q=";
    static final String COURSE_SEARCH_URL = "https://www.coursera.org/search?query=";

    private static final String[] MILESTONES  = {"milestones", "phases", "steps"};
    private static final String[] TITLE       = {"title", "name", "milestone"};
    private static final String[] DESCRIPTION = {"description", "summary", "details"};
    private static final String[] WEEKS       = {"durationWeeks", "duration_weeks", "weeks"};
    private static final String[] TIMEFRAME   = {"timeframe", "duration"};
    private static final String[] URL         = {"url", "link"};

    private final CompletionService completion;
    private final AnalysisStore     store;
    private final StagePrompts      prompts;

    public PlanStage(CompletionService completion, AnalysisStore store, StagePrompts prompts) {
        this.completion = completion;
        this.store      = store;
        this.prompts    = prompts;
    }

    @Override
    public StageName name() {
        return StageName.PLAN;
    }

    @Override
    public DevelopmentPlan execute(AnalysisContext ctx, PriorOutputs prior) {
        String reply = completion.complete(
                prompts.system(StageName.PLAN),
                prompts.plan(ctx, prior.skillGaps(), prior.insights(), prior.stories()));

        Extraction extraction = ResponseExtractor.extract(reply, Shape.OBJECT, ExtractionIntent.PLAN);
        DevelopmentPlan plan = parse(extraction.value());
        if (plan.milestones().isEmpty()) {
            log.info("Transition {}: no milestones in response (tier={}), synthesizing from {} skill gaps",
                    ctx.transitionId(), extraction.tier(), prior.skillGaps().size());
            plan = synthesize(ctx, prior.skillGaps());
        }
        return persist(ctx.transitionId(), plan);
    }

    @Override
    public DevelopmentPlan fallback(AnalysisContext ctx, PriorOutputs prior) {
        return synthesize(ctx, prior.skillGaps());
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    static DevelopmentPlan parse(JsonNode node) {
        List<PlannedMilestone> milestones = new ArrayList<>();
        JsonFields.array(node, MILESTONES).ifPresent(items -> {
            for (JsonNode item : items) {
                Optional<String> title = JsonFields.text(item, TITLE);
                if (title.isEmpty()) {
                    continue;
                }
                milestones.add(new PlannedMilestone(
                        title.get(),
                        JsonFields.text(item, DESCRIPTION).orElse(null),
                        Priority.fromText(JsonFields.text(item, "priority").orElse(null)),
                        durationWeeks(item),
                        milestones.size() + 1,
                        resources(item)));
            }
        });
        return new DevelopmentPlan(
                JsonFields.text(node, "overview", "summary").orElse(null),
                JsonFields.text(node, "estimatedTimeframe", "estimated_timeframe", "timeframe").orElse(null),
                milestones);
    }

    /**
     * Explicit weeks, else the first number of a timeframe text (months count
     * 4 weeks). Capped at MAX_WEEKS.
     */
    static int durationWeeks(JsonNode milestone) {
        Optional<Integer> weeks = JsonFields.integer(milestone, WEEKS).filter(w -> w > 0);
        if (weeks.isPresent()) {
            return Math.min(weeks.get(), MAX_WEEKS);
        }
        Optional<String> timeframe = JsonFields.text(milestone, TIMEFRAME);
        if (timeframe.isPresent()) {
            long n = JsonFields.firstNumber(timeframe.get()).map(JsonFields::toInt).orElse(0);
            if (n > 0) {
                long total = timeframe.get().toLowerCase(Locale.ROOT).contains("month") ? n * 4 : n;
                return (int) Math.min(total, MAX_WEEKS);
            }
        }
        return DEFAULT_WEEKS;
    }

    /** Milestone-level resources plus those nested under tasks[]. */
    private static List<PlannedResource> resources(JsonNode milestone) {
        List<PlannedResource> out = new ArrayList<>();
        JsonFields.array(milestone, "resources").ifPresent(items -> items.forEach(r -> resource(r).ifPresent(out::add)));
        JsonFields.array(milestone, "tasks").ifPresent(tasks -> {
            for (JsonNode task : tasks) {
                JsonFields.array(task, "resources")
                        .ifPresent(items -> items.forEach(r -> resource(r).ifPresent(out::add)));
            }
        });
        return out;
    }

    static Optional<PlannedResource> resource(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText().strip();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(looksLikeUrl(text)
                    ? new PlannedResource(text, text, "link")
                    : new PlannedResource(text, searchUrl(text), "search"));
        }
        Optional<String> title = JsonFields.text(node, TITLE);
        Optional<String> url = JsonFields.text(node, URL);
        if (title.isEmpty() && url.isEmpty()) {
            return Optional.empty();
        }
        String t = title.orElseGet(url::get);
        return Optional.of(new PlannedResource(t,
                url.orElseGet(() -> searchUrl(t)),
                JsonFields.text(node, "type").orElse("course")));
    }

    private static boolean looksLikeUrl(String text) {
        return text.startsWith("http://") || text.startsWith("https://");
    }

    private static String searchUrl(String title) {
        return SEARCH_URL + URLEncoder.encode(title, StandardCharsets.UTF_8);
    }

    // ------------------------------------------------------------------
    // Synthesis
    // ------------------------------------------------------------------

    /**
     * One milestone per top skill gap (High before Medium before Low, then by
     * confidence), or one generic milestone when there are no gaps.
     */
    static DevelopmentPlan synthesize(AnalysisContext ctx, List<SkillGapFinding> skillGaps) {
        List<SkillGapFinding> top = skillGaps.stream()
                .sorted(Comparator.comparing(SkillGapFinding::gapLevel).reversed()
                        .thenComparing(Comparator.comparingInt(SkillGapFinding::confidenceScore).reversed()))
                .limit(MAX_SYNTHESIZED)
                .toList();

        List<PlannedMilestone> milestones = new ArrayList<>();
        for (SkillGapFinding gap : top) {
            milestones.add(new PlannedMilestone(
                    "Develop " + gap.skillName(),
                    "Close the " + gap.gapLevel().display().toLowerCase(Locale.ROOT) + " gap in "
                            + gap.skillName() + " through coursework and a hands-on project.",
                    Priority.of(gap.gapLevel()),
                    DEFAULT_WEEKS,
                    milestones.size() + 1,
                    List.of(course(gap.skillName()))));
        }
        if (milestones.isEmpty()) {
            milestones.add(new PlannedMilestone(
                    "Build core " + ctx.targetRole() + " skills",
                    "Learn the fundamentals of the " + ctx.targetRole() + " role and apply them in a small project.",
                    Priority.MEDIUM,
                    DEFAULT_WEEKS,
                    1,
                    List.of(course(ctx.targetRole()))));
        }

        int weeks = milestones.size() * DEFAULT_WEEKS;
        return new DevelopmentPlan(
                "Step-by-step plan from " + ctx.currentRole() + " to " + ctx.targetRole()
                        + ", ordered by the most important skill gaps.",
                weeks + " weeks",
                milestones);
    }

    private static PlannedResource course(String topic) {
        return new PlannedResource("Learn " + topic,
                COURSE_SEARCH_URL + URLEncoder.encode(topic, StandardCharsets.UTF_8), "course");
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    /**
     * Plan row failure fails the stage; milestone and resource failures are
     * skipped. Stored milestones are renumbered so their order stays
     * contiguous, and the returned plan holds only what was stored.
     */
    private DevelopmentPlan persist(long transitionId, DevelopmentPlan plan) {
        Plan row = store.createPlan(transitionId);
        List<PlannedMilestone> stored = new ArrayList<>();
        for (PlannedMilestone planned : plan.milestones()) {
            PlannedMilestone milestone = planned.withOrder(stored.size() + 1);
            Milestone m;
            try {
                m = store.createMilestone(row.getId(), milestone);
            } catch (RuntimeException e) {
                log.warn("Could not store milestone '{}' for transition {}: {}",
                        milestone.title(), transitionId, e.getMessage());
                continue;
            }
            stored.add(milestone);
            for (PlannedResource resource : milestone.resources()) {
                try {
                    store.createResource(m.getId(), resource);
                } catch (RuntimeException e) {
                    log.warn("Could not store resource '{}' for milestone {}: {}",
                            resource.title(), m.getId(), e.getMessage());
                }
            }
        }
        log.info("Transition {}: plan {} stored with {}/{} milestones",
                transitionId, row.getId(), stored.size(), plan.milestones().size());
        if (stored.isEmpty()) {
            throw new StageException("No milestone of plan " + row.getId() + " could be stored");
        }
        return new DevelopmentPlan(plan.overview(), plan.estimatedTimeframe(), stored);
    }
}
