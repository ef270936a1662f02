package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.extract.Extraction;
import com.careerpath.orchestrator.extract.ExtractionIntent;
import com.careerpath.orchestrator.extract.JsonFields;
import com.careerpath.orchestrator.extract.ResponseExtractor;
import com.careerpath.orchestrator.extract.Shape;
import com.careerpath.orchestrator.model.InsightType;
import com.careerpath.orchestrator.provider.completion.CompletionService;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns stories and skill gaps into observations, challenges and an
 * outlook (success rate, timeframe, success factors).
 */
@Component
public class InsightStage implements AnalysisStage<TransitionInsights> {

    private static final Logger log = LoggerFactory.getLogger(InsightStage.class);

    static final String SOURCE = "analysis";

    private static final String[] OBSERVATIONS = {"keyObservations", "key_observations", "observations"};
    private static final String[] CHALLENGES   = {"commonChallenges", "common_challenges", "challenges"};
    private static final String[] FACTORS      = {"successFactors", "success_factors", "factors"};
    private static final String[] RATE         = {"successRate", "success_rate", "estimatedSuccessRate"};
    private static final String[] TIMEFRAME    = {"timeframe", "timeFrame", "typicalTimeframe", "typical_timeframe"};
    private static final String[] ITEM_TEXT    = {"text", "content", "description", "observation", "challenge", "factor", "title"};

    private final CompletionService completion;
    private final AnalysisStore     store;
    private final StagePrompts      prompts;

    public InsightStage(CompletionService completion, AnalysisStore store, StagePrompts prompts) {
        this.completion = completion;
        this.store      = store;
        this.prompts    = prompts;
    }

    @Override
    public StageName name() {
        return StageName.INSIGHTS;
    }

    @Override
    public TransitionInsights execute(AnalysisContext ctx, PriorOutputs prior) {
        String reply = completion.complete(
                prompts.system(StageName.INSIGHTS),
                prompts.insights(ctx, prior.stories(), prior.skillGaps()));

        Extraction extraction = ResponseExtractor.extract(reply, Shape.OBJECT, ExtractionIntent.INSIGHTS);
        TransitionInsights insights = parse(extraction.value());
        log.info("Transition {}: {} observations, {} challenges (tier={})", ctx.transitionId(),
                insights.keyObservations().size(), insights.commonChallenges().size(), extraction.tier());
        if (insights.keyObservations().isEmpty() && insights.commonChallenges().isEmpty()) {
            throw new StageException("No observations or challenges in response (tier=" + extraction.tier() + ")");
        }

        insights.keyObservations().forEach(o -> persist(ctx.transitionId(), InsightType.OBSERVATION, o));
        insights.commonChallenges().forEach(c -> persist(ctx.transitionId(), InsightType.CHALLENGE, c));
        return insights;
    }

    @Override
    public TransitionInsights fallback(AnalysisContext ctx, PriorOutputs prior) {
        return new TransitionInsights(
                List.of("Most successful transitions from " + ctx.currentRole() + " to " + ctx.targetRole()
                                + " take 6-12 months",
                        "Building a portfolio of relevant projects is critical",
                        "Networking with professionals already in the target role increases success rate"),
                List.of("Adapting to new technical requirements",
                        "Building required domain knowledge",
                        "Demonstrating leadership capabilities"),
                65,
                "6-12 months",
                List.of("Continuously expanding technical skills",
                        "Building a professional network",
                        "Creating a portfolio of relevant projects",
                        "Understanding company-specific culture and processes"),
                null);
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    static TransitionInsights parse(JsonNode node) {
        JsonNode root = node;
        // {"insights": {...}}
        if (JsonFields.array(root, OBSERVATIONS).isEmpty() && JsonFields.array(root, CHALLENGES).isEmpty()
                && root.path("insights").isObject()) {
            root = root.get("insights");
        }
        Integer rate = JsonFields.integer(root, RATE)
                .map(r -> Math.max(0, Math.min(100, r)))
                .orElse(null);
        return new TransitionInsights(
                strings(root, OBSERVATIONS),
                strings(root, CHALLENGES),
                rate,
                timeframe(root),
                strings(root, FACTORS),
                null);
    }

    /** Array items may be plain strings or objects with a text-like field. */
    private static List<String> strings(JsonNode node, String... names) {
        List<String> out = new ArrayList<>();
        JsonFields.array(node, names).ifPresent(items -> {
            for (JsonNode item : items) {
                if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                    out.add(item.asText().strip());
                } else if (item.isObject()) {
                    JsonFields.text(item, ITEM_TEXT).ifPresent(out::add);
                }
            }
        });
        return out;
    }

    /** A bare number is read as months. */
    private static String timeframe(JsonNode node) {
        for (String name : TIMEFRAME) {
            JsonNode value = node.get(name);
            if (value != null && value.isNumber()) {
                return JsonFields.toInt(value.asDouble()) + " months";
            }
        }
        return JsonFields.text(node, TIMEFRAME).orElse(null);
    }

    private void persist(long transitionId, InsightType type, String content) {
        try {
            store.createInsight(transitionId, type, content, SOURCE, null);
        } catch (RuntimeException e) {
            log.warn("Could not store {} insight for transition {}: {}", type.value(), transitionId, e.getMessage());
        }
    }
}
