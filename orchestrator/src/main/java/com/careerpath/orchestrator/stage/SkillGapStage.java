package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.extract.Extraction;
import com.careerpath.orchestrator.extract.ExtractionIntent;
import com.careerpath.orchestrator.extract.JsonFields;
import com.careerpath.orchestrator.extract.ResponseExtractor;
import com.careerpath.orchestrator.extract.Shape;
import com.careerpath.orchestrator.model.GapLevel;
import com.careerpath.orchestrator.provider.completion.CompletionService;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the completion provider which skills separate the two roles and
 * stores each normalized finding.
 */
@Component
public class SkillGapStage implements AnalysisStage<List<SkillGapFinding>> {

    private static final Logger log = LoggerFactory.getLogger(SkillGapStage.class);

    private static final String[] NAME       = {"skillName", "skill_name", "skill", "name"};
    private static final String[] LEVEL      = {"gapLevel", "gap_level", "level"};
    private static final String[] CONFIDENCE = {"confidenceScore", "confidence_score", "confidence"};
    private static final String[] MENTIONS   = {"mentionCount", "mention_count", "number_of_mentions", "mentions"};
    private static final String[] CONTEXT    = {"contextSummary", "context_summary", "description"};

    private final CompletionService completion;
    private final AnalysisStore     store;
    private final StagePrompts      prompts;

    public SkillGapStage(CompletionService completion, AnalysisStore store, StagePrompts prompts) {
        this.completion = completion;
        this.store      = store;
        this.prompts    = prompts;
    }

    @Override
    public StageName name() {
        return StageName.SKILL_GAPS;
    }

    @Override
    public List<SkillGapFinding> execute(AnalysisContext ctx, PriorOutputs prior) {
        List<String> roleSkills;
        try {
            roleSkills = store.findRoleSkills(ctx.targetRole());
        } catch (RuntimeException e) {
            log.warn("Could not load known skills for '{}': {}", ctx.targetRole(), e.getMessage());
            roleSkills = List.of();
        }

        String reply = completion.complete(
                prompts.system(StageName.SKILL_GAPS),
                prompts.skillGaps(ctx, prior.stories(), roleSkills));

        Extraction extraction = ResponseExtractor.extract(reply, Shape.ARRAY, ExtractionIntent.SKILL_GAPS);
        List<SkillGapFinding> findings = normalize(extraction.value());
        log.info("Transition {}: {} skill gaps from {} records (tier={})",
                ctx.transitionId(), findings.size(), extraction.value().size(), extraction.tier());
        if (findings.isEmpty()) {
            throw new StageException("No usable skill gaps in response (tier=" + extraction.tier() + ")");
        }

        for (SkillGapFinding finding : findings) {
            try {
                store.createSkillGap(ctx.transitionId(), finding);
            } catch (RuntimeException e) {
                log.warn("Could not store skill gap '{}' for transition {}: {}",
                        finding.skillName(), ctx.transitionId(), e.getMessage());
            }
        }
        return findings;
    }

    @Override
    public List<SkillGapFinding> fallback(AnalysisContext ctx, PriorOutputs prior) {
        return List.of(
                new SkillGapFinding("Technical Skills", GapLevel.MEDIUM, 70, 1,
                        "Core technical skills expected of a " + ctx.targetRole()),
                new SkillGapFinding("Domain Knowledge", GapLevel.HIGH, 80, 2,
                        "Understanding of the domain the " + ctx.targetRole() + " role works in"),
                new SkillGapFinding("Leadership Experience", GapLevel.MEDIUM, 75, 3,
                        "Leading initiatives and influencing without authority"));
    }

    // ------------------------------------------------------------------
    // Normalization
    // ------------------------------------------------------------------

    /**
     * Records without a skill name are dropped. Confidence is clamped to 0-100
     * (70 when absent or not a number), mention count is at least 1.
     */
    static List<SkillGapFinding> normalize(JsonNode records) {
        List<SkillGapFinding> out = new ArrayList<>();
        for (JsonNode record : records) {
            if (record.isTextual() && !record.asText().isBlank()) {
                out.add(new SkillGapFinding(record.asText().strip(), GapLevel.MEDIUM,
                        SkillGapFinding.DEFAULT_CONFIDENCE, 1, null));
                continue;
            }
            JsonFields.text(record, NAME).ifPresent(name -> out.add(new SkillGapFinding(
                    name,
                    GapLevel.fromText(JsonFields.text(record, LEVEL).orElse(null)),
                    JsonFields.integer(record, CONFIDENCE).orElse(SkillGapFinding.DEFAULT_CONFIDENCE),
                    JsonFields.integer(record, MENTIONS).orElse(1),
                    JsonFields.text(record, CONTEXT).orElse(null))));
        }
        return out;
    }
}
