package com.careerpath.orchestrator.stage;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * System and user prompts for the completion-backed stages.
 *
 * Each user prompt asks for one JSON value and names its fields; the stages
 * still run every reply through the extractor, since providers drift.
 */
@Component
public class StagePrompts {

    // Per-story cap keeps the prompt well inside the context window
    static final int MAX_STORY_CHARS = 1500;
    static final int MAX_STORIES     = 8;
    static final int PLAN_STORIES    = 3;

    public String system(StageName stage) {
        return switch (stage) {
            case RESEARCH   -> throw new IllegalArgumentException("Research does not use the completion service");
            case SKILL_GAPS -> SKILL_GAP_SYSTEM;
            case INSIGHTS   -> INSIGHT_SYSTEM;
            case PLAN       -> PLAN_SYSTEM;
        };
    }

    public String skillGaps(AnalysisContext ctx, List<Story> stories, List<String> targetRoleSkills) {
        String known = targetRoleSkills.isEmpty()
                ? ""
                : "Skills typically required for " + ctx.targetRole() + ": " + String.join(", ", targetRoleSkills);
        return SKILL_GAP_PROMPT
                .replace("{{CURRENT}}", ctx.currentRole())
                .replace("{{TARGET}}", ctx.targetRole())
                .replace("{{EXISTING}}", existingSkills(ctx))
                .replace("{{KNOWN}}", known)
                .replace("{{STORIES}}", stories(stories, MAX_STORIES));
    }

    public String insights(AnalysisContext ctx, List<Story> stories, List<SkillGapFinding> skillGaps) {
        return INSIGHT_PROMPT
                .replace("{{CURRENT}}", ctx.currentRole())
                .replace("{{TARGET}}", ctx.targetRole())
                .replace("{{STORIES}}", stories(stories, MAX_STORIES))
                .replace("{{GAPS}}", skillGaps(skillGaps));
    }

    public String plan(AnalysisContext ctx, List<SkillGapFinding> skillGaps,
                       TransitionInsights insights, List<Story> stories) {
        String observations = insights == null || insights.keyObservations().isEmpty()
                ? "None"
                : bullets(insights.keyObservations());
        String challenges = insights == null || insights.commonChallenges().isEmpty()
                ? "None"
                : bullets(insights.commonChallenges());
        return PLAN_PROMPT
                .replace("{{CURRENT}}", ctx.currentRole())
                .replace("{{TARGET}}", ctx.targetRole())
                .replace("{{EXISTING}}", existingSkills(ctx))
                .replace("{{GAPS}}", skillGaps(skillGaps))
                .replace("{{OBSERVATIONS}}", observations)
                .replace("{{CHALLENGES}}", challenges)
                .replace("{{STORIES}}", stories(stories, PLAN_STORIES));
    }

    // ------------------------------------------------------------------
    // Formatting
    // ------------------------------------------------------------------

    private static String existingSkills(AnalysisContext ctx) {
        return ctx.existingSkills().isEmpty() ? "None provided" : String.join(", ", ctx.existingSkills());
    }

    private static String stories(List<Story> stories, int limit) {
        if (stories.isEmpty()) {
            return "No stories found.";
        }
        return stories.stream()
                .limit(limit)
                .map(s -> "[" + s.source() + "] " + clip(s.content()))
                .collect(Collectors.joining("\n\n"));
    }

    private static String skillGaps(List<SkillGapFinding> gaps) {
        if (gaps.isEmpty()) {
            return "None identified.";
        }
        return gaps.stream()
                .map(g -> "- %s (gap: %s, confidence: %d)".formatted(
                        g.skillName(), g.gapLevel().display(), g.confidenceScore()))
                .collect(Collectors.joining("\n"));
    }

    private static String bullets(List<String> items) {
        return items.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
    }

    private static String clip(String text) {
        return text.length() <= MAX_STORY_CHARS ? text : text.substring(0, MAX_STORY_CHARS) + "...";
    }

    // ------------------------------------------------------------------
    // Prompts  ({{...}} placeholders are replaced per call)
    // ------------------------------------------------------------------

    private static final String SKILL_GAP_SYSTEM =
            "You are a career skills analyst who identifies skill gaps between roles.";

    private static final String INSIGHT_SYSTEM =
            "You are a career insights specialist who extracts patterns and observations from transition data.";

    private static final String PLAN_SYSTEM =
            "You are a career development expert who creates specific, actionable transition plans.";

    private static final String SKILL_GAP_PROMPT = """
            Analyze the skill gaps for a transition from {{CURRENT}} to {{TARGET}}.

            The user's existing skills: {{EXISTING}}
            {{KNOWN}}

            Transition stories:
            {{STORIES}}

            Instructions:
            1. Identify which skills the target role needs that the user does not have yet.
            2. Focus on the gaps most critical for a successful transition.
            3. Prefer skills mentioned repeatedly in the stories.
            4. Include both technical and soft skills.

            Return ONLY a JSON array. Each element:
            {
              "skillName": "specific, actionable skill",
              "gapLevel": "Low" | "Medium" | "High",
              "confidenceScore": 0-100,
              "mentionCount": number of stories mentioning it (at least 1),
              "contextSummary": "why it matters for this transition"
            }
            """;

    private static final String INSIGHT_PROMPT = """
            Generate career transition insights for moving from {{CURRENT}} to {{TARGET}}.

            Stories:
            {{STORIES}}

            Skill gaps:
            {{GAPS}}

            Return ONLY a JSON object:
            {
              "keyObservations": ["3-5 observations"],
              "commonChallenges": ["3-5 challenges"],
              "successRate": estimated percentage as a number,
              "timeframe": "typical duration, e.g. 6-12 months",
              "successFactors": ["3-5 factors"]
            }
            """;

    private static final String PLAN_PROMPT = """
            Create a practical development plan for the transition from {{CURRENT}} to {{TARGET}}.

            The user's existing skills: {{EXISTING}}

            Skill gaps to address:
            {{GAPS}}

            Key observations:
            {{OBSERVATIONS}}

            Common challenges:
            {{CHALLENGES}}

            Stories from people who made this move:
            {{STORIES}}

            Requirements:
            - 4-5 milestones, most important first, each with a realistic duration in weeks.
            - At least one concrete learning resource per milestone, with its full URL.

            Return ONLY a JSON object:
            {
              "overview": "brief strategy",
              "estimatedTimeframe": "X-Y months",
              "milestones": [
                {
                  "title": "milestone title",
                  "description": "what done looks like",
                  "priority": "Low" | "Medium" | "High",
                  "durationWeeks": 4,
                  "resources": [
                    {"title": "resource name", "url": "https://...", "type": "course | video | book | article"}
                  ]
                }
              ]
            }
            """;
}
