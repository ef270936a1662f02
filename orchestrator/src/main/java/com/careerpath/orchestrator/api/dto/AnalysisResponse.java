package com.careerpath.orchestrator.api.dto;

import com.careerpath.orchestrator.model.Insight;
import com.careerpath.orchestrator.model.InsightType;
import com.careerpath.orchestrator.model.Milestone;
import com.careerpath.orchestrator.model.Resource;
import com.careerpath.orchestrator.model.ScrapedData;
import com.careerpath.orchestrator.model.SkillGap;
import com.careerpath.orchestrator.service.StoredAnalysis;
import com.careerpath.orchestrator.stage.TransitionInsights;

import java.time.Instant;
import java.util.List;

/**
 * Response body for GET /transitions/{id}/analysis: the stored results of a
 * transition. plan is null until one has been stored; successRate,
 * timeframe and successFactors are null when this process has not run the
 * analysis.
 */
public record AnalysisResponse(
        Long                 transitionId,
        String               currentRole,
        String               targetRole,
        boolean              complete,
        ProgressResponse     progress,
        List<SkillGapView>   skillGaps,
        List<String>         keyObservations,
        List<String>         commonChallenges,
        Integer              successRate,
        String               timeframe,
        List<String>         successFactors,
        PlanView             plan,
        List<StoryView>      stories
) {
    public static AnalysisResponse from(StoredAnalysis a, ProgressResponse progress) {
        TransitionInsights outlook = a.outlook();
        return new AnalysisResponse(
                a.transition().getId(),
                a.transition().getCurrentRole(),
                a.transition().getTargetRole(),
                a.transition().isComplete(),
                progress,
                a.skillGaps().stream().map(SkillGapView::from).toList(),
                contents(a.insights(), InsightType.OBSERVATION),
                contents(a.insights(), InsightType.CHALLENGE),
                outlook == null ? null : outlook.successRate(),
                outlook == null ? null : outlook.timeframe(),
                outlook == null ? null : outlook.successFactors(),
                a.plan() == null ? null : new PlanView(
                        a.plan().getId(),
                        a.plan().getCreatedAt(),
                        a.milestones().stream().map(MilestoneView::from).toList()),
                a.stories().stream().map(StoryView::from).toList()
        );
    }

    private static List<String> contents(List<Insight> insights, InsightType type) {
        return insights.stream()
                .filter(i -> i.getType() == type)
                .map(Insight::getContent)
                .toList();
    }

    // ------------------------------------------------------------------
    // Nested views
    // ------------------------------------------------------------------

    public record SkillGapView(String skillName, String gapLevel, int confidenceScore,
                               int mentionCount, String contextSummary) {
        static SkillGapView from(SkillGap g) {
            return new SkillGapView(g.getSkillName(), g.getGapLevel().display(), g.getConfidenceScore(),
                    g.getMentionCount(), g.getContextSummary());
        }
    }

    public record PlanView(Long id, Instant createdAt, List<MilestoneView> milestones) {
    }

    public record MilestoneView(String title, String description, String priority, int durationWeeks,
                                int order, int progress, List<ResourceView> resources) {
        static MilestoneView from(StoredAnalysis.PlanStep step) {
            Milestone m = step.milestone();
            return new MilestoneView(m.getTitle(), m.getDescription(), m.getPriority().name(),
                    m.getDurationWeeks(), m.getOrder(), m.getProgress(),
                    step.resources().stream().map(ResourceView::from).toList());
        }
    }

    public record ResourceView(String title, String url, String type) {
        static ResourceView from(Resource r) {
            return new ResourceView(r.getTitle(), r.getUrl(), r.getType());
        }
    }

    public record StoryView(String source, String content, String url, String date) {
        static StoryView from(ScrapedData s) {
            return new StoryView(s.getSource(), s.getContent(), s.getUrl(), s.getPostDate());
        }
    }
}
