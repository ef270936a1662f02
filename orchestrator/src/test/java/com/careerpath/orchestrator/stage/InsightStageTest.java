package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.model.Insight;
import com.careerpath.orchestrator.model.InsightType;
import com.careerpath.orchestrator.provider.completion.CompletionService;
import com.careerpath.orchestrator.support.InMemoryAnalysisStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InsightStageTest {

    private static final long ID = 11L;

    @Mock CompletionService completion;

    InMemoryAnalysisStore store;
    InsightStage stage;
    AnalysisContext ctx;

    @BeforeEach
    void setUp() {
        store = new InMemoryAnalysisStore();
        store.addTransition(ID, "Journalist", "UX Designer");
        stage = new InsightStage(completion, store, new StagePrompts());
        ctx = new AnalysisContext(ID, "Journalist", "UX Designer", List.of());
    }

    @Test
    void execute_fullObject_isParsedAndPersisted() {
        when(completion.complete(anyString(), anyString())).thenReturn("""
                Sure! Here is the analysis:
                {
                  "keyObservations": ["Portfolios matter more than degrees", "Research skills transfer well"],
                  "commonChallenges": ["Learning Figma"],
                  "successRate": "70%",
                  "timeframe": "9-12 months",
                  "successFactors": ["Mentorship"]
                }
                """);

        TransitionInsights insights = stage.execute(ctx, PriorOutputs.none());

        assertThat(insights.keyObservations()).hasSize(2);
        assertThat(insights.commonChallenges()).containsExactly("Learning Figma");
        assertThat(insights.successRate()).isEqualTo(70);
        assertThat(insights.timeframe()).isEqualTo("9-12 months");
        assertThat(insights.successFactors()).containsExactly("Mentorship");
        assertThat(insights.plan()).isNull();

        assertThat(store.getInsightsByTransitionId(ID))
                .extracting(Insight::getType)
                .containsExactly(InsightType.OBSERVATION, InsightType.OBSERVATION, InsightType.CHALLENGE);
        assertThat(store.getInsightsByTransitionId(ID))
                .extracting(Insight::getSource)
                .containsOnly(InsightStage.SOURCE);
    }

    @Test
    void execute_variantFieldsAndObjectItems_areAccepted() {
        when(completion.complete(anyString(), anyString())).thenReturn("""
                {"insights": {
                  "key_observations": [{"text": "Bootcamps help"}, "Networking is key"],
                  "challenges": [{"description": "Imposter syndrome"}],
                  "success_rate": 140,
                  "timeframe": 8
                }}
                """);

        TransitionInsights insights = stage.execute(ctx, PriorOutputs.none());

        assertThat(insights.keyObservations()).containsExactly("Bootcamps help", "Networking is key");
        assertThat(insights.commonChallenges()).containsExactly("Imposter syndrome");
        assertThat(insights.successRate()).isEqualTo(100);
        assertThat(insights.timeframe()).isEqualTo("8 months");
    }

    @Test
    void execute_onlyChallenges_isEnough() {
        when(completion.complete(anyString(), anyString()))
                .thenReturn("{\"commonChallenges\": [\"Salary cut\"]}");

        TransitionInsights insights = stage.execute(ctx, PriorOutputs.none());

        assertThat(insights.keyObservations()).isEmpty();
        assertThat(insights.successRate()).isNull();
        assertThat(store.getInsightsByTransitionId(ID)).hasSize(1);
    }

    @Test
    void execute_nothingRecovered_throwsStageException() {
        when(completion.complete(anyString(), anyString())).thenReturn("No insights available right now.");

        assertThatThrownBy(() -> stage.execute(ctx, PriorOutputs.none())).isInstanceOf(StageException.class);
        assertThat(store.getInsightsByTransitionId(ID)).isEmpty();
    }

    @Test
    void fallback_isFixedAndMentionsRoles() {
        TransitionInsights insights = stage.fallback(ctx, PriorOutputs.none());

        assertThat(insights.keyObservations()).hasSize(3);
        assertThat(insights.keyObservations().get(0)).contains("Journalist").contains("UX Designer");
        assertThat(insights.commonChallenges()).hasSize(3);
        assertThat(insights.successRate()).isEqualTo(65);
        assertThat(insights.timeframe()).isEqualTo("6-12 months");
        assertThat(insights.successFactors()).hasSize(4);
    }
}
