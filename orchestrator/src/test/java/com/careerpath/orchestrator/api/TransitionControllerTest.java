package com.careerpath.orchestrator.api;

import com.careerpath.orchestrator.model.GapLevel;
import com.careerpath.orchestrator.model.Insight;
import com.careerpath.orchestrator.model.InsightType;
import com.careerpath.orchestrator.model.Milestone;
import com.careerpath.orchestrator.model.Plan;
import com.careerpath.orchestrator.model.Priority;
import com.careerpath.orchestrator.model.Resource;
import com.careerpath.orchestrator.model.ScrapedData;
import com.careerpath.orchestrator.model.SkillGap;
import com.careerpath.orchestrator.model.Transition;
import com.careerpath.orchestrator.progress.AnalysisPhase;
import com.careerpath.orchestrator.progress.RunData;
import com.careerpath.orchestrator.progress.RunState;
import com.careerpath.orchestrator.progress.RunStatus;
import com.careerpath.orchestrator.repository.TransitionNotFoundException;
import com.careerpath.orchestrator.service.StoredAnalysis;
import com.careerpath.orchestrator.service.TransitionService;
import com.careerpath.orchestrator.stage.Story;
import com.careerpath.orchestrator.stage.TransitionInsights;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TransitionController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no providers, no workers).
 * TransitionService is replaced by a mock.
 */
@WebMvcTest(TransitionController.class)
class TransitionControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TransitionService transitionService;

    // ------------------------------------------------------------------
    // POST /transitions
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns202() throws Exception {
        Transition t = fakeTransition(1L);
        when(transitionService.submit(eq("Data Analyst"), eq("Data Scientist"), any())).thenReturn(t);
        when(transitionService.progress(1L)).thenReturn(Optional.empty());

        mockMvc.perform(post("/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"currentRole":"Data Analyst","targetRole":"Data Scientist","existingSkills":["SQL"]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.complete").value(false))
                .andExpect(jsonPath("$.progress.status").value("IDLE"));
    }

    @Test
    void submit_blankRole_returns400() throws Exception {
        mockMvc.perform(post("/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"currentRole":"  ","targetRole":"Data Scientist"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(transitionService);
    }

    @Test
    void submit_missingTargetRole_returns400() throws Exception {
        mockMvc.perform(post("/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"currentRole":"Journalist"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /transitions/{id}
    // ------------------------------------------------------------------

    @Test
    void getTransition_inProgress_returnsPhaseAndCounts() throws Exception {
        Transition t = fakeTransition(7L);
        RunState state = new RunState(7L, 1L, RunStatus.IN_PROGRESS, AnalysisPhase.ANALYZING_GAPS,
                RunData.ofStories(List.of(new Story("blog", "a", null, null), new Story("forum", "b", null, null))),
                Instant.now());
        when(transitionService.findById(7L)).thenReturn(Optional.of(t));
        when(transitionService.progress(7L)).thenReturn(Optional.of(state));

        mockMvc.perform(get("/transitions/{id}", 7L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentRole").value("Data Analyst"))
                .andExpect(jsonPath("$.progress.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.progress.phase").value("ANALYZING_GAPS"))
                .andExpect(jsonPath("$.progress.stories").value(2))
                .andExpect(jsonPath("$.progress.skillGaps").value(0));
    }

    @Test
    void getTransition_unknownId_returns404() throws Exception {
        when(transitionService.findById(anyLong())).thenReturn(Optional.empty());

        mockMvc.perform(get("/transitions/{id}", 99L))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /transitions/{id}/analysis
    // ------------------------------------------------------------------

    @Test
    void getAnalysis_returnsStoredResultsWithOutlook() throws Exception {
        Transition t = fakeTransition(5L);
        Plan plan = withId(new Plan(5L), 50L);
        Milestone sql = withId(new Milestone(plan, "Learn SQL", "Joins and window functions",
                Priority.HIGH, 6, 1), 51L);
        StoredAnalysis stored = new StoredAnalysis(
                t,
                List.of(new ScrapedData(5L, "Reddit", "It took me a year.", "https://www.reddit.com/r/ds/1", "2024-01-10")),
                List.of(new SkillGap(5L, "SQL", GapLevel.HIGH, 80, 3, "Mentioned in most stories")),
                List.of(new Insight(5L, InsightType.OBSERVATION, "Portfolios matter", "analysis", null),
                        new Insight(5L, InsightType.CHALLENGE, "Imposter syndrome", "analysis", null)),
                plan,
                List.of(new StoredAnalysis.PlanStep(sql,
                        List.of(new Resource(sql, "SQLBolt", "https://sqlbolt.com", "tutorial")))),
                new TransitionInsights(List.of("Portfolios matter"), List.of("Imposter syndrome"),
                        60, "6-12 months", List.of("Networking"), null));
        when(transitionService.results(5L)).thenReturn(Optional.of(stored));
        when(transitionService.progress(5L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/transitions/{id}/analysis", 5L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transitionId").value(5))
                .andExpect(jsonPath("$.progress.status").value("IDLE"))
                .andExpect(jsonPath("$.skillGaps[0].skillName").value("SQL"))
                .andExpect(jsonPath("$.skillGaps[0].gapLevel").value("High"))
                .andExpect(jsonPath("$.keyObservations[0]").value("Portfolios matter"))
                .andExpect(jsonPath("$.commonChallenges[0]").value("Imposter syndrome"))
                .andExpect(jsonPath("$.successRate").value(60))
                .andExpect(jsonPath("$.successFactors[0]").value("Networking"))
                .andExpect(jsonPath("$.plan.id").value(50))
                .andExpect(jsonPath("$.plan.milestones[0].title").value("Learn SQL"))
                .andExpect(jsonPath("$.plan.milestones[0].order").value(1))
                .andExpect(jsonPath("$.plan.milestones[0].priority").value("HIGH"))
                .andExpect(jsonPath("$.plan.milestones[0].resources[0].url").value("https://sqlbolt.com"))
                .andExpect(jsonPath("$.stories[0].source").value("Reddit"));
    }

    @Test
    void getAnalysis_nothingStoredYet_returnsEmptyResults() throws Exception {
        Transition t = fakeTransition(6L);
        when(transitionService.results(6L)).thenReturn(Optional.of(
                new StoredAnalysis(t, List.of(), List.of(), List.of(), null, List.of(), null)));
        when(transitionService.progress(6L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/transitions/{id}/analysis", 6L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skillGaps").isEmpty())
                .andExpect(jsonPath("$.plan").doesNotExist())
                .andExpect(jsonPath("$.successRate").doesNotExist());
    }

    @Test
    void getAnalysis_unknownId_returns404() throws Exception {
        when(transitionService.results(anyLong())).thenReturn(Optional.empty());

        mockMvc.perform(get("/transitions/{id}/analysis", 99L))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /transitions/{id}/analysis
    // ------------------------------------------------------------------

    @Test
    void reanalyze_forceRefresh_returns202() throws Exception {
        Transition t = fakeTransition(3L);
        when(transitionService.reanalyze(3L, true)).thenReturn(t);
        when(transitionService.progress(3L)).thenReturn(Optional.empty());

        mockMvc.perform(post("/transitions/{id}/analysis", 3L).param("forceRefresh", "true"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(3));

        verify(transitionService).reanalyze(3L, true);
    }

    @Test
    void reanalyze_unknownId_returns404() throws Exception {
        when(transitionService.reanalyze(99L, false)).thenThrow(new TransitionNotFoundException(99L));

        mockMvc.perform(post("/transitions/{id}/analysis", 99L))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Transition fakeTransition(long id) {
        return withId(new Transition("Data Analyst", "Data Scientist", List.of("SQL")), id);
    }

    private static <T> T withId(T entity, long id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
