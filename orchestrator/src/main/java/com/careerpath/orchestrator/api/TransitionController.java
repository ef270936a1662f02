package com.careerpath.orchestrator.api;

import com.careerpath.orchestrator.api.dto.AnalysisResponse;
import com.careerpath.orchestrator.api.dto.ProgressResponse;
import com.careerpath.orchestrator.api.dto.SubmitTransitionRequest;
import com.careerpath.orchestrator.api.dto.TransitionResponse;
import com.careerpath.orchestrator.model.Transition;
import com.careerpath.orchestrator.repository.TransitionNotFoundException;
import com.careerpath.orchestrator.service.TransitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for career transition analyses.
 *
 * POST /transitions                 : create a transition and start its analysis
 * GET  /transitions/{id}            : the transition plus progress of its latest run
 * GET  /transitions/{id}/analysis   : stored results (skill gaps, insights, plan, stories)
 * POST /transitions/{id}/analysis   : run the analysis again (?forceRefresh=true clears stored results)
 */
@RestController
@RequestMapping("/transitions")
public class TransitionController {

    private final TransitionService transitionService;

    public TransitionController(TransitionService transitionService) {
        this.transitionService = transitionService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/transitions \
     *     -H "Content-Type: application/json" \
     *     -d '{"currentRole":"Data Analyst","targetRole":"Data Scientist","existingSkills":["SQL"]}'
     */
    @PostMapping
    public ResponseEntity<TransitionResponse> submit(@RequestBody SubmitTransitionRequest req) {
        if (isBlank(req.currentRole()) || isBlank(req.targetRole())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "currentRole and targetRole are required");
        }
        Transition t = transitionService.submit(req.currentRole(), req.targetRole(), req.existingSkills());
        return ResponseEntity.accepted().body(view(t));
    }

    /** Returns 404 if the transition ID is not found. */
    @GetMapping("/{id}")
    public TransitionResponse getTransition(@PathVariable long id) {
        return transitionService.findById(id)
                .map(this::view)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Transition not found: " + id));
    }

    /** Returns 404 if the transition ID is not found. */
    @GetMapping("/{id}/analysis")
    public AnalysisResponse getAnalysis(@PathVariable long id) {
        return transitionService.results(id)
                .map(a -> AnalysisResponse.from(a, progressOf(id)))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Transition not found: " + id));
    }

    @PostMapping("/{id}/analysis")
    public ResponseEntity<TransitionResponse> reanalyze(@PathVariable long id,
                                                        @RequestParam(defaultValue = "false") boolean forceRefresh) {
        try {
            Transition t = transitionService.reanalyze(id, forceRefresh);
            return ResponseEntity.accepted().body(view(t));
        } catch (TransitionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    private TransitionResponse view(Transition t) {
        return TransitionResponse.from(t, progressOf(t.getId()));
    }

    private ProgressResponse progressOf(long id) {
        return transitionService.progress(id)
                .map(ProgressResponse::from)
                .orElseGet(ProgressResponse::idle);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
