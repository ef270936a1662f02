package com.careerpath.orchestrator.stage;

import java.util.List;

/**
 * Narrative findings for a transition. successRate and timeframe are optional;
 * plan is attached by the orchestrator once the plan stage has run.
 */
public record TransitionInsights(List<String> keyObservations,
                                 List<String> commonChallenges,
                                 Integer successRate,
                                 String timeframe,
                                 List<String> successFactors,
                                 DevelopmentPlan plan) {

    public TransitionInsights {
        keyObservations  = keyObservations == null ? List.of() : List.copyOf(keyObservations);
        commonChallenges = commonChallenges == null ? List.of() : List.copyOf(commonChallenges);
        successFactors   = successFactors == null ? List.of() : List.copyOf(successFactors);
    }

    public TransitionInsights withPlan(DevelopmentPlan plan) {
        return new TransitionInsights(keyObservations, commonChallenges, successRate, timeframe, successFactors, plan);
    }
}
