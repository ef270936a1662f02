package com.careerpath.orchestrator.stage;

import java.util.Locale;

/**
 * The four pipeline stages, in execution order.
 */
public enum StageName {
    RESEARCH,
    SKILL_GAPS,
    INSIGHTS,
    PLAN;

    /** Lower-case form used as a metric tag and MDC value. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
