package com.careerpath.orchestrator.extract;

/**
 * Which step of the extraction cascade produced the value.
 * Logged by callers so we can see how often providers drift off-format.
 */
public enum ExtractionTier {
    DIRECT,       // raw text parsed as-is
    SANITIZED,    // parsed after textual repairs
    FENCED,       // parsed from a ``` code fence
    REGION,       // parsed from the outermost [...] / {...} region
    LABELLED,     // assembled from "Label: value" lines
    FALLBACK      // nothing usable, typed empty value returned
}
