package com.z254.butterfly.triage.correlation;

/**
 * Most likely root cause among the correlated incidents of a target.
 *
 * @param rootCauseGroupId null when nothing correlates
 */
public record RootCauseSuggestion(String rootCauseGroupId, double confidence, String explanation) {

    static final String NO_CORRELATIONS = "No correlated alerts found";

    static RootCauseSuggestion none() {
        return new RootCauseSuggestion(null, 0, NO_CORRELATIONS);
    }
}
