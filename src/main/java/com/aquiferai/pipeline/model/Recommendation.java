package com.aquiferai.pipeline.model;

/**
 * A suggested action; priority runs from 1 (most urgent) to 5.
 */
public record Recommendation(
        String action,
        String rationale,
        int priority
) {

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;

    public Recommendation {
        if (priority < HIGHEST_PRIORITY) {
            priority = HIGHEST_PRIORITY;
        } else if (priority > LOWEST_PRIORITY) {
            priority = LOWEST_PRIORITY;
        }
    }
}
