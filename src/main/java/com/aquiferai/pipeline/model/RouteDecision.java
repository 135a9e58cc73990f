package com.aquiferai.pipeline.model;

import java.util.List;

/**
 * Routing after validation. Every decision proceeds to synthesis; the decision only changes how
 * prominently failed sub-tasks are reported.
 */
public enum RouteDecision {
    /** Every sub-task validated. */
    ALL_VALID,
    /** Some sub-tasks failed, fewer than succeeded. */
    PARTIAL_FAILURE,
    /** At least as many sub-tasks failed as succeeded. */
    FAILURES_DOMINATE;

    public static RouteDecision of(List<ValidationOutcome> outcomes) {
        long valid = outcomes.stream().filter(ValidationOutcome::isValid).count();
        long failed = outcomes.size() - valid;
        if (failed == 0) {
            return ALL_VALID;
        }
        return failed < valid ? PARTIAL_FAILURE : FAILURES_DOMINATE;
    }

    public boolean escalates() {
        return this != ALL_VALID;
    }
}
