package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.model.ValidationStatus;
import org.springframework.lang.Nullable;

/**
 * State of the validate-and-heal loop for one candidate query.
 * <p>
 * {@code PENDING} means the current query text still has to be checked and executed,
 * {@code HEALING} means it failed and a repaired text is awaited. {@code VALID} and {@code FAILED}
 * are absorbing: every transition applied to them returns the same state. Transitions are pure,
 * so the loop can be driven and tested without a model or a store.
 */
public record HealingState(
        Phase phase,
        int attempt,
        String query,
        @Nullable ValidationStatus failureStatus,
        @Nullable String errorMessage,
        @Nullable Long executionTimeMs
) {

    public enum Phase {
        PENDING,
        HEALING,
        VALID,
        FAILED
    }

    public static HealingState pending(String query) {
        return new HealingState(Phase.PENDING, 0, query, null, null, null);
    }

    public boolean isTerminal() {
        return phase == Phase.VALID || phase == Phase.FAILED;
    }

    /**
     * The current text passed the checks and ran.
     */
    public HealingState executed(long elapsedMs) {
        if (phase != Phase.PENDING) {
            return this;
        }
        return new HealingState(Phase.VALID, attempt, query, null, null, elapsedMs);
    }

    /**
     * The current text failed a check or execution. Moves to {@code HEALING} while retries remain,
     * otherwise to {@code FAILED}.
     */
    public HealingState failed(ValidationStatus status, String message, @Nullable Long elapsedMs, int maxRetries) {
        if (phase != Phase.PENDING) {
            return this;
        }
        Phase next = attempt >= maxRetries ? Phase.FAILED : Phase.HEALING;
        return new HealingState(next, attempt, query, status, message, elapsedMs);
    }

    /**
     * A repaired text arrived; it is checked as the next attempt.
     */
    public HealingState repaired(String replacement) {
        if (phase != Phase.HEALING) {
            return this;
        }
        return new HealingState(Phase.PENDING, attempt + 1, replacement, null, null, null);
    }

    /**
     * Stops the loop with the last known failure, used when the run is cancelled.
     */
    public HealingState abandon(String reason) {
        if (isTerminal()) {
            return this;
        }
        ValidationStatus status = failureStatus != null ? failureStatus : ValidationStatus.EXECUTION_ERROR;
        String message = errorMessage != null ? errorMessage + " (" + reason + ")" : reason;
        return new HealingState(Phase.FAILED, attempt, query, status, message, executionTimeMs);
    }
}
