package com.aquiferai.pipeline.model;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Final result of validating one candidate query. Rows are present exactly when the status is
 * {@link ValidationStatus#VALID}; a query that was never healed keeps its original text.
 */
public record ValidationOutcome(
        String subTaskId,
        ValidationStatus status,
        String originalQuery,
        String finalQuery,
        @Nullable String errorMessage,
        @Nullable List<Map<String, Object>> rows,
        @Nullable Long executionTimeMs,
        int retryCount
) {

    public ValidationOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if ((status == ValidationStatus.VALID) != (rows != null)) {
            throw new IllegalArgumentException("rows must be present exactly for VALID outcomes");
        }
        if (retryCount == 0 && finalQuery != null && !finalQuery.equals(originalQuery)) {
            throw new IllegalArgumentException("finalQuery must equal originalQuery when nothing was healed");
        }
        rows = rows != null ? List.copyOf(rows) : null;
    }

    public static ValidationOutcome valid(String subTaskId, String originalQuery, String finalQuery,
                                          List<Map<String, Object>> rows, long executionTimeMs, int retryCount) {
        return new ValidationOutcome(subTaskId, ValidationStatus.VALID, originalQuery, finalQuery, null, rows,
                executionTimeMs, retryCount);
    }

    public static ValidationOutcome failed(String subTaskId, ValidationStatus status, String originalQuery,
                                           String finalQuery, String errorMessage,
                                           @Nullable Long executionTimeMs, int retryCount) {
        return new ValidationOutcome(subTaskId, status, originalQuery, finalQuery, errorMessage, null,
                executionTimeMs, retryCount);
    }

    public boolean isValid() {
        return status == ValidationStatus.VALID;
    }

    public int rowCount() {
        return rows != null ? rows.size() : 0;
    }
}
