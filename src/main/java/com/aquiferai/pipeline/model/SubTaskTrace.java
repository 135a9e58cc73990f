package com.aquiferai.pipeline.model;

import org.springframework.lang.Nullable;

public record SubTaskTrace(
        String subTaskId,
        String description,
        String query,
        String finalQuery,
        ValidationStatus status,
        int retryCount,
        @Nullable Long executionTimeMs,
        int rowCount,
        @Nullable String errorMessage
) {
}
