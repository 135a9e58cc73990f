package com.aquiferai.pipeline.model;

public record RunMetadata(
        QueryComplexity complexity,
        int queriesExecuted,
        int totalRetries,
        boolean allQueriesValid,
        boolean escalated,
        long totalTimeMs
) {
}
