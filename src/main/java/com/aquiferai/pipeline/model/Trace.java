package com.aquiferai.pipeline.model;

import java.util.List;

public record Trace(
        QueryPlan plan,
        List<SubTaskTrace> subTaskOutcomes,
        int totalRetries,
        long totalTimeMs
) {
}
