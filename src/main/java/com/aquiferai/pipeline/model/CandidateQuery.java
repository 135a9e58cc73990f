package com.aquiferai.pipeline.model;

import java.util.List;

/**
 * A generated query for one sub-task. Healing produces new instances rather than changing this one.
 */
public record CandidateQuery(
        String subTaskId,
        String queryText,
        String explanation,
        List<String> expectedColumns
) {

    public CandidateQuery {
        expectedColumns = expectedColumns != null ? List.copyOf(expectedColumns) : List.of();
    }

    public CandidateQuery withQueryText(String replacement) {
        return new CandidateQuery(subTaskId, replacement, explanation, expectedColumns);
    }
}
