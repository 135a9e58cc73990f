package com.aquiferai.pipeline.model;

import java.util.List;

public record QueryPlan(
        String originalQuestion,
        QueryComplexity complexity,
        List<SubTask> subTasks,
        String rationale
) {

    public QueryPlan {
        subTasks = subTasks != null ? List.copyOf(subTasks) : List.of();
    }
}
