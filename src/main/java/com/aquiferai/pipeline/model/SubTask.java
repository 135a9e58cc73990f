package com.aquiferai.pipeline.model;

import java.util.List;

/**
 * One retrieval step of a plan. {@code dependsOn} only names earlier sub-tasks of the same plan.
 */
public record SubTask(
        String id,
        String description,
        String queryType,
        List<String> requiredEntityKinds,
        List<String> dependsOn
) {

    public SubTask {
        requiredEntityKinds = requiredEntityKinds != null ? List.copyOf(requiredEntityKinds) : List.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    public boolean isIndependent() {
        return dependsOn.isEmpty();
    }
}
