package com.aquiferai.pipeline.model;

public record Insight(
        String title,
        String description,
        String importance
) {
}
