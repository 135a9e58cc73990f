package com.aquiferai.pipeline.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public record AnalysisReport(
        String summary,
        List<Insight> insights,
        List<Recommendation> recommendations,
        List<String> followUpQuestions,
        List<VisualizationHint> visualizationHints,
        List<String> dataQualityNotes
) {

    public AnalysisReport {
        summary = summary != null ? summary : "";
        insights = nonNull(insights);
        recommendations = nonNull(recommendations).stream()
                .sorted(Comparator.comparingInt(Recommendation::priority))
                .toList();
        followUpQuestions = nonNull(followUpQuestions);
        visualizationHints = nonNull(visualizationHints);
        dataQualityNotes = nonNull(dataQualityNotes);
    }

    private static <T> List<T> nonNull(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
