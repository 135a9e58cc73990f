package com.aquiferai.pipeline.service;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Caps the rows handed to the synthesizer, per sub-task and overall.
 */
@Component
public class ResultSampler {

    private final PipelineProperties properties;
    private final JsonProcessingService jsonProcessingService;

    public ResultSampler(PipelineProperties properties, JsonProcessingService jsonProcessingService) {
        this.properties = properties;
        this.jsonProcessingService = jsonProcessingService;
    }

    public String describeResults(List<ValidationOutcome> outcomes) {
        int budget = properties.getMaxSynthesisRows();
        int perSubTask = properties.getSampleRowsPerSubTask();
        StringBuilder builder = new StringBuilder();
        for (ValidationOutcome outcome : outcomes) {
            if (!outcome.isValid()) {
                continue;
            }
            List<Map<String, Object>> rows = outcome.rows();
            int shown = Math.max(0, Math.min(Math.min(perSubTask, budget), rows.size()));
            builder.append("Sub-task ").append(outcome.subTaskId())
                    .append(" (").append(rows.size()).append(" rows");
            if (shown < rows.size()) {
                builder.append(", showing first ").append(shown);
            }
            builder.append("):\n");
            builder.append(jsonProcessingService.toJson(rows.subList(0, shown))).append("\n\n");
            budget -= shown;
        }
        String text = builder.toString().trim();
        return text.isEmpty() ? "None." : text;
    }

    public String describeFailures(List<ValidationOutcome> outcomes) {
        StringBuilder builder = new StringBuilder();
        for (ValidationOutcome outcome : outcomes) {
            if (outcome.isValid()) {
                continue;
            }
            builder.append("- ").append(outcome.subTaskId()).append(": ").append(outcome.status())
                    .append(" after ").append(outcome.retryCount()).append(" retries, ")
                    .append(outcome.errorMessage()).append('\n');
        }
        String text = builder.toString().trim();
        return text.isEmpty() ? "None." : text;
    }
}
