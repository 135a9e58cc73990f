package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Renders run state into the plain-text sections of stage prompts.
 */
@Service
public class PipelineContextService {

    private static final int MAX_TURN_LENGTH = 600;
    private static final int MAX_PREREQUISITE_ROWS = 10;

    private final JsonProcessingService jsonProcessingService;

    public PipelineContextService(JsonProcessingService jsonProcessingService) {
        this.jsonProcessingService = jsonProcessingService;
    }

    public String describeHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "None.";
        }
        StringBuilder builder = new StringBuilder();
        for (ConversationTurn turn : history) {
            builder.append("User: ").append(clip(turn.userMessage())).append('\n');
            builder.append("Assistant: ").append(clip(turn.assistantMessage())).append('\n');
        }
        return builder.toString().trim();
    }

    public String describePlan(QueryPlan plan) {
        StringBuilder builder = new StringBuilder();
        for (SubTask subTask : plan.subTasks()) {
            builder.append("- ").append(subTask.id()).append(": ").append(subTask.description());
            if (!subTask.dependsOn().isEmpty()) {
                builder.append(" (after ").append(String.join(", ", subTask.dependsOn())).append(')');
            }
            builder.append('\n');
        }
        if (StringUtils.hasText(plan.rationale())) {
            builder.append("Rationale: ").append(plan.rationale());
        }
        return builder.toString().trim();
    }

    public String describePrerequisites(List<ValidationOutcome> prerequisites) {
        if (prerequisites == null || prerequisites.isEmpty()) {
            return "None.";
        }
        StringBuilder builder = new StringBuilder();
        for (ValidationOutcome outcome : prerequisites) {
            builder.append(outcome.subTaskId()).append(" (").append(outcome.status()).append("): ");
            if (outcome.isValid()) {
                List<?> sample = outcome.rows().subList(0, Math.min(MAX_PREREQUISITE_ROWS, outcome.rowCount()));
                builder.append(jsonProcessingService.toJson(sample));
            } else {
                builder.append("no data, ").append(outcome.errorMessage());
            }
            builder.append('\n');
        }
        return builder.toString().trim();
    }

    private static String clip(String value) {
        if (value == null) {
            return "";
        }
        return JsonProcessingService.truncate(value, MAX_TURN_LENGTH);
    }
}
