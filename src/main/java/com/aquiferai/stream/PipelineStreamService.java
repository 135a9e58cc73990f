package com.aquiferai.stream;

import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class PipelineStreamService {

    private final PipelineStreamHub hub;

    public PipelineStreamService(PipelineStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    public void emitSession(String runId, String sessionId) {
        hub.emit(runId, "session", Map.of("sessionId", sessionId));
    }

    public void emitStatus(String runId, String message) {
        hub.emit(runId, "status", Map.of("message", message));
    }

    public void emitPlan(String runId, QueryPlan plan) {
        hub.emit(runId, "plan", plan);
    }

    public void emitSubTaskStart(String runId, SubTask subTask) {
        hub.emit(runId, "sub-task-start", Map.of(
                "subTaskId", subTask.id(),
                "description", subTask.description()
        ));
    }

    public void emitSubTaskOutcome(String runId, ValidationOutcome outcome) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("subTaskId", outcome.subTaskId());
        payload.put("status", outcome.status());
        payload.put("finalQuery", outcome.finalQuery());
        payload.put("retryCount", outcome.retryCount());
        payload.put("rowCount", outcome.rowCount());
        if (outcome.executionTimeMs() != null) {
            payload.put("executionTimeMs", outcome.executionTimeMs());
        }
        if (outcome.errorMessage() != null) {
            payload.put("errorMessage", outcome.errorMessage());
        }
        hub.emit(runId, "sub-task-outcome", payload);
    }

    public void emitFinalAnswer(String runId, String answer) {
        hub.emit(runId, "final", Map.of("answer", answer));
    }

    public void emitRunComplete(String runId, String status) {
        hub.emit(runId, PipelineStreamHub.EVENT_RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.emit(runId, PipelineStreamHub.EVENT_ERROR, Map.of("message", message != null ? message : "Unknown error"));
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }

    public boolean isCancelled(String runId) {
        return hub.isCancelled(runId);
    }

    public void onCancel(String runId, Runnable callback) {
        hub.onCancel(runId, callback);
    }
}
