package com.aquiferai.pipeline.api;

import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.lang.Nullable;

/**
 * Pushes pipeline progress to stream listeners. Every method is a no-op when {@code streamId} is null.
 */
public interface PipelineEventService {

    boolean isCancelled(@Nullable String streamId);

    /**
     * Runs {@code callback} when the stream is cancelled, or at once if it already was.
     */
    void onCancel(@Nullable String streamId, Runnable callback);

    void emitSession(@Nullable String streamId, String sessionId);

    void emitStatus(@Nullable String streamId, String status);

    void emitPlan(@Nullable String streamId, QueryPlan plan);

    void emitSubTaskStart(@Nullable String streamId, SubTask subTask);

    void emitSubTaskOutcome(@Nullable String streamId, ValidationOutcome outcome);

    void emitFinalAnswer(@Nullable String streamId, String answer);

    void emitRunComplete(@Nullable String streamId, String status);

    void emitError(@Nullable String streamId, String message);
}
