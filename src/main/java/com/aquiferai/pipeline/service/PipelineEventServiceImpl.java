package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.api.PipelineEventService;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import com.aquiferai.stream.PipelineStreamService;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
public class PipelineEventServiceImpl implements PipelineEventService {

    private final PipelineStreamService streamService;

    public PipelineEventServiceImpl(PipelineStreamService streamService) {
        this.streamService = streamService;
    }

    @Override
    public boolean isCancelled(@Nullable String streamId) {
        return streamId != null && streamService.isCancelled(streamId);
    }

    @Override
    public void emitSession(@Nullable String streamId, String sessionId) {
        if (streamId != null) {
            streamService.emitSession(streamId, sessionId);
        }
    }

    @Override
    public void emitStatus(@Nullable String streamId, String status) {
        if (streamId != null) {
            streamService.emitStatus(streamId, status);
        }
    }

    @Override
    public void emitPlan(@Nullable String streamId, QueryPlan plan) {
        if (streamId != null) {
            streamService.emitPlan(streamId, plan);
        }
    }

    @Override
    public void emitSubTaskStart(@Nullable String streamId, SubTask subTask) {
        if (streamId != null) {
            streamService.emitSubTaskStart(streamId, subTask);
        }
    }

    @Override
    public void emitSubTaskOutcome(@Nullable String streamId, ValidationOutcome outcome) {
        if (streamId != null) {
            streamService.emitSubTaskOutcome(streamId, outcome);
        }
    }

    @Override
    public void emitFinalAnswer(@Nullable String streamId, String answer) {
        if (streamId != null) {
            streamService.emitFinalAnswer(streamId, answer);
        }
    }

    @Override
    public void emitRunComplete(@Nullable String streamId, String status) {
        if (streamId != null) {
            streamService.emitRunComplete(streamId, status);
        }
    }

    @Override
    public void emitError(@Nullable String streamId, String message) {
        if (streamId != null) {
            streamService.emitError(streamId, message);
        }
    }

    @Override
    public void onCancel(@Nullable String streamId, Runnable callback) {
        if (streamId != null) {
            streamService.onCancel(streamId, callback);
        }
    }
}
