package com.aquiferai.pipeline.model;

import org.springframework.lang.Nullable;

public record PipelineResult(
        @Nullable String sessionId,
        String answerText,
        AnalysisReport report,
        @Nullable Trace trace,
        RunMetadata metadata
) {

    public PipelineResult withSessionId(String sessionId) {
        return new PipelineResult(sessionId, answerText, report, trace, metadata);
    }
}
