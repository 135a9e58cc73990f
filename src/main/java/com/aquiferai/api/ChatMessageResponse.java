package com.aquiferai.api;

import com.aquiferai.pipeline.model.AnalysisReport;
import com.aquiferai.pipeline.model.PipelineResult;
import com.aquiferai.pipeline.model.RunMetadata;
import com.aquiferai.pipeline.model.Trace;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessageResponse(
        String sessionId,
        String answer,
        AnalysisReport report,
        Trace trace,
        RunMetadata metadata,
        Instant createdAt
) {

    public static ChatMessageResponse from(PipelineResult result) {
        return new ChatMessageResponse(result.sessionId(), result.answerText(), result.report(),
                result.trace(), result.metadata(), Instant.now());
    }
}
