package com.aquiferai.pipeline;

public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String runId) {
        super("Pipeline run " + runId + " was cancelled");
    }
}
