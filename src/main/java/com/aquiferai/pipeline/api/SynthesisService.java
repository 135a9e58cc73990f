package com.aquiferai.pipeline.api;

import com.aquiferai.pipeline.model.AnalysisReport;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.ValidationOutcome;

import java.util.List;

/**
 * Builds the analysis report from validated results.
 */
public interface SynthesisService {

    /**
     * Synthesizes a report. Returns a deterministic "no data" report without calling the model
     * when no rows were retrieved, and a row-count report when the model call fails.
     */
    AnalysisReport synthesize(String question, QueryPlan plan, List<ValidationOutcome> outcomes);
}
