package com.aquiferai.pipeline.service;

import static com.aquiferai.pipeline.PipelineConstants.*;

import com.aquiferai.gateway.GatewayException;
import com.aquiferai.gateway.ModelGateway;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.pipeline.api.SynthesisService;
import com.aquiferai.pipeline.model.AnalysisReport;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.Recommendation;
import com.aquiferai.pipeline.model.ValidationOutcome;
import com.aquiferai.pipeline.model.VisualizationHint;
import com.aquiferai.pipeline.model.VisualizationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class SynthesisServiceImpl implements SynthesisService {

    private final ModelGateway modelGateway;
    private final ResultSampler resultSampler;
    private final PipelineContextService contextService;

    @Override
    public AnalysisReport synthesize(String question, QueryPlan plan, List<ValidationOutcome> outcomes) {
        long validCount = outcomes.stream().filter(ValidationOutcome::isValid).count();
        int totalRows = outcomes.stream().mapToInt(ValidationOutcome::rowCount).sum();
        if (totalRows == 0) {
            log.info("No rows retrieved ({} valid outcomes). Skipping synthesizer.", validCount);
            return noDataReport(validCount > 0);
        }
        AnalysisReport draft;
        try {
            draft = modelGateway.generateStructured(ModelRole.SYNTHESIZER, SYNTHESIZER_SYSTEM_PROMPT,
                    SYNTHESIZER_USER_TEMPLATE, Map.of(
                            "question", question,
                            "complexity", String.valueOf(plan.complexity()),
                            "plan", contextService.describePlan(plan),
                            "results", resultSampler.describeResults(outcomes),
                            "failures", resultSampler.describeFailures(outcomes)),
                    AnalysisReport.class);
        } catch (GatewayException ex) {
            log.warn("Synthesis degraded: {}", ex.getMessage());
            return degradedReport(totalRows, (int) validCount);
        }
        if (!StringUtils.hasText(draft.summary())) {
            log.warn("Synthesizer returned no summary. Using row-count report.");
            return degradedReport(totalRows, (int) validCount);
        }
        return draft;
    }

    AnalysisReport noDataReport(boolean queriesSucceeded) {
        String summary = queriesSucceeded ? EMPTY_RESULT_SUMMARY : NO_DATA_SUMMARY;
        List<String> notes = queriesSucceeded
                ? List.of("All successful queries returned zero rows.")
                : List.of("No query could be validated against the graph.");
        return new AnalysisReport(summary, List.of(),
                List.of(new Recommendation(NO_DATA_ACTION, NO_DATA_RATIONALE, Recommendation.HIGHEST_PRIORITY)),
                NO_DATA_FOLLOW_UPS, List.of(), notes);
    }

    AnalysisReport degradedReport(int totalRows, int successfulQueries) {
        List<String> notes = new ArrayList<>();
        notes.add(DEGRADED_QUALITY_NOTE);
        return new AnalysisReport(DEGRADED_SUMMARY_FORMAT.formatted(totalRows, successfulQueries),
                List.of(), List.of(), List.of(),
                List.of(new VisualizationHint(VisualizationType.TABLE, RESULTS_DATA_KEY, Map.of())),
                notes);
    }
}
