package com.aquiferai.pipeline.service;

import static com.aquiferai.pipeline.PipelineConstants.*;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.gateway.GatewayException;
import com.aquiferai.gateway.ModelGateway;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.graph.GraphStore;
import com.aquiferai.graph.GraphStoreException;
import com.aquiferai.graph.SchemaVocabulary;
import com.aquiferai.pipeline.api.ValidationService;
import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.PipelineRun;
import com.aquiferai.pipeline.model.ValidationOutcome;
import com.aquiferai.pipeline.model.ValidationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationServiceImpl implements ValidationService {

    private final GraphStore graphStore;
    private final ModelGateway modelGateway;
    private final CypherStaticChecker staticChecker;
    private final PipelineProperties properties;
    private final PipelineMetricsService metricsService;

    @Override
    public ValidationOutcome validate(CandidateQuery candidate, @Nullable PipelineRun run) {
        SchemaVocabulary vocabulary = graphStore.schemaVocabulary();
        int maxRetries = properties.getMaxRetries();
        String subTaskId = candidate.subTaskId();
        String originalQuery = candidate.queryText() != null ? candidate.queryText() : "";
        HealingState state = HealingState.pending(originalQuery);
        List<String> failedQueries = new ArrayList<>();
        List<Map<String, Object>> rows = null;

        while (!state.isTerminal()) {
            if (run != null && run.isCancelled()) {
                state = state.abandon("run cancelled");
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                state = state.abandon("interrupted");
                break;
            }
            if (state.phase() == HealingState.Phase.PENDING) {
                CypherStaticChecker.CheckFailure failure = staticChecker.check(state.query(), vocabulary);
                if (failure != null) {
                    state = state.failed(failure.status(), failure.message(), null, maxRetries);
                } else {
                    long started = System.nanoTime();
                    try {
                        rows = graphStore.execute(state.query(), properties.getQueryTimeout());
                        state = state.executed(elapsedMs(started));
                    } catch (GraphStoreException ex) {
                        state = state.failed(ValidationStatus.EXECUTION_ERROR, ex.getMessage(), elapsedMs(started), maxRetries);
                    } finally {
                        metricsService.recordQueryExecution();
                    }
                }
                if (state.phase() != HealingState.Phase.VALID) {
                    log.warn("Sub-task {} attempt {} failed with {}: {}", subTaskId, state.attempt(),
                            state.failureStatus(), state.errorMessage());
                }
            } else {
                failedQueries.add(state.query());
                metricsService.recordHealingAttempt(subTaskId, state.attempt() + 1);
                state = state.repaired(heal(subTaskId, state, failedQueries, vocabulary));
            }
        }

        ValidationOutcome outcome;
        if (state.phase() == HealingState.Phase.VALID) {
            outcome = ValidationOutcome.valid(subTaskId, originalQuery, state.query(), rows != null ? rows : List.of(),
                    state.executionTimeMs(), state.attempt());
            log.info("Sub-task {} valid after {} retries ({} rows, {} ms).", subTaskId, state.attempt(),
                    outcome.rowCount(), state.executionTimeMs());
        } else {
            ValidationStatus status = state.failureStatus() != null ? state.failureStatus() : ValidationStatus.EXECUTION_ERROR;
            outcome = ValidationOutcome.failed(subTaskId, status, originalQuery, state.query(),
                    state.errorMessage(), state.executionTimeMs(), state.attempt());
            log.warn("Sub-task {} failed after {} retries with {}.", subTaskId, state.attempt(), status);
        }
        metricsService.recordOutcome(outcome);
        return outcome;
    }

    /**
     * Asks the healer for a replacement. Keeps the current text when the call fails or returns nothing,
     * the attempt still counts against the ceiling.
     */
    private String heal(String subTaskId, HealingState state, List<String> failedQueries, SchemaVocabulary vocabulary) {
        try {
            String response = modelGateway.generate(ModelRole.HEALER, HEALER_SYSTEM_PROMPT, HEALER_USER_TEMPLATE, Map.of(
                    "query", state.query(),
                    "category", String.valueOf(state.failureStatus()),
                    "error", String.valueOf(state.errorMessage()),
                    "previousAttempts", describeAttempts(failedQueries),
                    "schema", vocabulary.describe()));
            String replacement = CypherText.stripCodeFences(response);
            if (!StringUtils.hasText(replacement)) {
                log.warn("Healer returned no query for sub-task {}. Keeping the current query.", subTaskId);
                return state.query();
            }
            if (isRepeat(replacement, failedQueries)) {
                log.warn("Healer repeated an earlier failing query for sub-task {}.", subTaskId);
            }
            return replacement;
        } catch (GatewayException ex) {
            log.warn("Healing failed for sub-task {}: {}. Keeping the current query.", subTaskId, ex.getMessage());
            return state.query();
        }
    }

    private static boolean isRepeat(String replacement, List<String> failedQueries) {
        String normalized = CypherText.normalize(replacement);
        return failedQueries.stream().map(CypherText::normalize).anyMatch(normalized::equals);
    }

    private static String describeAttempts(List<String> failedQueries) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < failedQueries.size(); i++) {
            builder.append(i + 1).append(". ").append(CypherText.normalize(failedQueries.get(i))).append('\n');
        }
        return builder.toString().trim();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
