package com.aquiferai.pipeline;

import static com.aquiferai.pipeline.PipelineConstants.*;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.pipeline.api.PipelineEventService;
import com.aquiferai.pipeline.api.PlanningService;
import com.aquiferai.pipeline.api.QueryGenerationService;
import com.aquiferai.pipeline.api.SynthesisService;
import com.aquiferai.pipeline.api.ValidationService;
import com.aquiferai.pipeline.model.AnalysisReport;
import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.pipeline.model.PipelineResult;
import com.aquiferai.pipeline.model.PipelineRun;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.RouteDecision;
import com.aquiferai.pipeline.model.RunMetadata;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.Trace;
import com.aquiferai.pipeline.model.ValidationOutcome;
import com.aquiferai.pipeline.model.ValidationStatus;
import com.aquiferai.pipeline.service.PipelineMetricsService;
import com.aquiferai.pipeline.service.ResponseFormatter;
import com.aquiferai.pipeline.service.SubTaskScheduler;
import com.aquiferai.session.SessionLockRegistry;
import com.aquiferai.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * Runs plan, generate, validate, route, synthesize and format for one question.
 * <p>
 * Runs for the same session are serialized through {@link SessionLockRegistry}, keyed on the store's
 * canonical session id. The conversation is appended once, after the answer has been rendered; a
 * question without a session creates its session at that point. A cancelled or failed run stores nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_FAILED = "FAILED";

    private final PlanningService planningService;
    private final QueryGenerationService queryGenerationService;
    private final ValidationService validationService;
    private final SynthesisService synthesisService;
    private final SubTaskScheduler subTaskScheduler;
    private final ResponseFormatter responseFormatter;
    private final PipelineEventService eventService;
    private final SessionStore sessionStore;
    private final SessionLockRegistry sessionLocks;
    private final PipelineProperties properties;
    private final PipelineMetricsService metricsService;

    private final Map<String, PipelineRun> activeRuns = new ConcurrentHashMap<>();

    public PipelineResult run(String question, @Nullable String sessionId, boolean detailedMode) {
        return run(question, sessionId, detailedMode, null);
    }

    /**
     * Answers a question.
     *
     * @param question     the user question
     * @param sessionId    an existing session, or null to start a new one
     * @param detailedMode whether to render execution details and return a trace
     * @param streamId     stream run receiving progress events, or null
     * @throws PipelineCancelledException when the run is cancelled before it completes
     * @throws com.aquiferai.session.SessionBusyException when the session stays locked past the lock timeout
     */
    public PipelineResult run(String question, @Nullable String sessionId, boolean detailedMode, @Nullable String streamId) {
        String runId = streamId != null ? streamId : UUID.randomUUID().toString();
        if (!StringUtils.hasText(sessionId)) {
            // the session only exists once the first turn is stored, so no other run can reach it
            PipelineRun run = new PipelineRun(runId, null, question, detailedMode, List.of());
            return complete(run, streamId, answer -> {
                String createdId = sessionStore.createSessionWithTurn(question, answer).sessionId();
                eventService.emitSession(streamId, createdId);
                return createdId;
            });
        }

        String resolvedSessionId = sessionStore.canonicalId(sessionId);
        eventService.emitSession(streamId, resolvedSessionId);
        try (SessionLockRegistry.SessionLease ignored = sessionLocks.acquire(resolvedSessionId,
                properties.getSessionLockTimeout())) {
            List<ConversationTurn> history = sessionStore.recentTurns(resolvedSessionId, properties.getContextPairs());
            PipelineRun run = new PipelineRun(runId, resolvedSessionId, question, detailedMode, history);
            return complete(run, streamId, answer -> {
                sessionStore.appendTurn(resolvedSessionId, question, answer);
                return resolvedSessionId;
            });
        }
    }

    /**
     * Streaming variant: reports the outcome as events instead of returning it.
     */
    public void runStreaming(String question, @Nullable String sessionId, boolean detailedMode, String streamId) {
        try {
            PipelineResult result = run(question, sessionId, detailedMode, streamId);
            eventService.emitFinalAnswer(streamId, result.answerText());
            eventService.emitRunComplete(streamId, STATUS_COMPLETED);
        } catch (PipelineCancelledException ex) {
            log.info("Streamed run {} cancelled.", streamId);
            eventService.emitRunComplete(streamId, STATUS_CANCELLED);
        } catch (RuntimeException ex) {
            log.error("Streamed run {} failed.", streamId, ex);
            eventService.emitError(streamId, ex.getMessage());
            eventService.emitRunComplete(streamId, STATUS_FAILED);
        }
    }

    /**
     * Cancels an in-flight run and its pending model and store calls.
     *
     * @return false when no run with that id is in flight
     */
    public boolean cancel(String runId) {
        PipelineRun run = activeRuns.get(runId);
        if (run == null) {
            return false;
        }
        run.cancel();
        log.info("Cancelled pipeline run {}.", runId);
        return true;
    }

    /**
     * Executes the run and stores the turn once the answer is final.
     *
     * @param persist stores the answer and returns the id of the session it was stored in
     */
    private PipelineResult complete(PipelineRun run, @Nullable String streamId, UnaryOperator<String> persist) {
        activeRuns.put(run.getRunId(), run);
        eventService.onCancel(streamId, run::cancel);
        try {
            PipelineResult result = execute(run, streamId);
            ensureNotCancelled(run, streamId);
            String storedSessionId = persist.apply(result.answerText());
            metricsService.recordRunCompleted(run.isShouldEscalate());
            return result.withSessionId(storedSessionId);
        } finally {
            activeRuns.remove(run.getRunId());
        }
    }

    private PipelineResult execute(PipelineRun run, @Nullable String streamId) {
        eventService.emitStatus(streamId, STAGE_PLAN);
        QueryPlan plan = run.interruptibly(() -> planningService.plan(run.getQuestion(), run.getHistory()));
        if (plan.rationale() != null && plan.rationale().startsWith(FALLBACK_PLAN_RATIONALE)) {
            run.recordDegradation();
        }
        run.setPlan(plan);
        eventService.emitPlan(streamId, plan);
        ensureNotCancelled(run, streamId);

        eventService.emitStatus(streamId, STAGE_VALIDATE);
        run.prepareSlots(plan.subTasks().size());
        List<ValidationOutcome> outcomes = subTaskScheduler.run(plan, run,
                (index, subTask, prerequisites) -> processSubTask(run, streamId, plan, index, subTask, prerequisites),
                (index, subTask, error) -> failSubTask(run, index, subTask, error));
        ensureNotCancelled(run, streamId);

        RouteDecision decision = RouteDecision.of(outcomes);
        run.setShouldEscalate(decision.escalates());
        outcomes.stream().filter(outcome -> !outcome.isValid()).forEach(outcome -> run.recordDegradation());
        log.info("Run {} routed {} ({} of {} sub-tasks valid, {} retries).", run.getRunId(), decision,
                outcomes.stream().filter(ValidationOutcome::isValid).count(), outcomes.size(), run.totalRetriesValue());

        eventService.emitStatus(streamId, STAGE_SYNTHESIZE);
        AnalysisReport report = run.interruptibly(() -> synthesisService.synthesize(run.getQuestion(), plan, outcomes));
        if (report.dataQualityNotes().contains(DEGRADED_QUALITY_NOTE)) {
            run.recordDegradation();
        }
        run.setReport(report);
        ensureNotCancelled(run, streamId);

        eventService.emitStatus(streamId, STAGE_FORMAT);
        String answer = responseFormatter.format(run, report, decision);
        run.setAnswerText(answer);
        Trace trace = run.isDetailedMode() ? responseFormatter.buildTrace(run) : null;
        RunMetadata metadata = new RunMetadata(plan.complexity(), outcomes.size(), run.totalRetriesValue(),
                decision == RouteDecision.ALL_VALID, run.isShouldEscalate(),
                Duration.between(run.getStartedAt(), Instant.now()).toMillis());
        return new PipelineResult(run.getSessionId(), answer, report, trace, metadata);
    }

    private ValidationOutcome processSubTask(PipelineRun run, @Nullable String streamId, QueryPlan plan,
                                             int index, SubTask subTask, List<ValidationOutcome> prerequisites) {
        ensureNotCancelled(run, streamId);
        eventService.emitSubTaskStart(streamId, subTask);
        CandidateQuery candidate = queryGenerationService.generate(subTask, plan, prerequisites);
        if (candidate.explanation() != null && candidate.explanation().startsWith(FALLBACK_QUERY_EXPLANATION)) {
            run.recordDegradation();
        }
        run.recordCandidate(index, candidate);
        ValidationOutcome outcome = validationService.validate(candidate, run);
        if (!run.recordOutcome(index, outcome)) {
            return run.outcomeAt(index);
        }
        eventService.emitSubTaskOutcome(streamId, outcome);
        return outcome;
    }

    private ValidationOutcome failSubTask(PipelineRun run, int index, SubTask subTask, Throwable error) {
        String reason;
        if (error instanceof TimeoutException) {
            reason = "Sub-task timed out after " + properties.getSubTaskTimeout().toMillis() + " ms";
        } else if (error instanceof CancellationException || error instanceof PipelineCancelledException) {
            reason = "Sub-task cancelled";
        } else {
            reason = "Sub-task failed: " + error.getMessage();
        }
        log.warn("Sub-task {} of run {} did not complete: {}", subTask.id(), run.getRunId(), reason);
        CandidateQuery candidate = run.candidateAt(index);
        if (candidate == null) {
            candidate = queryGenerationService.fallbackQuery(subTask, reason);
            run.recordCandidate(index, candidate);
        }
        ValidationOutcome outcome = ValidationOutcome.failed(subTask.id(), ValidationStatus.EXECUTION_ERROR,
                candidate.queryText(), candidate.queryText(), reason, null, 0);
        if (!run.recordOutcome(index, outcome)) {
            return run.outcomeAt(index);
        }
        return outcome;
    }

    private void ensureNotCancelled(PipelineRun run, @Nullable String streamId) {
        if (run.isCancelled() || eventService.isCancelled(streamId)) {
            run.cancel();
            throw new PipelineCancelledException(run.getRunId());
        }
    }
}
