package com.aquiferai.pipeline.service;

import com.aquiferai.gateway.ModelRole;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class PipelineMetricsService {

    private static final int SUMMARY_INTERVAL = 10;

    private final AtomicLong gatewayRequestCount = new AtomicLong();
    private final AtomicLong planCount = new AtomicLong();
    private final AtomicLong fallbackPlanCount = new AtomicLong();
    private final AtomicLong queryExecutionCount = new AtomicLong();
    private final AtomicLong healingAttemptCount = new AtomicLong();
    private final AtomicLong failedOutcomeCount = new AtomicLong();
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong escalatedRunCount = new AtomicLong();

    public void recordGatewayRequest(ModelRole role) {
        long count = gatewayRequestCount.incrementAndGet();
        log.info("Model request #{} sent (role={}).", count, role.wireName());
    }

    public void recordPlan(@Nullable QueryPlan plan, boolean fallback) {
        long plans = planCount.incrementAndGet();
        if (fallback) {
            fallbackPlanCount.incrementAndGet();
        }
        int subTasks = plan != null ? plan.subTasks().size() : 0;
        log.info("Plan #{} ready with {} sub-tasks (complexity={}, fallback={}).",
                plans, subTasks, plan != null ? plan.complexity() : null, fallback);
    }

    public void recordQueryExecution() {
        queryExecutionCount.incrementAndGet();
    }

    public void recordHealingAttempt(String subTaskId, int attempt) {
        long total = healingAttemptCount.incrementAndGet();
        log.info("Healing attempt {} for sub-task {}. Total healing attempts={}.", attempt, subTaskId, total);
    }

    public void recordOutcome(ValidationOutcome outcome) {
        if (!outcome.isValid()) {
            failedOutcomeCount.incrementAndGet();
        }
    }

    public void recordRunCompleted(boolean escalated) {
        long runs = runCount.incrementAndGet();
        if (escalated) {
            escalatedRunCount.incrementAndGet();
        }
        log.info("Pipeline run #{} completed (escalated={}).", runs, escalated);
        if (runs % SUMMARY_INTERVAL == 0) {
            logSummary();
        }
    }

    public void logSummary() {
        log.info("Pipeline stats: modelRequests={}, plans={}, fallbackPlans={}, queriesExecuted={}, "
                        + "healingAttempts={}, failedOutcomes={}, runs={}, escalatedRuns={}.",
                gatewayRequestCount.get(), planCount.get(), fallbackPlanCount.get(), queryExecutionCount.get(),
                healingAttemptCount.get(), failedOutcomeCount.get(), runCount.get(), escalatedRunCount.get());
    }

    public long healingAttempts() {
        return healingAttemptCount.get();
    }
}
