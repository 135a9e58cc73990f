package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.model.AnalysisReport;
import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.Insight;
import com.aquiferai.pipeline.model.PipelineRun;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.Recommendation;
import com.aquiferai.pipeline.model.RouteDecision;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.SubTaskTrace;
import com.aquiferai.pipeline.model.Trace;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the markdown answer and the execution trace of a run.
 */
@Component
public class ResponseFormatter {

    public String format(PipelineRun run, AnalysisReport report, RouteDecision decision) {
        List<ValidationOutcome> outcomes = run.outcomeList();
        StringBuilder answer = new StringBuilder();
        if (decision == RouteDecision.FAILURES_DOMINATE) {
            appendFailureNotice(answer, outcomes);
        }

        answer.append("## Summary\n\n").append(report.summary()).append("\n\n");

        if (!report.insights().isEmpty()) {
            answer.append("## Key Insights\n\n");
            for (Insight insight : report.insights()) {
                answer.append("- **").append(insight.title()).append("**");
                if (StringUtils.hasText(insight.importance())) {
                    answer.append(" (").append(insight.importance()).append(')');
                }
                answer.append(": ").append(insight.description()).append('\n');
            }
            answer.append('\n');
        }

        if (!report.recommendations().isEmpty()) {
            answer.append("## Recommendations\n\n");
            int position = 1;
            for (Recommendation recommendation : report.recommendations()) {
                answer.append(position++).append(". **").append(recommendation.action()).append("** (priority ")
                        .append(recommendation.priority()).append(")");
                if (StringUtils.hasText(recommendation.rationale())) {
                    answer.append(": ").append(recommendation.rationale());
                }
                answer.append('\n');
            }
            answer.append('\n');
        }

        if (!report.dataQualityNotes().isEmpty()) {
            answer.append("## Data Quality\n\n");
            report.dataQualityNotes().forEach(note -> answer.append("- ").append(note).append('\n'));
            answer.append('\n');
        }

        if (!report.followUpQuestions().isEmpty()) {
            answer.append("## You might also want to ask\n\n");
            report.followUpQuestions().forEach(question -> answer.append("- ").append(question).append('\n'));
            answer.append('\n');
        }

        if (decision == RouteDecision.PARTIAL_FAILURE) {
            appendFailureNotice(answer, outcomes);
        }

        if (run.isDetailedMode()) {
            appendExecutionDetails(answer, run, outcomes);
        }
        return answer.toString().trim();
    }

    public Trace buildTrace(PipelineRun run) {
        QueryPlan plan = run.getPlan();
        List<ValidationOutcome> outcomes = run.outcomeList();
        List<SubTaskTrace> subTaskTraces = new ArrayList<>(outcomes.size());
        for (ValidationOutcome outcome : outcomes) {
            subTaskTraces.add(new SubTaskTrace(outcome.subTaskId(), describe(plan, outcome.subTaskId()),
                    outcome.originalQuery(), outcome.finalQuery(), outcome.status(), outcome.retryCount(),
                    outcome.executionTimeMs(), outcome.rowCount(), outcome.errorMessage()));
        }
        return new Trace(plan, subTaskTraces, run.totalRetriesValue(), elapsedMs(run));
    }

    private void appendFailureNotice(StringBuilder answer, List<ValidationOutcome> outcomes) {
        List<ValidationOutcome> failed = outcomes.stream().filter(outcome -> !outcome.isValid()).toList();
        if (failed.isEmpty()) {
            return;
        }
        answer.append("> **Partial results:** data could not be retrieved for ")
                .append(failed.size()).append(" of ").append(outcomes.size()).append(" sub-tasks.\n");
        for (ValidationOutcome outcome : failed) {
            answer.append("> - ").append(outcome.subTaskId()).append(": ").append(outcome.status());
            if (StringUtils.hasText(outcome.errorMessage())) {
                answer.append(" (").append(outcome.errorMessage()).append(')');
            }
            answer.append('\n');
        }
        answer.append('\n');
    }

    private void appendExecutionDetails(StringBuilder answer, PipelineRun run, List<ValidationOutcome> outcomes) {
        QueryPlan plan = run.getPlan();
        answer.append("## Execution Details\n\n");
        if (plan != null) {
            answer.append("- Complexity: ").append(plan.complexity()).append('\n');
            answer.append("- Sub-tasks: ").append(plan.subTasks().size()).append('\n');
        }
        answer.append("- Total retries: ").append(run.totalRetriesValue()).append('\n');
        answer.append("- Total time: ").append(elapsedMs(run)).append(" ms\n\n");
        List<CandidateQuery> candidates = run.candidateList();
        for (ValidationOutcome outcome : outcomes) {
            answer.append("### ").append(outcome.subTaskId());
            String description = describe(plan, outcome.subTaskId());
            if (StringUtils.hasText(description)) {
                answer.append(": ").append(description);
            }
            answer.append("\n\n");
            candidates.stream()
                    .filter(candidate -> outcome.subTaskId().equals(candidate.subTaskId()))
                    .findFirst()
                    .filter(candidate -> StringUtils.hasText(candidate.explanation()))
                    .ifPresent(candidate -> answer.append(candidate.explanation()).append("\n\n"));
            answer.append("```cypher\n").append(outcome.finalQuery()).append("\n```\n\n");
            answer.append("Status: ").append(outcome.status());
            if (outcome.executionTimeMs() != null) {
                answer.append(", ").append(outcome.executionTimeMs()).append(" ms");
            }
            answer.append(", retries: ").append(outcome.retryCount());
            if (outcome.isValid()) {
                answer.append(", rows: ").append(outcome.rowCount());
            }
            answer.append("\n\n");
        }
    }

    private static String describe(QueryPlan plan, String subTaskId) {
        if (plan == null) {
            return "";
        }
        return plan.subTasks().stream()
                .filter(subTask -> subTask.id().equals(subTaskId))
                .map(SubTask::description)
                .findFirst()
                .orElse("");
    }

    private static long elapsedMs(PipelineRun run) {
        return Duration.between(run.getStartedAt(), Instant.now()).toMillis();
    }
}
