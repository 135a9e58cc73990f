package com.aquiferai.pipeline.service;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.pipeline.model.PipelineRun;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dispatches per-sub-task work on the worker pool. Independent sub-tasks start immediately,
 * dependent ones start once every prerequisite has an outcome. Results come back in plan order.
 * <p>
 * The sub-task timeout starts when the work starts on a worker, so time spent waiting for
 * prerequisites or for a free worker is not charged to it. Work that times out or belongs to a
 * cancelled run is interrupted.
 */
@Component
@Slf4j
public class SubTaskScheduler {

    @FunctionalInterface
    public interface SubTaskWork {
        ValidationOutcome execute(int index, SubTask subTask, List<ValidationOutcome> prerequisites);
    }

    @FunctionalInterface
    public interface FailureHandler {
        ValidationOutcome onFailure(int index, SubTask subTask, Throwable error);
    }

    private final ExecutorService workerExecutor;
    private final PipelineProperties properties;

    public SubTaskScheduler(@Qualifier("workerExecutor") ExecutorService workerExecutor, PipelineProperties properties) {
        this.workerExecutor = workerExecutor;
        this.properties = properties;
    }

    /**
     * Blocks until every sub-task has an outcome. Failures, timeouts and cancellations are turned into
     * outcomes by {@code failureHandler}.
     */
    public List<ValidationOutcome> run(QueryPlan plan, PipelineRun run, SubTaskWork work, FailureHandler failureHandler) {
        List<SubTask> subTasks = plan.subTasks();
        Map<String, CompletableFuture<ValidationOutcome>> byId = new HashMap<>();
        List<CompletableFuture<ValidationOutcome>> ordered = new ArrayList<>(subTasks.size());
        long timeoutMs = properties.getSubTaskTimeout().toMillis();

        for (int i = 0; i < subTasks.size(); i++) {
            int index = i;
            SubTask subTask = subTasks.get(i);
            List<CompletableFuture<ValidationOutcome>> prerequisites = subTask.dependsOn().stream()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .toList();
            CompletableFuture<Void> ready = prerequisites.isEmpty()
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.allOf(prerequisites.toArray(new CompletableFuture[0]));
            CompletableFuture<ValidationOutcome> future = ready
                    .thenCompose(ignored -> dispatch(run, timeoutMs, () -> work.execute(index, subTask,
                            prerequisites.stream().map(CompletableFuture::join).toList())))
                    .exceptionally(ex -> failureHandler.onFailure(index, subTask, unwrap(ex)));
            byId.put(subTask.id(), future);
            ordered.add(future);
        }
        log.info("Dispatched {} sub-tasks ({} independent).", subTasks.size(),
                subTasks.stream().filter(SubTask::isIndependent).count());

        CompletableFuture.allOf(ordered.toArray(new CompletableFuture[0])).join();
        return ordered.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<ValidationOutcome> dispatch(PipelineRun run, long timeoutMs,
                                                          Supplier<ValidationOutcome> work) {
        CompletableFuture<ValidationOutcome> result = new CompletableFuture<>();
        Future<?> task = workerExecutor.submit(() -> {
            result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            try {
                result.complete(work.get());
            } catch (Throwable ex) {
                result.completeExceptionally(ex);
            }
        });
        run.track(task);
        run.track(result);
        result.whenComplete((value, error) -> {
            run.untrack(task);
            run.untrack(result);
            if (error != null) {
                task.cancel(true);
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
