package com.aquiferai.pipeline.model;

import com.aquiferai.pipeline.PipelineCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PipelineRunTest {

    @Test
    void testFirstOutcomeWins() {
        PipelineRun run = new PipelineRun("run-1", "session-1", "question", false, List.of());
        run.prepareSlots(1);
        ValidationOutcome timedOut = ValidationOutcome.failed("st1", ValidationStatus.EXECUTION_ERROR, "q", "q",
                "timed out", null, 0);
        ValidationOutcome late = ValidationOutcome.valid("st1", "q", "q2", List.of(), 3, 2);

        assertTrue(run.recordOutcome(0, timedOut));
        assertFalse(run.recordOutcome(0, late));

        assertSame(timedOut, run.outcomeAt(0));
        assertEquals(0, run.totalRetriesValue());
    }

    @Test
    void testOutcomesKeepPlanOrder() {
        PipelineRun run = new PipelineRun("run-1", "session-1", "question", false, List.of());
        run.prepareSlots(3);
        run.recordOutcome(2, ValidationOutcome.valid("st3", "q", "q", List.of(), 1, 0));
        run.recordOutcome(0, ValidationOutcome.valid("st1", "q", "q2", List.of(), 1, 1));

        assertEquals(List.of("st1", "st3"), run.outcomeList().stream().map(ValidationOutcome::subTaskId).toList());
        assertEquals(1, run.totalRetriesValue());
    }

    @Test
    void testCancelInterruptsTrackedWork() throws InterruptedException {
        PipelineRun run = new PipelineRun("run-1", "session-1", "question", false, List.of());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        try {
            Future<?> blocking = executor.submit(() -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ex) {
                    interrupted.countDown();
                }
            });
            run.track(blocking);
            assertTrue(started.await(2, TimeUnit.SECONDS));

            run.cancel();

            assertTrue(run.isCancelled());
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
            assertTrue(blocking.isCancelled());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testWorkTrackedAfterCancelIsCancelled() {
        PipelineRun run = new PipelineRun("run-1", "session-1", "question", false, List.of());
        run.cancel();
        CompletableFuture<String> late = new CompletableFuture<>();

        run.track(late);

        assertTrue(late.isCancelled());
    }

    @Test
    void testCancelInterruptsStageThread() throws Exception {
        PipelineRun run = new PipelineRun("run-1", null, "question", false, List.of());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        try {
            Future<Boolean> stage = executor.submit(() -> {
                boolean wasInterrupted = run.interruptibly(() -> {
                    started.countDown();
                    try {
                        Thread.sleep(10_000);
                        return false;
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        return true;
                    }
                });
                // the flag must not leak into the next stage on this thread
                return wasInterrupted && !Thread.currentThread().isInterrupted();
            });
            assertTrue(started.await(2, TimeUnit.SECONDS));

            run.cancel();

            assertTrue(stage.get(2, TimeUnit.SECONDS));
            assertThrows(PipelineCancelledException.class, () -> run.interruptibly(() -> "next"));
        } finally {
            executor.shutdownNow();
        }
    }
}
