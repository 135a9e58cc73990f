package com.aquiferai.pipeline.model;

import com.aquiferai.pipeline.PipelineCancelledException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Execution state of one pipeline request. Each stage writes its own section; the instance is
 * discarded once the response has been produced.
 * <p>
 * Candidate and outcome slots are indexed by sub-task position so concurrent sub-tasks can record
 * results without reordering them.
 */
@Getter
public class PipelineRun {

    private final String runId;
    @Nullable
    private final String sessionId;
    private final String question;
    private final boolean detailedMode;
    private final List<ConversationTurn> history;
    private final Instant startedAt = Instant.now();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger errorCount = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger totalRetries = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final Object cancelLock = new Object();
    @Getter(AccessLevel.NONE)
    private final List<Future<?>> inFlight = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Set<Thread> stageThreads = new HashSet<>();

    @Setter
    @Nullable
    private QueryPlan plan;
    @Setter
    @Nullable
    private AnalysisReport report;
    @Setter
    private boolean shouldEscalate;
    @Setter
    @Nullable
    private String answerText;

    @Getter(AccessLevel.NONE)
    private CandidateQuery[] candidates = new CandidateQuery[0];
    @Getter(AccessLevel.NONE)
    private ValidationOutcome[] outcomes = new ValidationOutcome[0];
    private volatile boolean cancelled;

    /**
     * @param sessionId the session the run belongs to, or null when the session is only created once
     *                  the run completes
     */
    public PipelineRun(String runId, @Nullable String sessionId, String question, boolean detailedMode,
                       List<ConversationTurn> history) {
        this.runId = runId;
        this.sessionId = sessionId;
        this.question = question;
        this.detailedMode = detailedMode;
        this.history = history != null ? List.copyOf(history) : List.of();
    }

    public synchronized void prepareSlots(int subTaskCount) {
        candidates = new CandidateQuery[subTaskCount];
        outcomes = new ValidationOutcome[subTaskCount];
    }

    public synchronized void recordCandidate(int index, CandidateQuery candidate) {
        candidates[index] = candidate;
    }

    /**
     * Records the outcome of a sub-task. The first outcome recorded for a slot wins, so a sub-task
     * that finishes after being timed out does not replace its timeout outcome.
     *
     * @return whether the outcome was recorded
     */
    public synchronized boolean recordOutcome(int index, ValidationOutcome outcome) {
        if (outcomes[index] != null) {
            return false;
        }
        outcomes[index] = outcome;
        totalRetries.addAndGet(outcome.retryCount());
        return true;
    }

    @Nullable
    public synchronized ValidationOutcome outcomeAt(int index) {
        return outcomes[index];
    }

    @Nullable
    public synchronized CandidateQuery candidateAt(int index) {
        return candidates[index];
    }

    public synchronized List<CandidateQuery> candidateList() {
        return Arrays.stream(candidates).filter(Objects::nonNull).toList();
    }

    public synchronized List<ValidationOutcome> outcomeList() {
        return Arrays.stream(outcomes).filter(Objects::nonNull).toList();
    }

    public void recordDegradation() {
        errorCount.incrementAndGet();
    }

    public int errorCountValue() {
        return errorCount.get();
    }

    public int totalRetriesValue() {
        return totalRetries.get();
    }

    /**
     * Registers work done on behalf of this run. Work registered after the run was cancelled is
     * cancelled at once.
     */
    public void track(Future<?> future) {
        synchronized (cancelLock) {
            if (!cancelled) {
                inFlight.add(future);
                return;
            }
        }
        future.cancel(true);
    }

    public void untrack(Future<?> future) {
        synchronized (cancelLock) {
            inFlight.remove(future);
        }
    }

    /**
     * Runs a blocking stage on the calling thread so that {@link #cancel()} can interrupt it.
     *
     * @throws PipelineCancelledException when the run is already cancelled
     */
    public <T> T interruptibly(Supplier<T> stage) {
        Thread current = Thread.currentThread();
        synchronized (cancelLock) {
            if (cancelled) {
                throw new PipelineCancelledException(runId);
            }
            stageThreads.add(current);
        }
        try {
            return stage.get();
        } finally {
            synchronized (cancelLock) {
                stageThreads.remove(current);
                if (cancelled) {
                    // clears the interrupt raised by cancel()
                    Thread.interrupted();
                }
            }
        }
    }

    /**
     * Marks the run cancelled, cancels every tracked call with interruption and interrupts the
     * threads running a stage through {@link #interruptibly(Supplier)}.
     */
    public void cancel() {
        List<Future<?>> pending;
        synchronized (cancelLock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            pending = new ArrayList<>(inFlight);
            inFlight.clear();
            stageThreads.forEach(Thread::interrupt);
        }
        pending.forEach(future -> future.cancel(true));
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
