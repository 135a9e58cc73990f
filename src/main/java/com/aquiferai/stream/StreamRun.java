package com.aquiferai.stream;

import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Events and listeners of one streamed pipeline run. A run emits a bounded number of events, so all
 * of them are kept and a listener connecting late sees the whole run.
 * <p>
 * Event ids are consecutive from 1.
 */
class StreamRun {

    enum State {
        RUNNING, COMPLETED, CANCELLED
    }

    private final List<StreamEvent> events = new ArrayList<>();
    private final Map<String, WebSocketSession> listeners = new LinkedHashMap<>();
    private final List<Runnable> cancelCallbacks = new ArrayList<>();
    private State state = State.RUNNING;
    @Nullable
    private Instant finishedAt;

    /**
     * Appends an event and returns the listeners it must be sent to.
     */
    synchronized Delivery append(String type, Object data) {
        StreamEvent event = new StreamEvent(events.size() + 1L, Instant.now(), type, data);
        events.add(event);
        return new Delivery(event, List.copyOf(listeners.values()));
    }

    /**
     * Adds a listener and returns the events after {@code lastSeenId} it has to catch up on. Events
     * appended afterwards reach it through {@link #append}.
     */
    synchronized List<StreamEvent> subscribe(WebSocketSession session, long lastSeenId) {
        listeners.put(session.getId(), session);
        int from = (int) Math.min(Math.max(lastSeenId, 0L), events.size());
        return List.copyOf(events.subList(from, events.size()));
    }

    synchronized void unsubscribe(WebSocketSession session) {
        listeners.remove(session.getId());
    }

    synchronized boolean hasListeners() {
        return !listeners.isEmpty();
    }

    synchronized State state() {
        return state;
    }

    synchronized void finish() {
        if (state == State.RUNNING) {
            state = State.COMPLETED;
        }
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    synchronized boolean finishedBefore(Instant cutoff) {
        return finishedAt != null && finishedAt.isBefore(cutoff);
    }

    /**
     * Registers work to run on cancellation, or runs it at once when the run is already cancelled.
     */
    void onCancel(Runnable callback) {
        synchronized (this) {
            if (state != State.CANCELLED) {
                cancelCallbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * Cancels a running run and runs its cancel callbacks.
     *
     * @return the state before the call
     */
    State cancel() {
        List<Runnable> callbacks;
        State previous;
        synchronized (this) {
            previous = state;
            if (previous != State.RUNNING) {
                return previous;
            }
            state = State.CANCELLED;
            callbacks = List.copyOf(cancelCallbacks);
            cancelCallbacks.clear();
        }
        callbacks.forEach(Runnable::run);
        return previous;
    }

    record Delivery(StreamEvent event, List<WebSocketSession> listeners) {
    }
}
