package com.aquiferai.stream;

import com.aquiferai.config.PipelineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the events of streamed pipeline runs and pushes them to WebSocket listeners. A listener
 * reconnecting with the id of the last event it saw receives only what it missed.
 * <p>
 * Finished runs stay available for {@code pipeline.stream-retention} and are dropped when a new run
 * is created after that, unless a listener is still connected.
 */
@Component
@Slf4j
public class PipelineStreamHub {
    static final String EVENT_RUN_COMPLETE = "run-complete";
    static final String EVENT_RUN_CANCEL = "run-cancel";
    static final String EVENT_ERROR = "error";

    private static final Set<String> FINISHING_EVENTS = Set.of(EVENT_RUN_COMPLETE, EVENT_ERROR);
    private static final Set<String> TERMINAL_EVENTS = Set.of(EVENT_RUN_COMPLETE, EVENT_ERROR, EVENT_RUN_CANCEL);
    private static final String RUN_ID_ATTRIBUTE = "runId";

    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public PipelineStreamHub(ObjectMapper objectMapper, PipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String createRun() {
        dropExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun());
        return runId;
    }

    /**
     * Attaches a listener to a run and sends it the events after {@code lastSeenId}. Unknown runs
     * close the connection.
     */
    public void registerListener(String runId, WebSocketSession session, long lastSeenId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            log.debug("Closing listener {} for unknown stream run {}.", session.getId(), runId);
            session.close();
            return;
        }
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        run.subscribe(session, lastSeenId).forEach(event -> send(session, event));
    }

    public void removeListener(WebSocketSession session) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        StreamRun run = runId != null ? runs.get(runId.toString()) : null;
        if (run != null) {
            run.unsubscribe(session);
        }
    }

    /**
     * Publishes an event. Once a run is cancelled only terminal events are published.
     */
    public void emit(String runId, String type, Object data) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        if (run.state() == StreamRun.State.CANCELLED && !TERMINAL_EVENTS.contains(type)) {
            return;
        }
        publish(run, type, data);
        if (FINISHING_EVENTS.contains(type)) {
            run.finish();
        }
    }

    /**
     * Registers work to run when the run is cancelled; runs it at once if it already was.
     */
    public void onCancel(String runId, Runnable callback) {
        StreamRun run = runs.get(runId);
        if (run != null) {
            run.onCancel(callback);
        }
    }

    /**
     * @return false when the run is unknown or already completed
     */
    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        StreamRun.State previous = run.cancel();
        if (previous == StreamRun.State.RUNNING) {
            publish(run, EVENT_RUN_CANCEL, Map.of());
        }
        return previous != StreamRun.State.COMPLETED;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.state() == StreamRun.State.CANCELLED;
    }

    private void publish(StreamRun run, String type, Object data) {
        StreamRun.Delivery delivery = run.append(type, data);
        List<WebSocketSession> listeners = delivery.listeners();
        listeners.forEach(session -> send(session, delivery.event()));
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Stream event {} of type {} could not be serialized: {}", event.id(), event.type(), ex.getMessage());
            return;
        }
        try {
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream event {} to {}: {}", event.id(), session.getId(), ex.getMessage());
        }
    }

    private void dropExpiredRuns() {
        Instant cutoff = Instant.now().minus(properties.getStreamRetention());
        runs.values().removeIf(run -> run.finishedBefore(cutoff) && !run.hasListeners());
    }
}
