package com.aquiferai.api;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.graph.GraphStore;
import com.aquiferai.pipeline.PipelineCancelledException;
import com.aquiferai.pipeline.PipelineOrchestrator;
import com.aquiferai.stream.PipelineStreamService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/v2/chat")
public class ChatController {

    private final PipelineOrchestrator orchestrator;
    private final PipelineStreamService streamService;
    private final GraphStore graphStore;
    private final PipelineProperties properties;
    private final ExecutorService pipelineExecutor;

    public ChatController(PipelineOrchestrator orchestrator,
                          PipelineStreamService streamService,
                          GraphStore graphStore,
                          PipelineProperties properties,
                          @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.orchestrator = orchestrator;
        this.streamService = streamService;
        this.graphStore = graphStore;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;
    }

    @PostMapping("/message")
    public ChatMessageResponse message(@Valid @RequestBody ChatMessageRequest request) {
        try {
            var result = orchestrator.run(request.message(), request.sessionId(), request.expertMode());
            return ChatMessageResponse.from(result);
        } catch (PipelineCancelledException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage());
        }
    }

    @PostMapping("/stream")
    public StreamStartResponse stream(@Valid @RequestBody ChatMessageRequest request) {
        String runId = streamService.createRun();
        streamService.emitStatus(runId, "Queued");
        CompletableFuture.runAsync(() -> orchestrator.runStreaming(request.message(), request.sessionId(),
                request.expertMode(), runId), pipelineExecutor);
        return new StreamStartResponse(runId, Instant.now());
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancel(@PathVariable String runId) {
        boolean streamCancelled = streamService.cancelRun(runId);
        boolean runCancelled = orchestrator.cancel(runId);
        return streamCancelled || runCancelled ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        boolean graphAvailable = graphStore.isAvailable();
        return new HealthResponse(graphAvailable ? "UP" : "DEGRADED", graphAvailable, properties.getBackend().name());
    }
}
