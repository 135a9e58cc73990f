package com.aquiferai.gateway;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.pipeline.service.JsonProcessingService;
import com.aquiferai.pipeline.service.PipelineMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Model gateway over a Spring AI {@link ChatClient}. Each call runs on the gateway executor and is
 * cancelled with interruption when it times out or when the calling thread is interrupted.
 */
@Service
@Slf4j
public class ChatClientModelGateway implements ModelGateway {

    private final ChatClient chatClient;
    private final PipelineProperties properties;
    private final JsonProcessingService jsonProcessingService;
    private final PipelineMetricsService metricsService;
    private final ExecutorService gatewayExecutor;

    public ChatClientModelGateway(ChatClient chatClient,
                                  PipelineProperties properties,
                                  JsonProcessingService jsonProcessingService,
                                  PipelineMetricsService metricsService,
                                  @Qualifier("gatewayExecutor") ExecutorService gatewayExecutor) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.gatewayExecutor = gatewayExecutor;
    }

    @Override
    public String generate(ModelRole role, String systemPrompt, String userTemplate, Map<String, Object> params) {
        metricsService.recordGatewayRequest(role);
        Duration timeout = properties.getGatewayTimeout();
        Future<String> call = gatewayExecutor.submit(() -> call(role, systemPrompt, userTemplate, params));
        String content;
        try {
            content = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new GatewayException(role, "Model call timed out after " + timeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new GatewayException(role, "Model call interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof GatewayException gatewayException) {
                throw gatewayException;
            }
            throw new GatewayException(role, "Model call failed: " + cause.getMessage(), cause);
        }
        if (!StringUtils.hasText(content)) {
            throw new GatewayException(role, "Model returned an empty response");
        }
        return content;
    }

    @Override
    public <T> T generateStructured(ModelRole role, String systemPrompt, String userTemplate,
                                    Map<String, Object> params, Class<T> type) {
        String raw = generate(role, systemPrompt, userTemplate, params);
        T value = jsonProcessingService.parseJsonResponse(role.wireName(), raw, type);
        if (value == null) {
            throw new GatewayException(role, "Model response could not be mapped to " + type.getSimpleName());
        }
        return value;
    }

    private String call(ModelRole role, String systemPrompt, String userTemplate, Map<String, Object> params) {
        ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
        ChatOptions options = optionsFor(role);
        if (options != null) {
            spec = spec.options(options);
        }
        log.debug("Calling model gateway (role={}, params={}).", role.wireName(), params.keySet());
        return spec.system(systemPrompt)
                .user(user -> user.text(userTemplate).params(params))
                .call()
                .content();
    }

    ChatOptions optionsFor(ModelRole role) {
        PipelineProperties.RoleModelConfig config = properties.getModels().forRole(role);
        if (!StringUtils.hasText(config.getModel()) && config.getTemperature() == null) {
            return null;
        }
        ChatOptions.Builder builder = ChatOptions.builder();
        if (StringUtils.hasText(config.getModel())) {
            builder.model(config.getModel());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }
}
