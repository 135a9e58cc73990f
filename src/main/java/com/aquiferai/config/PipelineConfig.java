package com.aquiferai.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public ChatClient chatClient(PipelineProperties properties,
                                 ObjectProvider<OllamaChatModel> ollamaChatModelProvider,
                                 ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
                                 ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        ChatModel chatModel = switch (properties.getBackend()) {
            case OLLAMA -> ollamaChatModelProvider.getIfAvailable();
            case OPENAI -> openAiChatModelProvider.getIfAvailable();
            case GOOGLE -> googleGenAiChatModelProvider.getIfAvailable();
        };
        if (chatModel == null) {
            throw new IllegalStateException("Chat backend " + properties.getBackend() + " is not configured. "
                    + "Check that spring.ai.model.chat matches pipeline.backend and the backend settings are present.");
        }
        log.info("Model gateway backend: {}", properties.getBackend());
        return ChatClient.builder(chatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerConcurrency()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService gatewayExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        return Executors.newCachedThreadPool();
    }
}
