package com.aquiferai.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.UUID;

@Service
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    public JsonProcessingService(ObjectMapper objectMapper) {
        JsonMapper.Builder builder = objectMapper instanceof JsonMapper jsonMapper
                ? jsonMapper.rebuild()
                : JsonMapper.builder().findAndAddModules();
        this.objectMapper = builder
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    /**
     * Maps the first JSON object found in a model response onto {@code type}.
     *
     * @return the parsed value, or null when the response holds no usable JSON
     */
    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    /**
     * Cuts the outermost braces out of the response, which also drops surrounding prose and fences.
     */
    private String extractJsonObject(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {}: {}", value.getClass().getSimpleName(), ex.getOriginalMessage());
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }
}
