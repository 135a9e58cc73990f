package com.aquiferai.gateway;

import java.util.Map;

/**
 * Role-addressed access to the configured text generation backend.
 * <p>
 * Implementations are stateless. Every failure, including timeouts and output that cannot be
 * mapped to the requested type, surfaces as a {@link GatewayException}.
 */
public interface ModelGateway {

    /**
     * Generates free text.
     *
     * @param role         the logical caller, selects model and sampling settings
     * @param systemPrompt the system instructions
     * @param userTemplate the user message template with {@code {name}} placeholders
     * @param params       values for the template placeholders
     * @return the generated text, never blank
     */
    String generate(ModelRole role, String systemPrompt, String userTemplate, Map<String, Object> params);

    /**
     * Generates a JSON document and maps it onto {@code type}.
     *
     * @param role         the logical caller
     * @param systemPrompt the system instructions, including the expected JSON shape
     * @param userTemplate the user message template with {@code {name}} placeholders
     * @param params       values for the template placeholders
     * @param type         the target type
     * @return the parsed value, never null
     */
    <T> T generateStructured(ModelRole role, String systemPrompt, String userTemplate,
                             Map<String, Object> params, Class<T> type);
}
