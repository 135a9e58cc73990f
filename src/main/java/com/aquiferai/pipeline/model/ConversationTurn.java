package com.aquiferai.pipeline.model;

/**
 * A question and the answer given to it, in session order.
 */
public record ConversationTurn(
        String userMessage,
        String assistantMessage
) {
}
