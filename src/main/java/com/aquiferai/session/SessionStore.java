package com.aquiferai.session;

import com.aquiferai.pipeline.model.ConversationTurn;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Conversation persistence keyed by session id. Unknown ids are reported as HTTP 404 through
 * {@link org.springframework.web.server.ResponseStatusException}.
 */
public interface SessionStore {

    SessionSummary createSession(@Nullable String title);

    /**
     * Creates a session holding its first question and answer in one transaction.
     */
    SessionSummary createSessionWithTurn(String question, String answer);

    /**
     * Normalizes a client-supplied session id to the form the store keys sessions by, so that two
     * spellings of one id address the same session.
     *
     * @throws org.springframework.web.server.ResponseStatusException 404 when the id cannot name a session
     */
    String canonicalId(String sessionId);

    boolean exists(String sessionId);

    /**
     * @return up to {@code pairs} most recent question/answer pairs, oldest first
     */
    List<ConversationTurn> recentTurns(String sessionId, int pairs);

    /**
     * Appends one question and its answer atomically.
     */
    void appendTurn(String sessionId, String question, String answer);

    List<SessionSummary> listSessions();

    List<SessionMessage> history(String sessionId);

    SessionSummary rename(String sessionId, String title);

    void delete(String sessionId);
}
