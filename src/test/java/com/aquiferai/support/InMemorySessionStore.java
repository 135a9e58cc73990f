package com.aquiferai.support;

import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.session.SessionMessage;
import com.aquiferai.session.SessionStore;
import com.aquiferai.session.SessionSummary;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, List<ConversationTurn>> turns = new ConcurrentHashMap<>();
    private final Map<String, String> titles = new ConcurrentHashMap<>();

    public InMemorySessionStore withSession(String sessionId) {
        turns.put(sessionId, new ArrayList<>());
        titles.put(sessionId, "New chat");
        return this;
    }

    public synchronized List<ConversationTurn> turns(String sessionId) {
        return List.copyOf(require(sessionId));
    }

    @Override
    public SessionSummary createSession(String title) {
        String id = UUID.randomUUID().toString();
        withSession(id);
        return summary(id);
    }

    @Override
    public synchronized SessionSummary createSessionWithTurn(String question, String answer) {
        String id = UUID.randomUUID().toString();
        withSession(id);
        titles.put(id, question);
        turns.get(id).add(new ConversationTurn(question, answer));
        return summary(id);
    }

    @Override
    public String canonicalId(String sessionId) {
        String trimmed = sessionId.trim();
        try {
            return UUID.fromString(trimmed).toString();
        } catch (IllegalArgumentException ex) {
            // ids used by tests are not always UUIDs
            return trimmed;
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return turns.containsKey(sessionId);
    }

    @Override
    public synchronized List<ConversationTurn> recentTurns(String sessionId, int pairs) {
        List<ConversationTurn> all = require(sessionId);
        return List.copyOf(all.subList(Math.max(0, all.size() - pairs), all.size()));
    }

    @Override
    public synchronized void appendTurn(String sessionId, String question, String answer) {
        require(sessionId).add(new ConversationTurn(question, answer));
    }

    @Override
    public List<SessionSummary> listSessions() {
        return turns.keySet().stream().map(this::summary).toList();
    }

    @Override
    public synchronized List<SessionMessage> history(String sessionId) {
        List<SessionMessage> messages = new ArrayList<>();
        for (ConversationTurn turn : require(sessionId)) {
            messages.add(new SessionMessage("user", turn.userMessage(), OffsetDateTime.now()));
            messages.add(new SessionMessage("assistant", turn.assistantMessage(), OffsetDateTime.now()));
        }
        return messages;
    }

    @Override
    public SessionSummary rename(String sessionId, String title) {
        require(sessionId);
        titles.put(sessionId, title);
        return summary(sessionId);
    }

    @Override
    public void delete(String sessionId) {
        require(sessionId);
        turns.remove(sessionId);
        titles.remove(sessionId);
    }

    private List<ConversationTurn> require(String sessionId) {
        List<ConversationTurn> sessionTurns = turns.get(sessionId);
        if (sessionTurns == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return sessionTurns;
    }

    private SessionSummary summary(String sessionId) {
        OffsetDateTime now = OffsetDateTime.now();
        return new SessionSummary(sessionId, titles.get(sessionId), now, now);
    }
}
