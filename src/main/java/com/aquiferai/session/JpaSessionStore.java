package com.aquiferai.session;

import com.aquiferai.entity.ChatMessage;
import com.aquiferai.entity.ChatSession;
import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.repository.ChatMessageRepository;
import com.aquiferai.repository.ChatSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSessionStore implements SessionStore {

    static final String DEFAULT_TITLE = "New chat";
    private static final int TITLE_LENGTH = 60;

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;

    @Override
    @Transactional
    public SessionSummary createSession(@Nullable String title) {
        ChatSession session = sessionRepository.save(ChatSession.builder()
                .title(StringUtils.hasText(title) ? abbreviate(title.trim()) : DEFAULT_TITLE)
                .build());
        log.info("Created chat session {}.", session.getId());
        return toSummary(session);
    }

    @Override
    @Transactional
    public SessionSummary createSessionWithTurn(String question, String answer) {
        ChatSession session = sessionRepository.save(ChatSession.builder()
                .title(abbreviate(question.trim()))
                .build());
        appendMessages(session, question, answer);
        log.info("Created chat session {} with its first turn.", session.getId());
        return toSummary(session);
    }

    @Override
    public String canonicalId(String sessionId) {
        UUID id = parseId(sessionId);
        if (id == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return id.toString();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String sessionId) {
        UUID id = parseId(sessionId);
        return id != null && sessionRepository.existsById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurn> recentTurns(String sessionId, int pairs) {
        if (pairs <= 0) {
            return List.of();
        }
        ChatSession session = require(sessionId);
        List<ChatMessage> recent = new ArrayList<>(
                messageRepository.findBySessionIdOrderBySequenceDesc(session.getId(), PageRequest.of(0, pairs * 2)));
        Collections.reverse(recent);
        List<ConversationTurn> turns = new ArrayList<>();
        String pendingQuestion = null;
        for (ChatMessage message : recent) {
            if (ChatMessage.ROLE_USER.equals(message.getRole())) {
                pendingQuestion = message.getContent();
            } else if (pendingQuestion != null) {
                turns.add(new ConversationTurn(pendingQuestion, message.getContent()));
                pendingQuestion = null;
            }
        }
        return turns;
    }

    @Override
    @Transactional
    public void appendTurn(String sessionId, String question, String answer) {
        ChatSession session = require(sessionId);
        appendMessages(session, question, answer);
        if (DEFAULT_TITLE.equals(session.getTitle())) {
            session.setTitle(abbreviate(question.trim()));
        }
        // marks the session dirty so updated_at moves
        session.setUpdatedAt(OffsetDateTime.now());
        sessionRepository.save(session);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionSummary> listSessions() {
        return sessionRepository.findAllByOrderByUpdatedAtDesc().stream()
                .map(this::toSummary)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionMessage> history(String sessionId) {
        ChatSession session = require(sessionId);
        return messageRepository.findBySessionIdOrderBySequenceAsc(session.getId()).stream()
                .map(message -> new SessionMessage(message.getRole(), message.getContent(), message.getCreatedAt()))
                .toList();
    }

    @Override
    @Transactional
    public SessionSummary rename(String sessionId, String title) {
        if (!StringUtils.hasText(title)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Title must not be blank");
        }
        ChatSession session = require(sessionId);
        session.setTitle(abbreviate(title.trim()));
        return toSummary(sessionRepository.save(session));
    }

    @Override
    @Transactional
    public void delete(String sessionId) {
        ChatSession session = require(sessionId);
        int removed = messageRepository.deleteBySessionId(session.getId());
        sessionRepository.delete(session);
        log.info("Deleted chat session {} with {} messages.", sessionId, removed);
    }

    private void appendMessages(ChatSession session, String question, String answer) {
        int sequence = messageRepository.findMaxSequence(session.getId());
        messageRepository.save(ChatMessage.builder()
                .session(session)
                .role(ChatMessage.ROLE_USER)
                .content(question)
                .sequence(sequence + 1)
                .build());
        messageRepository.save(ChatMessage.builder()
                .session(session)
                .role(ChatMessage.ROLE_ASSISTANT)
                .content(answer)
                .sequence(sequence + 2)
                .build());
    }

    private ChatSession require(String sessionId) {
        UUID id = parseId(sessionId);
        if (id == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return sessionRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
    }

    @Nullable
    private static UUID parseId(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return null;
        }
        try {
            return UUID.fromString(sessionId.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private SessionSummary toSummary(ChatSession session) {
        return new SessionSummary(session.getId().toString(), session.getTitle(), session.getCreatedAt(), session.getUpdatedAt());
    }

    private static String abbreviate(String title) {
        String singleLine = title.replaceAll("\\s+", " ");
        if (singleLine.length() <= TITLE_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, TITLE_LENGTH - 3) + "...";
    }
}
