package com.aquiferai.repository;

import com.aquiferai.entity.ChatMessage;
import com.aquiferai.entity.ChatSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatMessageRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private ChatSessionRepository chatSessionRepository;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    private ChatSession session;

    @BeforeEach
    void setUp() {
        session = chatSessionRepository.save(ChatSession.builder().title("Basins").build());
    }

    @Test
    void testMaxSequenceStartsAtZero() {
        assertEquals(0, chatMessageRepository.findMaxSequence(session.getId()));
    }

    @Test
    void testMessagesInSequenceOrder() {
        save(2, ChatMessage.ROLE_ASSISTANT, "There are 12 basins.");
        save(1, ChatMessage.ROLE_USER, "How many basins are there?");
        save(3, ChatMessage.ROLE_USER, "Which is the largest?");

        List<ChatMessage> ascending = chatMessageRepository.findBySessionIdOrderBySequenceAsc(session.getId());
        assertEquals(List.of(1, 2, 3), ascending.stream().map(ChatMessage::getSequence).toList());

        List<ChatMessage> latest = chatMessageRepository.findBySessionIdOrderBySequenceDesc(session.getId(),
                PageRequest.of(0, 2));
        assertEquals(List.of(3, 2), latest.stream().map(ChatMessage::getSequence).toList());

        assertEquals(3, chatMessageRepository.findMaxSequence(session.getId()));
        assertEquals(3, chatMessageRepository.countBySessionId(session.getId()));
    }

    @Test
    void testDeleteBySession() {
        save(1, ChatMessage.ROLE_USER, "question");
        save(2, ChatMessage.ROLE_ASSISTANT, "answer");

        assertEquals(2, chatMessageRepository.deleteBySessionId(session.getId()));
        assertEquals(0, chatMessageRepository.countBySessionId(session.getId()));
    }

    private void save(int sequence, String role, String content) {
        chatMessageRepository.saveAndFlush(ChatMessage.builder()
                .session(session)
                .role(role)
                .content(content)
                .sequence(sequence)
                .build());
    }
}
