package com.aquiferai.repository;

import com.aquiferai.entity.ChatSession;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChatSessionRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private ChatSessionRepository chatSessionRepository;

    @Test
    void testSaveAndFind() {
        ChatSession saved = chatSessionRepository.save(ChatSession.builder()
                .title("Porosity in Norway")
                .build());
        assertNotNull(saved.getId());

        Optional<ChatSession> found = chatSessionRepository.findById(saved.getId());
        assertTrue(found.isPresent());
        assertEquals("Porosity in Norway", found.get().getTitle());
        assertNotNull(found.get().getCreatedAt());
    }

    @Test
    void testMostRecentlyUpdatedFirst() throws InterruptedException {
        ChatSession older = chatSessionRepository.saveAndFlush(ChatSession.builder().title("older").build());
        Thread.sleep(20);
        ChatSession newer = chatSessionRepository.saveAndFlush(ChatSession.builder().title("newer").build());

        List<ChatSession> sessions = chatSessionRepository.findAllByOrderByUpdatedAtDesc();

        assertEquals(newer.getId(), sessions.get(0).getId());
        assertEquals(older.getId(), sessions.get(1).getId());
    }
}
