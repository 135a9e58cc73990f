package com.aquiferai.repository;

import com.aquiferai.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link ChatMessage} entities.
 */
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    List<ChatMessage> findBySessionIdOrderBySequenceAsc(UUID sessionId);

    List<ChatMessage> findBySessionIdOrderBySequenceDesc(UUID sessionId, Pageable pageable);

    @Query("select coalesce(max(m.sequence), 0) from ChatMessage m where m.session.id = :sessionId")
    int findMaxSequence(@Param("sessionId") UUID sessionId);

    long countBySessionId(UUID sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ChatMessage m where m.session.id = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
