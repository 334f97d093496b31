package com.capturebot.common.repository;

import com.capturebot.common.entity.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, UUID> {

    // Most-recent-first conversation context
    List<ConversationMessage> findBySenderIdOrderByCreatedAtDesc(String senderId, Pageable pageable);
}
