package com.capturebot.common.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log of what the user sent and what the bot replied.
 * Only read back as conversation context.
 */
@Entity
@Table(name = "wbot_messages", indexes = {
        @Index(name = "idx_wbot_messages_phone_number", columnList = "phone_number"),
        @Index(name = "idx_wbot_messages_created_at", columnList = "created_at")
})
public class ConversationMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "phone_number", nullable = false)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private Direction direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private Role role;

    @Column(name = "message_sid")
    private String correlationId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum Direction {
        IN, OUT
    }

    public enum Role {
        USER, ASSISTANT
    }

    public ConversationMessage() {
        this.createdAt = LocalDateTime.now();
    }

    public ConversationMessage(String senderId, Direction direction, Role role, String correlationId,
            String content, Map<String, Object> metadata) {
        this();
        this.senderId = senderId;
        this.direction = direction;
        this.role = role;
        this.correlationId = correlationId;
        this.content = content != null ? content : "";
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    }

    public static ConversationMessage inbound(String senderId, String correlationId, String content,
            Map<String, Object> metadata) {
        return new ConversationMessage(senderId, Direction.IN, Role.USER, correlationId, content, metadata);
    }

    public static ConversationMessage outbound(String senderId, String correlationId, String content) {
        return new ConversationMessage(senderId, Direction.OUT, Role.ASSISTANT, correlationId, content, Map.of());
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getSenderId() {
        return senderId;
    }

    public Direction getDirection() {
        return direction;
    }

    public Role getRole() {
        return role;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getContent() {
        return content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return String.format("ConversationMessage{sender='%s', %s/%s, content='%s'}",
                senderId, role, direction,
                content != null && content.length() > 40 ? content.substring(0, 40) + "..." : content);
    }
}
