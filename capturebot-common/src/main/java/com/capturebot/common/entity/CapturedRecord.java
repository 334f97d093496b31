package com.capturebot.common.entity;

import com.capturebot.common.converter.EmbeddingConverter;
import jakarta.persistence.*;
import org.hibernate.annotations.ColumnTransformer;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A saved unit of captured information: OCR text from one or more media files,
 * or a note the user typed. Written once, never updated.
 */
@Entity
@Table(name = "wbot_records", indexes = {
        @Index(name = "idx_wbot_records_phone_number", columnList = "phone_number"),
        @Index(name = "idx_wbot_records_created_at", columnList = "created_at")
})
public class CapturedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "phone_number", nullable = false)
    private String senderId;

    @Column(name = "message_sid")
    private String correlationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 20)
    private RecordType recordType;

    @Column(name = "ocr_text", columnDefinition = "TEXT")
    private String ocrText; // media records

    @Column(name = "user_text", columnDefinition = "TEXT")
    private String userText; // note records

    // pgvector column, exchanged with the driver in its text form "[0.1,0.2,...]"
    @Convert(converter = EmbeddingConverter.class)
    @ColumnTransformer(read = "CAST(embedding AS text)", write = "CAST(? AS vector)")
    @Column(name = "embedding", columnDefinition = "vector(1536)")
    private float[] embedding;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "storage_urls", columnDefinition = "jsonb")
    private List<String> storageUrls = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum RecordType {
        MEDIA, // OCR text of images / PDFs
        NOTE // free text typed by the user
    }

    public CapturedRecord() {
        this.createdAt = LocalDateTime.now();
    }

    public static CapturedRecord media(String senderId, String correlationId, List<String> storageUrls,
            String ocrText, float[] embedding, Map<String, Object> metadata) {
        CapturedRecord record = new CapturedRecord();
        record.senderId = senderId;
        record.correlationId = correlationId;
        record.recordType = RecordType.MEDIA;
        record.storageUrls = new ArrayList<>(storageUrls);
        record.ocrText = ocrText;
        record.embedding = embedding;
        record.metadata = new HashMap<>(metadata);
        return record;
    }

    public static CapturedRecord note(String senderId, String correlationId, String userText,
            float[] embedding, Map<String, Object> metadata) {
        CapturedRecord record = new CapturedRecord();
        record.senderId = senderId;
        record.correlationId = correlationId;
        record.recordType = RecordType.NOTE;
        record.userText = userText;
        record.embedding = embedding;
        record.metadata = new HashMap<>(metadata);
        return record;
    }

    /**
     * The searchable text of this record regardless of its type.
     */
    public String getContent() {
        if (ocrText != null && !ocrText.isEmpty())
            return ocrText;
        return userText != null ? userText : "";
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
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

    public String getCorrelationId() {
        return correlationId;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    public String getOcrText() {
        return ocrText;
    }

    public String getUserText() {
        return userText;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public List<String> getStorageUrls() {
        return storageUrls;
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
        return "CapturedRecord{" +
                "id=" + id +
                ", senderId='" + senderId + '\'' +
                ", recordType=" + recordType +
                ", createdAt=" + createdAt +
                '}';
    }
}
