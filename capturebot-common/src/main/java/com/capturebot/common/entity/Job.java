package com.capturebot.common.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One inbound WhatsApp message waiting to be (or already) processed by the worker.
 *
 * Status only moves forward: PENDING → PROCESSING → COMPLETED | FAILED.
 * Once terminal, exactly one of {@code result} / {@code error} is set.
 */
@Entity
@Table(name = "wbot_jobs", indexes = {
        @Index(name = "idx_wbot_jobs_phone_number", columnList = "phone_number"),
        @Index(name = "idx_wbot_jobs_status", columnList = "status"),
        @Index(name = "idx_wbot_jobs_created_at", columnList = "created_at")
})
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "phone_number", nullable = false)
    private String senderId; // "whatsapp:+14155550123"

    @Column(name = "message_sid")
    private String correlationId; // Twilio MessageSid

    @Column(name = "job_type", nullable = false, length = 20)
    private String jobType; // raw value so unknown types survive to the worker

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> payload = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result", columnDefinition = "jsonb")
    private Map<String, Object> result;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public enum JobStatus {
        PENDING, // Created by the webhook, waiting in the queue
        PROCESSING, // Picked up by a worker
        COMPLETED, // Reply produced, result stored
        FAILED; // Error stored, apology attempted

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    public Job() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public Job(String senderId, String correlationId, JobType jobType, Map<String, Object> payload) {
        this(senderId, correlationId, jobType.getValue(), payload);
    }

    public Job(String senderId, String correlationId, String jobType, Map<String, Object> payload) {
        this();
        this.senderId = senderId;
        this.correlationId = correlationId;
        this.jobType = jobType;
        this.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    // Lifecycle transitions

    public void markAsProcessing() {
        this.status = JobStatus.PROCESSING;
        this.updatedAt = LocalDateTime.now();
    }

    public void markAsCompleted(Map<String, Object> result) {
        this.status = JobStatus.COMPLETED;
        this.result = result != null ? new HashMap<>(result) : new HashMap<>();
        this.error = null;
        this.updatedAt = LocalDateTime.now();
    }

    public void markAsFailed(String error) {
        this.status = JobStatus.FAILED;
        this.error = error != null ? error : "Unknown error";
        this.result = null;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
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

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", senderId='" + senderId + '\'' +
                ", jobType='" + jobType + '\'' +
                ", status=" + status +
                ", createdAt=" + createdAt +
                '}';
    }
}
