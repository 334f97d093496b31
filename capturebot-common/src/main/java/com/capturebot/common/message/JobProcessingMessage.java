package com.capturebot.common.message;

import com.capturebot.common.entity.Job;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Queue payload announcing a new job. The worker reloads the job by id, so the
 * remaining fields are informational only.
 */
public record JobProcessingMessage(
        UUID jobId,
        String senderId,
        String jobType,
        LocalDateTime createdAt
) {
    public static JobProcessingMessage from(Job job) {
        return new JobProcessingMessage(
                job.getId(),
                job.getSenderId(),
                job.getJobType(),
                job.getCreatedAt()
        );
    }
}
