package com.capturebot.webhook.service;

import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;
import com.capturebot.common.entity.JobType;
import com.capturebot.common.exception.JobNotFoundException;
import com.capturebot.common.service.RecordStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Accepts inbound messages: logs them, creates a PENDING job and queues it.
 * Processing happens in the worker.
 */
@Slf4j
@Service
public class InboundMessageService {

    public enum Status {
        EMPTY, // nothing to do, ask the user for input
        QUEUED,
        QUEUE_FAILED // job exists but was never published
    }

    public record Outcome(Status status, Job job) {
    }

    @Autowired
    private RecordStoreGateway recordStore;

    @Autowired
    private JobPublisher publisher;

    public Outcome accept(InboundMessage message) {
        if (message.isEmpty()) {
            log.info("Empty message from {}", message.from());
            return new Outcome(Status.EMPTY, null);
        }

        // 1. Log the inbound message; a failure here must not lose the job
        try {
            recordStore.saveMessage(ConversationMessage.inbound(
                    message.from(), message.messageSid(), contentOf(message), metadataOf(message)));
        } catch (Exception e) {
            log.error("Failed to save incoming message from {}: {}", message.from(), e.getMessage());
        }

        // 2. Create the job
        Job job = recordStore.createJob(new Job(
                message.from(),
                message.messageSid(),
                message.hasMedia() ? JobType.MEDIA : JobType.TEXT,
                payloadOf(message)));

        // 3. Queue it
        try {
            publisher.publish(job);
        } catch (Exception e) {
            log.error("Failed to enqueue job {}: {}", job.getId(), e.getMessage());
            return new Outcome(Status.QUEUE_FAILED, job);
        }

        log.info("Accepted {} message from {} as job {}", job.getJobType(), message.from(), job.getId());
        return new Outcome(Status.QUEUED, job);
    }

    public Job getJob(UUID jobId) {
        return recordStore.getJob(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    static Map<String, Object> payloadOf(InboundMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (message.hasMedia()) {
            payload.put("media_urls", message.mediaUrls());
            if (!message.body().isEmpty()) {
                payload.put("caption", message.body());
            }
        } else {
            payload.put("text", message.body());
        }
        return payload;
    }

    private static String contentOf(InboundMessage message) {
        if (!message.body().isEmpty()) {
            return message.body();
        }
        return "[media] " + String.join(", ", message.mediaUrls());
    }

    private static Map<String, Object> metadataOf(InboundMessage message) {
        return message.hasMedia() ? Map.of("media_urls", message.mediaUrls()) : Map.of();
    }
}
