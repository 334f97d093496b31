package com.capturebot.ai.service;

import com.capturebot.ai.service.IntentClassifier.Intent;
import com.capturebot.ai.service.agent.RetrievalAgent;
import com.capturebot.ai.service.ingestion.MediaIngestionPipeline;
import com.capturebot.ai.service.ingestion.MediaIngestionResult;
import com.capturebot.ai.service.ingestion.NoteIngestionResult;
import com.capturebot.ai.service.ingestion.NoteIngestionService;
import com.capturebot.common.config.RabbitMQConfig;
import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;
import com.capturebot.common.entity.JobType;
import com.capturebot.common.exception.JobNotFoundException;
import com.capturebot.common.exception.UnsupportedJobTypeException;
import com.capturebot.common.message.JobProcessingMessage;
import com.capturebot.common.service.RecordStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a job from PENDING to COMPLETED or FAILED and delivers the reply.
 *
 * RabbitMQ hands each job id to one consumer at a time; nothing here guards
 * against the same id being processed twice.
 */
@Slf4j
@Service
public class JobLifecycleManager {

    static final String APOLOGY_REPLY = "Sorry, your request could not be processed. Please try again later.";
    static final String EMPTY_MEDIA_REPLY = "Please send one or more images/PDFs.";
    static final int HISTORY_LIMIT = 10;

    private final RecordStoreGateway recordStore;
    private final MediaIngestionPipeline mediaPipeline;
    private final NoteIngestionService noteIngestion;
    private final IntentClassifier intentClassifier;
    private final RetrievalAgent retrievalAgent;
    private final ReplyDeliveryService replyDelivery;
    private final String replyFrom;

    public JobLifecycleManager(RecordStoreGateway recordStore,
            MediaIngestionPipeline mediaPipeline,
            NoteIngestionService noteIngestion,
            IntentClassifier intentClassifier,
            RetrievalAgent retrievalAgent,
            ReplyDeliveryService replyDelivery,
            @Value("${twilio.whatsapp-number:}") String replyFrom) {
        this.recordStore = recordStore;
        this.mediaPipeline = mediaPipeline;
        this.noteIngestion = noteIngestion;
        this.intentClassifier = intentClassifier;
        this.retrievalAgent = retrievalAgent;
        this.replyDelivery = replyDelivery;
        this.replyFrom = replyFrom;
    }

    /**
     * Entry point: triggered by the webhook service via RabbitMQ.
     * Never throws, so a failed job is not redelivered.
     */
    @RabbitListener(queues = RabbitMQConfig.CAPTURE_JOBS_QUEUE)
    public void onJobMessage(JobProcessingMessage message) {
        if (message == null || message.jobId() == null) {
            log.warn("Ignoring job message without a job id");
            return;
        }

        JobOutcome outcome = process(message.jobId());
        if (outcome.success()) {
            log.info("Job {} completed (reply delivered: {})", outcome.jobId(), outcome.replyDelivered());
        } else {
            log.warn("Job {} failed: {}", outcome.jobId(), outcome.error().getMessage());
        }
    }

    public JobOutcome process(UUID jobId) {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("PROCESSING JOB {}", jobId);

        Job job;
        try {
            Optional<Job> found = recordStore.getJob(jobId);
            if (found.isEmpty()) {
                log.error("Job not found: {}", jobId);
                return JobOutcome.failed(jobId, new JobNotFoundException(jobId));
            }
            job = found.get();
        } catch (Exception e) {
            log.error("Could not load job {}: {}", jobId, e.getMessage());
            return JobOutcome.failed(jobId, e);
        }

        log.info("   Type: {}", job.getJobType());
        log.info("   Sender: {}", job.getSenderId());

        // From here on every failure must leave the job FAILED
        Map<String, Object> result;
        try {
            job.markAsProcessing();
            recordStore.updateJob(job);
            result = dispatch(job);
        } catch (Exception e) {
            return fail(job, e);
        }

        try {
            job.markAsCompleted(result);
            recordStore.updateJob(job);
        } catch (Exception e) {
            return fail(job, e);
        }

        boolean delivered = deliverReply(job, String.valueOf(result.get("reply_text")));
        log.info("JOB COMPLETE: {}", jobId);
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        return JobOutcome.completed(jobId, result, delivered);
    }

    private Map<String, Object> dispatch(Job job) {
        JobType type = JobType.fromValue(job.getJobType())
                .orElseThrow(() -> new UnsupportedJobTypeException(job.getJobType()));

        return switch (type) {
            case MEDIA -> processMedia(job);
            case TEXT -> processText(job);
        };
    }

    private Map<String, Object> processMedia(Job job) {
        List<String> mediaUrls = mediaUrlsOf(job.getPayload());

        Map<String, Object> result = new LinkedHashMap<>();
        if (mediaUrls.isEmpty()) {
            result.put("reply_text", EMPTY_MEDIA_REPLY);
            result.put("media_count", 0);
            return result;
        }

        Object caption = job.getPayload() != null ? job.getPayload().get("caption") : null;
        MediaIngestionResult ingested = mediaPipeline.ingest(mediaUrls, job.getSenderId(), job.getCorrelationId(),
                caption != null ? caption.toString() : null);

        result.put("reply_text", "✅ Saved " + ingested.mediaCount() + " file(s) as a record.\nRecord ID: "
                + ingested.recordId());
        result.put("record_id", String.valueOf(ingested.recordId()));
        result.put("media_count", ingested.mediaCount());
        return result;
    }

    private Map<String, Object> processText(Job job) {
        Object rawText = job.getPayload() != null ? job.getPayload().get("text") : null;
        String text = rawText != null ? rawText.toString() : "";
        String question = text.trim();

        List<ConversationMessage> history = recordStore.getRecentMessages(job.getSenderId(), HISTORY_LIMIT);
        Intent intent = intentClassifier.classify(question, history);

        Map<String, Object> result = new LinkedHashMap<>();
        if (intent == Intent.SAVE_RECORD) {
            // notes keep the text exactly as received
            NoteIngestionResult saved = noteIngestion.ingest(text, job.getSenderId(), job.getCorrelationId());
            result.put("reply_text", "✅ Saved your note.\nRecord ID: " + saved.recordId());
            result.put("record_id", String.valueOf(saved.recordId()));
        } else {
            result.put("reply_text", retrievalAgent.answer(job.getSenderId(), question, history));
        }
        return result;
    }

    private JobOutcome fail(Job job, Exception e) {
        log.error("JOB FAILED: {} - {}", job.getId(), e.getMessage());
        try {
            job.markAsFailed(e.getMessage());
            recordStore.updateJob(job);
        } catch (Exception updateError) {
            log.error("Could not mark job {} as failed: {}", job.getId(), updateError.getMessage());
        }

        try {
            replyDelivery.send(job.getSenderId(), replyFrom, APOLOGY_REPLY);
        } catch (Exception deliveryError) {
            log.warn("Could not send apology for job {}: {}", job.getId(), deliveryError.getMessage());
        }
        return JobOutcome.failed(job.getId(), e);
    }

    /**
     * Send the reply and log it as an outbound message. Failures here leave the job COMPLETED.
     */
    private boolean deliverReply(Job job, String replyText) {
        try {
            replyDelivery.send(job.getSenderId(), replyFrom, replyText);
        } catch (Exception e) {
            log.error("Reply delivery failed for job {}: {}", job.getId(), e.getMessage());
            return false;
        }

        try {
            recordStore.saveMessage(ConversationMessage.outbound(job.getSenderId(), job.getCorrelationId(), replyText));
        } catch (Exception e) {
            log.error("Could not log outbound message for job {}: {}", job.getId(), e.getMessage());
            return false;
        }
        return true;
    }

    private static List<String> mediaUrlsOf(Map<String, Object> payload) {
        List<String> urls = new ArrayList<>();
        Object raw = payload != null ? payload.get("media_urls") : null;
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    urls.add(item.toString());
                }
            }
        }
        return urls;
    }
}
