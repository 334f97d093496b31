package com.capturebot.ai.service;

import com.capturebot.ai.service.IntentClassifier.Intent;
import com.capturebot.ai.service.agent.RetrievalAgent;
import com.capturebot.ai.service.ingestion.MediaIngestionPipeline;
import com.capturebot.ai.service.ingestion.MediaIngestionResult;
import com.capturebot.ai.service.ingestion.NoteIngestionResult;
import com.capturebot.ai.service.ingestion.NoteIngestionService;
import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;
import com.capturebot.common.entity.JobType;
import com.capturebot.common.exception.AnswerException;
import com.capturebot.common.exception.DeliveryException;
import com.capturebot.common.exception.JobNotFoundException;
import com.capturebot.common.exception.ProcessingException;
import com.capturebot.common.exception.UnsupportedJobTypeException;
import com.capturebot.common.message.JobProcessingMessage;
import com.capturebot.common.service.RecordStoreGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobLifecycleManager: dispatch, status transitions and reply delivery.
 */
@ExtendWith(MockitoExtension.class)
class JobLifecycleManagerTest {

    @Mock
    private RecordStoreGateway recordStore;

    @Mock
    private MediaIngestionPipeline mediaPipeline;

    @Mock
    private NoteIngestionService noteIngestion;

    @Mock
    private IntentClassifier intentClassifier;

    @Mock
    private RetrievalAgent retrievalAgent;

    @Mock
    private ReplyDeliveryService replyDelivery;

    private JobLifecycleManager manager;

    private static final String SENDER = "whatsapp:+15550001";
    private static final String BOT_NUMBER = "whatsapp:+14155238886";

    @BeforeEach
    void setUp() {
        manager = new JobLifecycleManager(recordStore, mediaPipeline, noteIngestion, intentClassifier,
                retrievalAgent, replyDelivery, BOT_NUMBER);
    }

    private Job storedJob(String jobType, Map<String, Object> payload) {
        Job job = new Job(SENDER, "SM1", jobType, payload);
        job.setId(UUID.randomUUID());
        when(recordStore.getJob(job.getId())).thenReturn(Optional.of(job));
        return job;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Media Jobs
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("A media job completes with the saved record and delivers the confirmation")
    void process_shouldCompleteMediaJob() {
        UUID recordId = UUID.randomUUID();
        Job job = storedJob("media", Map.of("media_urls", List.of("u1", "u2"), "caption", "lunch"));
        when(mediaPipeline.ingest(List.of("u1", "u2"), SENDER, "SM1", "lunch"))
                .thenReturn(new MediaIngestionResult(recordId, 2));

        JobOutcome outcome = manager.process(job.getId());

        String expectedReply = "✅ Saved 2 file(s) as a record.\nRecord ID: " + recordId;
        assertTrue(outcome.success());
        assertTrue(outcome.replyDelivered());
        assertEquals(Job.JobStatus.COMPLETED, job.getStatus());
        assertEquals(expectedReply, job.getResult().get("reply_text"));
        assertEquals(recordId.toString(), job.getResult().get("record_id"));
        assertEquals(2, job.getResult().get("media_count"));
        assertNull(job.getError());

        verify(replyDelivery).send(SENDER, BOT_NUMBER, expectedReply);
        ArgumentCaptor<ConversationMessage> message = ArgumentCaptor.forClass(ConversationMessage.class);
        verify(recordStore).saveMessage(message.capture());
        assertEquals(ConversationMessage.Direction.OUT, message.getValue().getDirection());
        assertEquals(ConversationMessage.Role.ASSISTANT, message.getValue().getRole());
        assertEquals("SM1", message.getValue().getCorrelationId());
        assertEquals(expectedReply, message.getValue().getContent());
    }

    @Test
    @DisplayName("The job is persisted as PROCESSING before any work happens")
    void process_shouldPersistProcessingFirst() {
        Job job = storedJob("media", Map.of("media_urls", List.of("u1")));
        when(mediaPipeline.ingest(anyList(), anyString(), anyString(), isNull()))
                .thenReturn(new MediaIngestionResult(UUID.randomUUID(), 1));
        // record the status at each save
        List<Job.JobStatus> statuses = new java.util.ArrayList<>();
        when(recordStore.updateJob(any(Job.class))).thenAnswer(inv -> {
            statuses.add(((Job) inv.getArgument(0)).getStatus());
            return inv.getArgument(0);
        });

        manager.process(job.getId());

        assertEquals(List.of(Job.JobStatus.PROCESSING, Job.JobStatus.COMPLETED), statuses);
        InOrder order = inOrder(recordStore, mediaPipeline);
        order.verify(recordStore).updateJob(job);
        order.verify(mediaPipeline).ingest(anyList(), anyString(), anyString(), isNull());
    }

    @Test
    @DisplayName("A media job without URLs completes with a hint and saves nothing")
    void process_shouldHandleEmptyMediaList() {
        Job job = storedJob("media", Map.of("media_urls", List.of()));

        JobOutcome outcome = manager.process(job.getId());

        assertTrue(outcome.success());
        assertEquals("Please send one or more images/PDFs.", job.getResult().get("reply_text"));
        assertEquals(0, job.getResult().get("media_count"));
        verifyNoInteractions(mediaPipeline);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Text Jobs
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("A text job classified as save_record stores a note")
    void process_shouldSaveNote() {
        UUID recordId = UUID.randomUUID();
        Job job = storedJob("text", Map.of("text", "Locker code 4242"));
        when(recordStore.getRecentMessages(SENDER, 10)).thenReturn(List.of());
        when(intentClassifier.classify("Locker code 4242", List.of())).thenReturn(Intent.SAVE_RECORD);
        when(noteIngestion.ingest("Locker code 4242", SENDER, "SM1")).thenReturn(new NoteIngestionResult(recordId));

        manager.process(job.getId());

        assertEquals("✅ Saved your note.\nRecord ID: " + recordId, job.getResult().get("reply_text"));
        assertEquals(recordId.toString(), job.getResult().get("record_id"));
        verifyNoInteractions(retrievalAgent);
    }

    @Test
    @DisplayName("Notes are saved exactly as received while the classifier sees trimmed text")
    void process_shouldSaveRawNoteText() {
        String raw = "  Locker code 4242\n";
        Job job = storedJob("text", Map.of("text", raw));
        when(recordStore.getRecentMessages(SENDER, 10)).thenReturn(List.of());
        when(intentClassifier.classify("Locker code 4242", List.of())).thenReturn(Intent.SAVE_RECORD);
        when(noteIngestion.ingest(raw, SENDER, "SM1")).thenReturn(new NoteIngestionResult(UUID.randomUUID()));

        JobOutcome outcome = manager.process(job.getId());

        assertTrue(outcome.success());
        verify(noteIngestion).ingest(raw, SENDER, "SM1");
    }

    @Test
    @DisplayName("A text job classified as a question is answered by the agent with the same history")
    void process_shouldAnswerQuestion() {
        Job job = storedJob("text", Map.of("text", "How much was coffee?"));
        List<ConversationMessage> history = List.of(
                ConversationMessage.inbound(SENDER, "SM1", "How much was coffee?", Map.of()));
        when(recordStore.getRecentMessages(SENDER, 10)).thenReturn(history);
        when(intentClassifier.classify("How much was coffee?", history)).thenReturn(Intent.QUESTION);
        when(retrievalAgent.answer(SENDER, "How much was coffee?", history)).thenReturn("$4.50");

        JobOutcome outcome = manager.process(job.getId());

        assertTrue(outcome.success());
        assertEquals(Map.of("reply_text", "$4.50"), job.getResult());
        verify(replyDelivery).send(SENDER, BOT_NUMBER, "$4.50");
        verifyNoInteractions(noteIngestion);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Failure Handling
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("A missing job is reported without updates or delivery")
    void process_shouldReportMissingJob() {
        UUID jobId = UUID.randomUUID();
        when(recordStore.getJob(jobId)).thenReturn(Optional.empty());

        JobOutcome outcome = manager.process(jobId);

        assertFalse(outcome.success());
        assertInstanceOf(JobNotFoundException.class, outcome.error());
        verify(recordStore, never()).updateJob(any());
        verifyNoInteractions(replyDelivery);
    }

    @Test
    @DisplayName("A store failure while marking PROCESSING still ends the job FAILED with an apology")
    void process_shouldFailWhenProcessingUpdateFails() {
        Job job = storedJob("media", Map.of("media_urls", List.of("u1")));
        when(recordStore.updateJob(any(Job.class)))
                .thenThrow(new RuntimeException("connection reset"))
                .thenAnswer(inv -> inv.getArgument(0));

        JobOutcome outcome = manager.process(job.getId());

        assertFalse(outcome.success());
        assertEquals("connection reset", outcome.error().getMessage());
        assertEquals(Job.JobStatus.FAILED, job.getStatus());
        assertEquals("connection reset", job.getError());
        assertNull(job.getResult());
        verify(recordStore, times(2)).updateJob(job);
        verify(replyDelivery, times(1)).send(SENDER, BOT_NUMBER, JobLifecycleManager.APOLOGY_REPLY);
        verifyNoInteractions(mediaPipeline);
    }

    @Test
    @DisplayName("An unknown job type fails the job and sends an apology")
    void process_shouldFailUnsupportedJobType() {
        Job job = storedJob("video", Map.of());

        JobOutcome outcome = manager.process(job.getId());

        assertFalse(outcome.success());
        assertInstanceOf(UnsupportedJobTypeException.class, outcome.error());
        assertEquals(Job.JobStatus.FAILED, job.getStatus());
        assertEquals("Unsupported job_type: video", job.getError());
        assertNull(job.getResult());
        verify(replyDelivery).send(SENDER, BOT_NUMBER, JobLifecycleManager.APOLOGY_REPLY);
    }

    @Test
    @DisplayName("A pipeline failure marks the job FAILED with the error message")
    void process_shouldFailOnPipelineError() {
        Job job = storedJob("media", Map.of("media_urls", List.of("u1")));
        when(mediaPipeline.ingest(anyList(), anyString(), anyString(), any()))
                .thenThrow(new ProcessingException("Failed to download media: 404"));

        JobOutcome outcome = manager.process(job.getId());

        assertFalse(outcome.success());
        assertEquals(Job.JobStatus.FAILED, job.getStatus());
        assertEquals("Failed to download media: 404", job.getError());
        verify(replyDelivery).send(SENDER, BOT_NUMBER, JobLifecycleManager.APOLOGY_REPLY);
        verify(recordStore, never()).saveMessage(any());
    }

    @Test
    @DisplayName("An apology that cannot be delivered does not escape process")
    void process_shouldSwallowApologyDeliveryFailure() {
        Job job = storedJob("text", Map.of("text", "q"));
        when(recordStore.getRecentMessages(SENDER, 10)).thenReturn(List.of());
        when(intentClassifier.classify(anyString(), anyList())).thenReturn(Intent.QUESTION);
        when(retrievalAgent.answer(anyString(), anyString(), anyList())).thenThrow(new AnswerException("model down"));
        doThrow(new DeliveryException("twilio down")).when(replyDelivery).send(anyString(), anyString(), anyString());

        JobOutcome outcome = assertDoesNotThrow(() -> manager.process(job.getId()));

        assertFalse(outcome.success());
        assertEquals(Job.JobStatus.FAILED, job.getStatus());
        assertEquals("model down", job.getError());
    }

    @Test
    @DisplayName("A reply that cannot be delivered leaves the job COMPLETED")
    void process_shouldKeepCompletedWhenDeliveryFails() {
        Job job = storedJob("media", Map.of("media_urls", List.of()));
        doThrow(new DeliveryException("twilio down")).when(replyDelivery).send(anyString(), anyString(), anyString());

        JobOutcome outcome = manager.process(job.getId());

        assertTrue(outcome.success());
        assertFalse(outcome.replyDelivered());
        assertEquals(Job.JobStatus.COMPLETED, job.getStatus());
        verify(recordStore, never()).saveMessage(any());
    }

    @Test
    @DisplayName("The queue listener never rethrows")
    void onJobMessage_shouldNotThrow() {
        UUID jobId = UUID.randomUUID();
        when(recordStore.getJob(jobId)).thenThrow(new RuntimeException("db down"));

        assertDoesNotThrow(() -> manager.onJobMessage(
                new JobProcessingMessage(jobId, SENDER, JobType.TEXT.getValue(), LocalDateTime.now())));
    }
}
