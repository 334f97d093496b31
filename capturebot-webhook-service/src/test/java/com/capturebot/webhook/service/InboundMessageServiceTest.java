package com.capturebot.webhook.service;

import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;
import com.capturebot.common.exception.JobNotFoundException;
import com.capturebot.common.service.RecordStoreGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InboundMessageService: inbound logging, job creation and queueing.
 */
@ExtendWith(MockitoExtension.class)
class InboundMessageServiceTest {

    @Mock
    private RecordStoreGateway recordStore;

    @Mock
    private JobPublisher publisher;

    @InjectMocks
    private InboundMessageService inboundMessageService;

    private static final String SENDER = "whatsapp:+15550001";

    private void stubJobCreation() {
        when(recordStore.createJob(any(Job.class))).thenAnswer(inv -> {
            Job job = inv.getArgument(0);
            job.setId(UUID.randomUUID());
            return job;
        });
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Accept Tests
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Text messages become queued TEXT jobs carrying the text")
    void accept_shouldQueueTextJob() {
        stubJobCreation();

        InboundMessageService.Outcome outcome = inboundMessageService.accept(
                new InboundMessage(SENDER, "  Coffee at Cafe X $42 ", "SM1", List.of()));

        assertEquals(InboundMessageService.Status.QUEUED, outcome.status());
        Job job = outcome.job();
        assertEquals("text", job.getJobType());
        assertEquals(Job.JobStatus.PENDING, job.getStatus());
        assertEquals(Map.of("text", "Coffee at Cafe X $42"), job.getPayload());
        assertEquals("SM1", job.getCorrelationId());
        verify(publisher).publish(job);

        ArgumentCaptor<ConversationMessage> logged = ArgumentCaptor.forClass(ConversationMessage.class);
        verify(recordStore).saveMessage(logged.capture());
        assertEquals(ConversationMessage.Direction.IN, logged.getValue().getDirection());
        assertEquals("Coffee at Cafe X $42", logged.getValue().getContent());
    }

    @Test
    @DisplayName("Media messages become MEDIA jobs with URLs and caption")
    void accept_shouldQueueMediaJob() {
        stubJobCreation();

        InboundMessageService.Outcome outcome = inboundMessageService.accept(
                new InboundMessage(SENDER, "lunch", "SM2", List.of("https://m/1", "https://m/2")));

        Job job = outcome.job();
        assertEquals("media", job.getJobType());
        assertEquals(List.of("https://m/1", "https://m/2"), job.getPayload().get("media_urls"));
        assertEquals("lunch", job.getPayload().get("caption"));
    }

    @Test
    @DisplayName("Media-only messages are logged with a media placeholder")
    void accept_shouldLogMediaPlaceholder() {
        stubJobCreation();

        inboundMessageService.accept(new InboundMessage(SENDER, null, "SM3", List.of("https://m/1")));

        ArgumentCaptor<ConversationMessage> logged = ArgumentCaptor.forClass(ConversationMessage.class);
        verify(recordStore).saveMessage(logged.capture());
        assertEquals("[media] https://m/1", logged.getValue().getContent());
    }

    @Test
    @DisplayName("Empty messages create no job")
    void accept_shouldIgnoreEmptyMessage() {
        InboundMessageService.Outcome outcome = inboundMessageService.accept(
                new InboundMessage(SENDER, "   ", "SM4", List.of()));

        assertEquals(InboundMessageService.Status.EMPTY, outcome.status());
        assertNull(outcome.job());
        verifyNoInteractions(recordStore, publisher);
    }

    @Test
    @DisplayName("A failed message log does not prevent the job")
    void accept_shouldSurviveMessageLogFailure() {
        stubJobCreation();
        when(recordStore.saveMessage(any())).thenThrow(new RuntimeException("db down"));

        InboundMessageService.Outcome outcome = inboundMessageService.accept(
                new InboundMessage(SENDER, "hello", "SM5", List.of()));

        assertEquals(InboundMessageService.Status.QUEUED, outcome.status());
        verify(publisher).publish(any(Job.class));
    }

    @Test
    @DisplayName("Broker failures are reported as QUEUE_FAILED with the job kept")
    void accept_shouldReportQueueFailure() {
        stubJobCreation();
        doThrow(new AmqpException("broker unreachable")).when(publisher).publish(any(Job.class));

        InboundMessageService.Outcome outcome = inboundMessageService.accept(
                new InboundMessage(SENDER, "hello", "SM6", List.of()));

        assertEquals(InboundMessageService.Status.QUEUE_FAILED, outcome.status());
        assertNotNull(outcome.job().getId());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Lookup Tests
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Unknown job ids raise JobNotFoundException")
    void getJob_shouldThrowWhenMissing() {
        UUID jobId = UUID.randomUUID();
        when(recordStore.getJob(jobId)).thenReturn(Optional.empty());

        assertThrows(JobNotFoundException.class, () -> inboundMessageService.getJob(jobId));
    }
}
