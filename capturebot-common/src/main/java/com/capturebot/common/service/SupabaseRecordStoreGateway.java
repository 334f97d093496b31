package com.capturebot.common.service;

import com.capturebot.common.converter.EmbeddingConverter;
import com.capturebot.common.dto.RecordMatch;
import com.capturebot.common.entity.CapturedRecord;
import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;
import com.capturebot.common.repository.CapturedRecordRepository;
import com.capturebot.common.repository.CapturedRecordRepository.SimilarityRow;
import com.capturebot.common.repository.ConversationMessageRepository;
import com.capturebot.common.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link RecordStoreGateway} backed by Supabase Postgres (Spring Data JPA + pgvector)
 * and Supabase Storage.
 */
@Slf4j
@Service
public class SupabaseRecordStoreGateway implements RecordStoreGateway {

    private final JobRepository jobRepository;
    private final CapturedRecordRepository recordRepository;
    private final ConversationMessageRepository messageRepository;
    private final SupabaseStorageService storageService;

    public SupabaseRecordStoreGateway(JobRepository jobRepository,
            CapturedRecordRepository recordRepository,
            ConversationMessageRepository messageRepository,
            SupabaseStorageService storageService) {
        this.jobRepository = jobRepository;
        this.recordRepository = recordRepository;
        this.messageRepository = messageRepository;
        this.storageService = storageService;
    }

    @Override
    public Job createJob(Job job) {
        Job saved = jobRepository.save(job);
        log.debug("Job created: {}", saved);
        return saved;
    }

    @Override
    public Optional<Job> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public Job updateJob(Job job) {
        Job saved = jobRepository.save(job);
        log.debug("Job {} → {}", saved.getId(), saved.getStatus());
        return saved;
    }

    @Override
    public CapturedRecord saveRecord(CapturedRecord record) {
        CapturedRecord saved = recordRepository.save(record);
        log.info("Record saved: {} ({}) for {}", saved.getId(), saved.getRecordType(), saved.getSenderId());
        return saved;
    }

    @Override
    public ConversationMessage saveMessage(ConversationMessage message) {
        return messageRepository.save(message);
    }

    @Override
    public List<ConversationMessage> getRecentMessages(String senderId, int limit) {
        List<ConversationMessage> messages = messageRepository
                .findBySenderIdOrderByCreatedAtDesc(senderId, PageRequest.of(0, limit));
        log.debug("Loaded {} recent message(s) for {}", messages.size(), senderId);
        return messages;
    }

    @Override
    public List<CapturedRecord> getRecentRecords(String senderId, int limit) {
        return recordRepository.findBySenderIdOrderByCreatedAtDesc(senderId, PageRequest.of(0, limit));
    }

    @Override
    public List<RecordMatch> matchRecords(String senderId, float[] queryEmbedding, int topK) {
        if (queryEmbedding == null || queryEmbedding.length == 0) {
            return List.of();
        }

        List<SimilarityRow> rows = recordRepository.matchRecords(
                EmbeddingConverter.toVectorLiteral(queryEmbedding), topK, senderId);
        if (rows.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = rows.stream().map(r -> UUID.fromString(r.getRecordId())).toList();
        Map<UUID, CapturedRecord> byId = recordRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(CapturedRecord::getId, Function.identity()));

        // Keep the similarity order from the SQL function
        List<RecordMatch> matches = new ArrayList<>();
        for (SimilarityRow row : rows) {
            CapturedRecord record = byId.get(UUID.fromString(row.getRecordId()));
            if (record != null) {
                double similarity = row.getSimilarity() != null ? row.getSimilarity() : 0.0;
                matches.add(RecordMatch.of(record, similarity));
            }
        }

        log.info("Similarity search for {}: {} match(es)", senderId, matches.size());
        return matches;
    }

    @Override
    public String uploadBlob(byte[] content, String fileName, String contentType) {
        return storageService.uploadAndSign(content, fileName, contentType);
    }
}
