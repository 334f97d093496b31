package com.capturebot.common.service;

import com.capturebot.common.dto.RecordMatch;
import com.capturebot.common.entity.CapturedRecord;
import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.entity.Job;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything the bot needs from persistence, kept narrow so pipelines and
 * the agent can be tested against an in-memory fake.
 *
 * Implementations provide their own consistency; callers never need more than
 * single-row reads and writes.
 */
public interface RecordStoreGateway {

    Job createJob(Job job);

    Optional<Job> getJob(UUID jobId);

    /**
     * Persist the current state of a job (status, result, error).
     */
    Job updateJob(Job job);

    CapturedRecord saveRecord(CapturedRecord record);

    ConversationMessage saveMessage(ConversationMessage message);

    /**
     * @return at most {@code limit} messages, most recent first
     */
    List<ConversationMessage> getRecentMessages(String senderId, int limit);

    /**
     * @return at most {@code limit} records of any type, most recent first
     */
    List<CapturedRecord> getRecentRecords(String senderId, int limit);

    /**
     * Nearest-neighbour search over the sender's records, ordered by descending similarity.
     * An empty query vector yields no matches.
     */
    List<RecordMatch> matchRecords(String senderId, float[] queryEmbedding, int topK);

    /**
     * Store a blob and return a time-limited URL to read it back.
     */
    String uploadBlob(byte[] content, String fileName, String contentType);
}
