package com.capturebot.ai.service.ingestion;

import com.capturebot.ai.service.EmbeddingSupport;
import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.common.entity.CapturedRecord;
import com.capturebot.common.exception.ProcessingException;
import com.capturebot.common.service.RecordStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Saves a typed note as a NOTE record.
 */
@Slf4j
@Service
public class NoteIngestionService {

    private final RecordStoreGateway recordStore;
    private final EmbeddingStrategy embeddings;

    public NoteIngestionService(RecordStoreGateway recordStore, EmbeddingStrategy embeddings) {
        this.recordStore = recordStore;
        this.embeddings = embeddings;
    }

    /**
     * @throws ProcessingException if embedding or persistence fails
     */
    public NoteIngestionResult ingest(String text, String senderId, String correlationId) {
        try {
            float[] embedding = EmbeddingSupport.embedOrNull(embeddings, text);

            CapturedRecord saved = recordStore.saveRecord(CapturedRecord.note(
                    senderId, correlationId, text, embedding, Map.of("source", "whatsapp")));

            log.info("Note saved for {}: record {}", senderId, saved.getId());
            return new NoteIngestionResult(saved.getId());

        } catch (Exception e) {
            log.error("Failed to save note for {}: {}", senderId, e.getMessage());
            throw new ProcessingException("Failed to save note: " + e.getMessage(), e);
        }
    }
}
