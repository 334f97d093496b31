package com.capturebot.ai.service.ingestion;

import com.capturebot.ai.service.EmbeddingSupport;
import com.capturebot.ai.service.FetchedMedia;
import com.capturebot.ai.service.MediaFetcher;
import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.ai.service.strategy.TextExtractionStrategy;
import com.capturebot.ai.service.strategy.TextExtractionStrategy.ExtractionResult;
import com.capturebot.common.entity.CapturedRecord;
import com.capturebot.common.exception.ExtractionException;
import com.capturebot.common.exception.FetchException;
import com.capturebot.common.exception.ProcessingException;
import com.capturebot.common.service.RecordStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of inbound media into one searchable MEDIA record.
 *
 * Steps per file: download → upload to storage (signed URL) → OCR.
 * Then: join texts → embed → save one record.
 *
 * All files of a batch succeed or the whole batch fails. Blobs uploaded
 * before a failure are left in storage.
 */
@Slf4j
@Service
public class MediaIngestionPipeline {

    static final String TEXT_SEPARATOR = "\n\n---\n\n";

    private final MediaFetcher mediaFetcher;
    private final RecordStoreGateway recordStore;
    private final TextExtractionStrategy textExtraction;
    private final EmbeddingStrategy embeddings;

    public MediaIngestionPipeline(MediaFetcher mediaFetcher,
            RecordStoreGateway recordStore,
            TextExtractionStrategy textExtraction,
            EmbeddingStrategy embeddings) {
        this.mediaFetcher = mediaFetcher;
        this.recordStore = recordStore;
        this.textExtraction = textExtraction;
        this.embeddings = embeddings;
    }

    public MediaIngestionResult ingest(List<String> mediaUrls, String senderId, String correlationId) {
        return ingest(mediaUrls, senderId, correlationId, null);
    }

    /**
     * @param caption optional text sent along with the media, kept in metadata
     * @throws ProcessingException on any failure, wrapping the cause
     */
    public MediaIngestionResult ingest(List<String> mediaUrls, String senderId, String correlationId,
            String caption) {
        try {
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
            log.info("MEDIA INGESTION: {} file(s) from {}", mediaUrls.size(), senderId);

            List<String> storageUrls = new ArrayList<>();
            List<String> texts = new ArrayList<>();

            for (int i = 0; i < mediaUrls.size(); i++) {
                String url = mediaUrls.get(i);

                // STEP 1: Download
                log.info("[{}/{}] Downloading", i + 1, mediaUrls.size());
                FetchedMedia media = mediaFetcher.fetch(url);

                // STEP 2: Store
                log.info("[{}/{}] Uploading {} bytes ({})", i + 1, mediaUrls.size(),
                        media.content().length, media.contentType());
                String storageUrl = recordStore.uploadBlob(media.content(), media.fileName(), media.contentType());
                storageUrls.add(storageUrl);

                // STEP 3: OCR
                log.info("[{}/{}] Extracting text", i + 1, mediaUrls.size());
                ExtractionResult extraction = textExtraction.extract(storageUrl, media.contentType());
                if (!extraction.isSuccessful()) {
                    throw new ExtractionException(extraction.getErrorMessage());
                }
                if (!extraction.getText().isEmpty()) {
                    texts.add(extraction.getText());
                }
            }

            String combinedText = String.join(TEXT_SEPARATOR, texts).trim();
            log.info("Combined text: {} characters", combinedText.length());

            // STEP 4: Embed (skipped when OCR found nothing)
            float[] embedding = EmbeddingSupport.embedOrNull(embeddings, combinedText);

            // STEP 5: Persist
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "whatsapp");
            metadata.put("media_count", mediaUrls.size());
            if (caption != null && !caption.isBlank()) {
                metadata.put("caption", caption.trim());
            }

            CapturedRecord saved = recordStore.saveRecord(CapturedRecord.media(
                    senderId, correlationId, storageUrls, combinedText, embedding, metadata));

            log.info("MEDIA INGESTION COMPLETE: record {}", saved.getId());
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
            return new MediaIngestionResult(saved.getId(), mediaUrls.size());

        } catch (FetchException e) {
            log.error("Media download failed for {}: {}", e.getUrl(), e.getMessage());
            throw new ProcessingException("Failed to download media: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Media ingestion failed: {}", e.getMessage());
            throw new ProcessingException("Processing error: " + e.getMessage(), e);
        }
    }
}
