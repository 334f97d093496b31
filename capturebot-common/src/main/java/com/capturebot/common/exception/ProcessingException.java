package com.capturebot.common.exception;

/**
 * Single failure type surfaced by the ingestion pipelines. The cause is one of
 * {@link FetchException}, {@link StorageException}, {@link ExtractionException},
 * {@link EmbeddingException} or a persistence error.
 */
public class ProcessingException extends RuntimeException {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
