package com.capturebot.ai.service.strategy;

/**
 * Strategy interface for OCR / text extraction from a stored image or PDF.
 */
public interface TextExtractionStrategy {

    /**
     * Extract all visible text from the file behind {@code fileUrl}.
     *
     * @param contentType MIME type if known, may be null
     */
    ExtractionResult extract(String fileUrl, String contentType);

    String getProviderName();

    class ExtractionResult {
        private final String text;
        private final String errorMessage;
        private final boolean successful;

        private ExtractionResult(String text, String errorMessage, boolean successful) {
            this.text = text;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static ExtractionResult success(String text) {
            return new ExtractionResult(text != null ? text.trim() : "", null, true);
        }

        public static ExtractionResult failed(String errorMessage) {
            return new ExtractionResult(null, errorMessage, false);
        }

        public String getText() {
            return text;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }
    }
}
