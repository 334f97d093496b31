package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.TextExtractionStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.web.reactive.function.client.WebClient;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Mistral vision-model OCR.
 *
 * Downloads the stored file, renders page 1 of a PDF to JPEG, and asks the model
 * for the verbatim text. Only the first page of a PDF is read.
 */
@Slf4j
public class MistralOcrService implements TextExtractionStrategy {

    static final String OCR_PROMPT = "Extract ALL visible text from this image. Preserve line breaks where helpful. "
            + "Return only the extracted text, with no commentary.";

    private static final String PDF_CONTENT_TYPE = "application/pdf";
    private static final String DEFAULT_IMAGE_TYPE = "image/jpeg";
    private static final float PDF_RENDER_DPI = 150f;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;

    public MistralOcrService(String apiKey, String baseUrl, String model, long timeoutSeconds) {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024)) // 20MB
                .build(), apiKey, baseUrl, model, timeoutSeconds);
    }

    MistralOcrService(WebClient webClient, String apiKey, String baseUrl, String model, long timeoutSeconds) {
        this.webClient = webClient;
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String getProviderName() {
        return "Mistral OCR (" + model + ")";
    }

    @Override
    public ExtractionResult extract(String fileUrl, String contentType) {
        try {
            log.info("[{}] Extracting text ({})", getProviderName(), contentType != null ? contentType : "unknown type");

            byte[] fileData = webClient
                    .get()
                    .uri(URI.create(fileUrl))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(timeout);

            if (fileData == null || fileData.length == 0) {
                return ExtractionResult.failed("Downloaded file is empty");
            }

            String mimeType = contentType;
            if (isPdf(fileUrl, contentType)) {
                fileData = renderFirstPage(fileData);
                mimeType = DEFAULT_IMAGE_TYPE;
            }
            if (mimeType == null || !mimeType.startsWith("image/")) {
                mimeType = DEFAULT_IMAGE_TYPE;
            }

            String dataUrl = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(fileData);

            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "messages", List.of(Map.of(
                            "role", "user",
                            "content", List.of(
                                    Map.of("type", "text", "text", OCR_PROMPT),
                                    Map.of("type", "image_url", "image_url", Map.of("url", dataUrl))))),
                    "temperature", 0.1,
                    "max_tokens", 1000);

            String response = webClient
                    .post()
                    .uri(baseUrl + "/chat/completions")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);

            return parseOcrResponse(response);

        } catch (Exception e) {
            log.error("[{}] OCR failed: {}", getProviderName(), e.getMessage());
            return ExtractionResult.failed("Mistral API error: " + e.getMessage());
        }
    }

    static boolean isPdf(String fileUrl, String contentType) {
        if (contentType != null && contentType.toLowerCase().startsWith(PDF_CONTENT_TYPE)) {
            return true;
        }
        if (fileUrl == null) {
            return false;
        }
        // signed URLs carry a ?token= query, so look at the path only
        String path = URI.create(fileUrl).getPath();
        return path != null && path.toLowerCase().endsWith(".pdf");
    }

    /**
     * Render page 1 of a PDF to JPEG bytes.
     */
    static byte[] renderFirstPage(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            if (document.getNumberOfPages() == 0) {
                throw new IOException("Failed to process PDF: document has no pages");
            }
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(0, PDF_RENDER_DPI, ImageType.RGB);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "jpg", out)) {
                throw new IOException("Failed to process PDF: no JPEG writer available");
            }
            log.debug("Rendered PDF page 1 to {} byte JPEG", out.size());
            return out.toByteArray();
        }
    }

    @SuppressWarnings("unchecked")
    private ExtractionResult parseOcrResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            List<Map<String, Object>> choices = (List<Map<String, Object>>) responseMap.get("choices");
            if (choices == null || choices.isEmpty()) {
                return ExtractionResult.failed("Unexpected API response format: no choices");
            }
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            if (message == null) {
                return ExtractionResult.failed("Unexpected API response format: no message");
            }

            Object content = message.get("content");
            String text = content != null ? content.toString().trim() : "";
            log.info("[{}] Extracted {} characters", getProviderName(), text.length());
            return ExtractionResult.success(text);

        } catch (Exception e) {
            log.error("Failed to parse OCR response: {}", e.getMessage());
            return ExtractionResult.failed("Unexpected API response format: " + e.getMessage());
        }
    }
}
