package com.capturebot.common.service;

import com.capturebot.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Supabase Storage over its REST API: uploads captured media and hands back
 * time-limited signed URLs the OCR provider can read.
 */
@Slf4j
@Service
public class SupabaseStorageService {

    private static final String DEFAULT_EXTENSION = "jpg";

    private final WebClient webClient;

    @Value("${supabase.url}")
    private String supabaseUrl;

    @Value("${supabase.service-key}")
    private String serviceKey;

    @Value("${supabase.bucket:whatsapp}")
    private String bucketName;

    @Value("${supabase.signed-url-ttl-seconds:3600}")
    private int signedUrlTtlSeconds;

    @Value("${capturebot.http.timeout-seconds:30}")
    private long timeoutSeconds;

    public SupabaseStorageService() {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024)) // 20MB
                .build());
    }

    SupabaseStorageService(WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Upload bytes under a fresh "<uuid>.<ext>" path and return a signed URL for it.
     */
    public String uploadAndSign(byte[] content, String fileName, String contentType) {
        String objectPath = UUID.randomUUID() + "." + extensionOf(fileName);

        try {
            log.info("Uploading to Supabase Storage: {} ({}, {} bytes)", objectPath, contentType, content.length);
            webClient
                    .post()
                    .uri(supabaseUrl + "/storage/v1/object/" + bucketName + "/" + objectPath)
                    .header("Authorization", "Bearer " + serviceKey)
                    .header("Content-Type", contentType)
                    .bodyValue(content)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(timeoutSeconds));
        } catch (Exception e) {
            throw new StorageException("Failed to upload file to Supabase Storage: " + e.getMessage(), e);
        }

        try {
            return getSignedUrl(objectPath, signedUrlTtlSeconds);
        } catch (Exception e) {
            throw new StorageException("Failed to create signed URL from Supabase Storage: " + e.getMessage(), e);
        }
    }

    /**
     * Generate signed URL for time-limited read access
     */
    @SuppressWarnings("unchecked")
    public String getSignedUrl(String objectPath, int expiresInSeconds) {

        Map<String, Object> requestBody = Map.of("expiresIn", expiresInSeconds);

        Map<String, Object> response = webClient
                .post()
                .uri(supabaseUrl + "/storage/v1/object/sign/" + bucketName + "/" + objectPath)
                .header("Authorization", "Bearer " + serviceKey)
                .header("Content-Type", "application/json")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .block(Duration.ofSeconds(timeoutSeconds));

        if (response == null) {
            throw new StorageException("Empty response when signing " + objectPath);
        }

        // The API has returned both spellings across versions
        Object signed = response.get("signedURL") != null ? response.get("signedURL") : response.get("signedUrl");
        if (signed == null) {
            throw new StorageException("No signed URL in response for " + objectPath);
        }

        String url = supabaseUrl + "/storage/v1" + signed;
        log.debug("Signed URL created for {} (ttl {}s)", objectPath, expiresInSeconds);
        return url;
    }

    static String extensionOf(String fileName) {
        if (fileName != null) {
            int dot = fileName.lastIndexOf('.');
            if (dot >= 0 && dot < fileName.length() - 1) {
                return fileName.substring(dot + 1);
            }
        }
        return DEFAULT_EXTENSION;
    }
}
