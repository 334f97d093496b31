package com.capturebot.ai.service;

import com.capturebot.common.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;

/**
 * Downloads inbound media from the messaging provider.
 *
 * Twilio media URLs answer with a redirect to the actual blob, so redirects are followed.
 * Basic auth is sent only when account credentials are configured.
 */
@Slf4j
@Service
public class MediaFetcher {

    static final String DEFAULT_CONTENT_TYPE = "image/jpeg";
    static final String DEFAULT_FILE_NAME = "upload.jpg";

    private final WebClient webClient;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${capturebot.http.timeout-seconds:30}")
    private long timeoutSeconds;

    public MediaFetcher() {
        this(WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024)) // 20MB
                .build());
    }

    MediaFetcher(WebClient webClient) {
        this.webClient = webClient;
        this.timeoutSeconds = 30;
    }

    /**
     * @throws FetchException if the download fails or returns no bytes
     */
    public FetchedMedia fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new FetchException(url, "Media URL is empty");
        }

        ResponseEntity<byte[]> response;
        try {
            log.info("Downloading media: {}", url);
            response = webClient
                    .get()
                    .uri(URI.create(url))
                    .headers(headers -> {
                        if (accountSid != null && !accountSid.isBlank()) {
                            headers.setBasicAuth(accountSid, authToken);
                        }
                    })
                    .retrieve()
                    .toEntity(byte[].class)
                    .block(Duration.ofSeconds(timeoutSeconds));
        } catch (Exception e) {
            throw new FetchException(url, e.getMessage(), e);
        }

        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw new FetchException(url, "Empty response body");
        }

        MediaType mediaType = response.getHeaders().getContentType();
        String contentType = mediaType != null ? mediaType.getType() + "/" + mediaType.getSubtype()
                : DEFAULT_CONTENT_TYPE;

        byte[] body = response.getBody();
        log.info("Downloaded {} bytes ({})", body.length, contentType);
        return new FetchedMedia(body, contentType, fileNameOf(url));
    }

    static String fileNameOf(String url) {
        try {
            String path = URI.create(url).getPath();
            if (path != null) {
                String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
                String last = trimmed.substring(trimmed.lastIndexOf('/') + 1);
                if (!last.isBlank()) {
                    return last;
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable media URL {}: {}", url, e.getMessage());
        }
        return DEFAULT_FILE_NAME;
    }
}
