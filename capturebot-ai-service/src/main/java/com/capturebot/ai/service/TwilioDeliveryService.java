package com.capturebot.ai.service;

import com.capturebot.common.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Sends WhatsApp replies through the Twilio Messages REST API.
 */
@Slf4j
@Service
public class TwilioDeliveryService implements ReplyDeliveryService {

    static final String WHATSAPP_PREFIX = "whatsapp:";
    static final int MAX_BODY_LENGTH = 1600; // Twilio rejects longer WhatsApp bodies

    private final WebClient webClient;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.base-url:https://api.twilio.com/2010-04-01}")
    private String baseUrl;

    @Value("${capturebot.http.timeout-seconds:30}")
    private long timeoutSeconds;

    public TwilioDeliveryService() {
        this(WebClient.builder().build());
    }

    TwilioDeliveryService(WebClient webClient) {
        this.webClient = webClient;
        this.baseUrl = "https://api.twilio.com/2010-04-01";
        this.timeoutSeconds = 30;
    }

    TwilioDeliveryService(WebClient webClient, String accountSid, String authToken) {
        this(webClient);
        this.accountSid = accountSid;
        this.authToken = authToken;
    }

    @Override
    public void send(String to, String from, String body) {
        if (accountSid == null || accountSid.isBlank()) {
            throw new DeliveryException("Twilio account SID is not configured");
        }

        String text = body != null ? body : "";
        if (text.length() > MAX_BODY_LENGTH) {
            log.warn("Reply is {} characters, truncating to {}", text.length(), MAX_BODY_LENGTH);
            text = text.substring(0, MAX_BODY_LENGTH);
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", toWhatsAppAddress(to));
        form.add("From", toWhatsAppAddress(from));
        form.add("Body", text);

        try {
            Map<?, ?> response = webClient
                    .post()
                    .uri(baseUrl + "/Accounts/" + accountSid + "/Messages.json")
                    .headers(headers -> headers.setBasicAuth(accountSid, authToken))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(timeoutSeconds));

            log.info("Reply sent to {} (sid: {})", to, response != null ? response.get("sid") : "unknown");
        } catch (Exception e) {
            throw new DeliveryException("Failed to send WhatsApp message: " + e.getMessage(), e);
        }
    }

    /**
     * Add the {@code whatsapp:} channel prefix unless it is already there.
     */
    static String toWhatsAppAddress(String number) {
        if (number == null || number.isBlank()) {
            throw new DeliveryException("Missing WhatsApp address");
        }
        String trimmed = number.trim();
        return trimmed.startsWith(WHATSAPP_PREFIX) ? trimmed : WHATSAPP_PREFIX + trimmed;
    }
}
