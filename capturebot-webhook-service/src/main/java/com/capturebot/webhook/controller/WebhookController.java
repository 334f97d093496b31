package com.capturebot.webhook.controller;

import com.capturebot.webhook.service.InboundMessage;
import com.capturebot.webhook.service.InboundMessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Twilio WhatsApp webhook. Answers immediately with TwiML; the real reply is
 * sent later by the worker.
 */
@Slf4j
@RestController
public class WebhookController {

    static final int MAX_MEDIA = 10; // Twilio sends MediaUrl0..MediaUrl9

    static final String EMPTY_MESSAGE_REPLY =
            "Please send an image or PDF to save, or ask a question about your saved records.";
    static final String QUEUE_FAILED_REPLY =
            "❌ Sorry, I couldn't start processing your message. Please try again later.";
    static final String ERROR_REPLY = "Sorry, an error occurred processing your request. Please try again.";

    @Autowired
    private InboundMessageService inboundMessageService;

    private static final String TWIML_CONTENT_TYPE = MediaType.APPLICATION_XML_VALUE + ";charset=UTF-8";

    @PostMapping(value = "/webhook", produces = TWIML_CONTENT_TYPE)
    public ResponseEntity<String> receive(@RequestParam MultiValueMap<String, String> form) {
        try {
            InboundMessage message = new InboundMessage(
                    form.getFirst("From"),
                    form.getFirst("Body"),
                    form.getFirst("MessageSid"),
                    mediaUrlsOf(form));

            log.info("Webhook: message {} from {} ({} media)",
                    message.messageSid(), message.from(), message.mediaUrls().size());

            InboundMessageService.Outcome outcome = inboundMessageService.accept(message);
            return switch (outcome.status()) {
                case EMPTY -> ResponseEntity.ok(twiml(EMPTY_MESSAGE_REPLY));
                case QUEUE_FAILED -> ResponseEntity.ok(twiml(QUEUE_FAILED_REPLY));
                case QUEUED -> ResponseEntity.ok(twiml(null));
            };

        } catch (Exception e) {
            log.error("Webhook error: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.parseMediaType(TWIML_CONTENT_TYPE))
                    .body(twiml(ERROR_REPLY));
        }
    }

    static List<String> mediaUrlsOf(MultiValueMap<String, String> form) {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < MAX_MEDIA; i++) {
            String url = form.getFirst("MediaUrl" + i);
            if (url != null && !url.isBlank()) {
                urls.add(url.trim());
            }
        }
        return urls;
    }

    /**
     * Minimal TwiML document, with an optional immediate reply.
     */
    static String twiml(String reply) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response>");
        if (reply != null) {
            xml.append("<Message>").append(HtmlUtils.htmlEscape(reply, "UTF-8")).append("</Message>");
        }
        return xml.append("</Response>").toString();
    }
}
