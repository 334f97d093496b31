package com.capturebot.webhook.service;

import java.util.List;

/**
 * One inbound WhatsApp message as Twilio posts it.
 *
 * @param mediaUrls MediaUrl0..N in order, blanks removed
 */
public record InboundMessage(String from, String body, String messageSid, List<String> mediaUrls) {

    public InboundMessage {
        body = body != null ? body.trim() : "";
        mediaUrls = mediaUrls != null ? List.copyOf(mediaUrls) : List.of();
    }

    public boolean hasMedia() {
        return !mediaUrls.isEmpty();
    }

    public boolean isEmpty() {
        return body.isEmpty() && mediaUrls.isEmpty();
    }
}
