package com.capturebot.ai.service;

/**
 * Outbound channel for replies to the user.
 */
public interface ReplyDeliveryService {

    /**
     * @throws com.capturebot.common.exception.DeliveryException if the provider rejects the message
     */
    void send(String to, String from, String body);
}
