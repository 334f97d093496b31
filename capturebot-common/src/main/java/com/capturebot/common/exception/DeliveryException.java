package com.capturebot.common.exception;

/** An outbound reply could not be handed to the messaging provider. */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
