package com.hubrelay.webhooks.handler;

/** Thrown by a {@link DeliveryHandler} when a notification cannot be delivered. */
public class DeliveryException extends Exception {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
