package com.hubrelay.webhooks.subscription;

/** Thrown by a {@link SubscriptionStore} when durable state cannot be read or written. */
public class SubscriptionStoreException extends Exception {

    public SubscriptionStoreException(String message) {
        super(message);
    }

    public SubscriptionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
