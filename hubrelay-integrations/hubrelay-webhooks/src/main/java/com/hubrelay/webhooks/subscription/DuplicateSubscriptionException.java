package com.hubrelay.webhooks.subscription;

/** A subscription for the same (repository, channel) pair already exists. */
public class DuplicateSubscriptionException extends SubscriptionStoreException {

    public DuplicateSubscriptionException(String repository, String channelId) {
        super("Subscription already exists for " + repository + " in " + channelId);
    }
}
