package com.hubrelay.webhooks.intake;

import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.subscription.Subscription;

/** A verified, fully decoded webhook delivery ready for dispatch. */
public final class DecodedDelivery {

    private final Subscription subscription;
    private final GitHubEvent  event;
    private final String       deliveryId;

    public DecodedDelivery(Subscription subscription, GitHubEvent event, String deliveryId) {
        this.subscription = subscription;
        this.event = event;
        this.deliveryId = deliveryId;
    }

    public Subscription getSubscription() { return subscription; }
    public GitHubEvent  getEvent()        { return event; }
    public EventKind    getKind()         { return event.getKind(); }
    public String       getDeliveryId()   { return deliveryId; }

    @Override
    public String toString() {
        return "DecodedDelivery{deliveryId=" + deliveryId + ", event=" + event +
               ", subscription=" + subscription.getId() + '}';
    }
}
