package com.hubrelay.webhooks.handler;

import com.hubrelay.webhooks.aggregation.Accumulator;
import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.model.action.EventAction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * What a {@link DeliveryHandler} receives: one representative event plus
 * whatever was folded into it.
 *
 * <p>{@link #getAction()} may differ from the event's own action when the
 * aggregation switched it to a pseudo-action such as {@code x_labels_changed};
 * the details then live in {@link #getAccumulator()}.
 */
public final class Notification {

    private final UUID        subscriptionId;
    private final String      channelId;
    private final EventKind   kind;
    private final EventAction action;
    private final GitHubEvent event;
    private final Accumulator accumulator;
    private final PushMetrics pushMetrics;
    private final Set<String> deliveryIds;

    public Notification(UUID subscriptionId, String channelId, GitHubEvent event, EventAction action,
                        Accumulator accumulator, PushMetrics pushMetrics, Set<String> deliveryIds) {
        this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId");
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.event = Objects.requireNonNull(event, "event");
        this.kind = event.getKind();
        this.action = action;
        this.accumulator = accumulator != null ? accumulator : new Accumulator();
        this.pushMetrics = pushMetrics;
        this.deliveryIds = Collections.unmodifiableSet(new LinkedHashSet<>(deliveryIds));
    }

    public UUID        getSubscriptionId() { return subscriptionId; }
    public String      getChannelId()      { return channelId; }
    public EventKind   getKind()           { return kind; }
    /** Representative action, {@code null} for kinds without one. */
    public EventAction getAction()         { return action; }
    public GitHubEvent getEvent()          { return event; }
    public Accumulator getAccumulator()    { return accumulator; }
    /** Set for {@code push} notifications only. */
    public PushMetrics getPushMetrics()    { return pushMetrics; }
    /** Delivery ids of every event folded into this notification, in arrival order. */
    public Set<String> getDeliveryIds()    { return deliveryIds; }

    @Override
    public String toString() {
        return "Notification{kind=" + kind +
               (action != null ? ", action=" + action.value() : "") +
               ", channel=" + channelId +
               ", subscription=" + subscriptionId +
               ", deliveries=" + deliveryIds + '}';
    }
}
