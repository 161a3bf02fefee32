package com.hubrelay.webhooks.aggregation;

import com.hubrelay.webhooks.handler.Notification;
import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.model.action.EventAction;
import com.hubrelay.webhooks.subscription.Subscription;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One not-yet-delivered notification of a subscription, absorbing related
 * events until its deadline passes.
 *
 * <p>Not thread-safe: every method is called with the owning subscription's
 * queue lock held.
 */
final class PendingAggregation {

    private final Subscription      subscription;
    private final AggregationPolicy policy;
    private final Accumulator       accumulator = new Accumulator();
    private final Set<String>       deliveryIds = new LinkedHashSet<>();
    private final PushMetrics       pushMetrics;

    private GitHubEvent      representative;
    private EventAction      action;
    private AggregationState state = AggregationState.STARTING;
    private long             deadlineNanos;

    PendingAggregation(Subscription subscription, AggregationPolicy policy, GitHubEvent event,
                       String deliveryId, PushMetrics pushMetrics) {
        this.subscription = subscription;
        this.policy = policy;
        this.representative = event;
        this.action = event.getAction();
        this.pushMetrics = pushMetrics;
        this.deliveryIds.add(deliveryId);
    }

    /** Runs the policy's starter and arms the deadline. */
    void start(long deadlineNanos) {
        policy.start(this);
        this.deadlineNanos = deadlineNanos;
        this.state = AggregationState.AGGREGATING;
    }

    /**
     * Offers a later event of the same subscription.
     *
     * @return {@code true} if the event was absorbed
     */
    boolean offer(GitHubEvent event, String deliveryId, long nowNanos, long timeoutNanos) {
        if (state != AggregationState.AGGREGATING) {
            return false;
        }
        MergeResult result = policy.merge(this, event);
        if (result == MergeResult.MERGED) {
            deadlineNanos = nowNanos + timeoutNanos;
        }
        if (result.isMerged()) {
            deliveryIds.add(deliveryId);
            return true;
        }
        return false;
    }

    /** Moves to {@link AggregationState#FLUSHED}; no merge applies afterwards. */
    Notification flush() {
        if (state != AggregationState.AGGREGATING) {
            throw new IllegalStateException("Cannot flush " + this);
        }
        state = AggregationState.FLUSHED;
        return new Notification(subscription.getId(), subscription.getChannelId(), representative, action,
                accumulator, pushMetrics, deliveryIds);
    }

    void abandon() {
        state = AggregationState.ABANDONED;
    }

    // policy callbacks

    void switchAction(EventAction action) {
        this.action = action;
    }

    void replaceRepresentative(GitHubEvent event, EventAction action) {
        this.representative = event;
        this.action = action;
    }

    GitHubEvent       getRepresentative() { return representative; }
    EventKind         getKind()           { return representative.getKind(); }
    EventAction       getAction()         { return action; }
    Accumulator       getAccumulator()    { return accumulator; }
    AggregationPolicy getPolicy()         { return policy; }
    AggregationState  getState()          { return state; }
    long              getDeadlineNanos()  { return deadlineNanos; }
    Set<String>       getDeliveryIds()    { return deliveryIds; }

    @Override
    public String toString() {
        return "aggregation " + policy + " of " + getKind() +
               (action != null ? "/" + action.value() : "") +
               " for subscription " + subscription.getId() +
               " deliveries=" + deliveryIds + " state=" + state;
    }
}
