package com.hubrelay.webhooks.intake;

import com.hubrelay.webhooks.aggregation.AggregationEngine;
import com.hubrelay.webhooks.handler.DeliveryException;
import com.hubrelay.webhooks.handler.DeliveryHandler;
import com.hubrelay.webhooks.handler.Notification;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.model.MetaEvent;
import com.hubrelay.webhooks.model.PingEvent;
import com.hubrelay.webhooks.model.PushEvent;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.model.RepositoryEvent;
import com.hubrelay.webhooks.model.action.MetaAction;
import com.hubrelay.webhooks.model.action.RepositoryAction;
import com.hubrelay.webhooks.subscription.Subscription;
import com.hubrelay.webhooks.subscription.SubscriptionRegistry;
import com.hubrelay.webhooks.subscription.SubscriptionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Applies subscription housekeeping for lifecycle events and forwards
 * everything else to the {@link AggregationEngine}, or straight to the
 * {@link DeliveryHandler} when aggregation is disabled.
 *
 * <p>Store failures during housekeeping are logged; the event is still
 * processed against the in-memory subscription.
 */
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final SubscriptionRegistry registry;
    private final DeliveryHandler      handler;
    private final AggregationEngine    engine;

    /** Delivers every event immediately, without aggregation. */
    public WebhookDispatcher(SubscriptionRegistry registry, DeliveryHandler handler) {
        this(registry, handler, null);
    }

    /**
     * @param engine the engine events are submitted to; {@code null} disables aggregation
     */
    public WebhookDispatcher(SubscriptionRegistry registry, DeliveryHandler handler, AggregationEngine engine) {
        this.registry = registry;
        this.handler = handler;
        this.engine = engine;
    }

    public void handle(DecodedDelivery delivery) {
        handle(delivery.getEvent(), delivery.getDeliveryId(), delivery.getSubscription());
    }

    public void handle(GitHubEvent event, String deliveryId, Subscription subscription) {
        PushMetrics pushMetrics = null;
        if (event instanceof PingEvent ping) {
            recordUpstreamId(subscription, ping);
        } else if (event instanceof MetaEvent meta) {
            if (meta.getAction() == MetaAction.DELETED) {
                log.info("Hook {} of subscription {} was deleted on GitHub", meta.getHookId(), subscription.getId());
                deleteSubscription(subscription);
                return;
            }
        } else if (event instanceof RepositoryEvent repository) {
            followRepository(subscription, repository);
        } else if (event instanceof PushEvent push) {
            pushMetrics = PushMetrics.of(push);
        }

        if (engine != null) {
            engine.submit(subscription, event, deliveryId, pushMetrics);
        } else {
            deliverNow(new Notification(subscription.getId(), subscription.getChannelId(), event,
                    event.getAction(), null, pushMetrics, Set.of(deliveryId)));
        }
    }

    /** {@code true} when events pass through the aggregation engine. */
    public boolean isAggregating() { return engine != null; }

    private void recordUpstreamId(Subscription subscription, PingEvent ping) {
        long hookId = ping.getHookId() != 0 ? ping.getHookId() : ping.getHook() != null ? ping.getHook().getId() : 0L;
        if (hookId == 0L) {
            log.warn("Ping for subscription {} carries no hook id", subscription.getId());
            return;
        }
        try {
            registry.setUpstreamId(subscription, hookId);
        } catch (SubscriptionStoreException e) {
            log.error("Could not persist upstream hook id {} of subscription {}", hookId, subscription.getId(), e);
        }
    }

    private void followRepository(Subscription subscription, RepositoryEvent event) {
        RepositoryAction action = event.getAction();
        try {
            if (action == RepositoryAction.RENAMED || action == RepositoryAction.TRANSFERRED) {
                String newName = event.getRepository() != null ? event.getRepository().getFullName() : null;
                if (newName != null && !newName.equals(subscription.getRepository())) {
                    registry.transfer(subscription, newName);
                }
            } else if (action == RepositoryAction.DELETED) {
                registry.delete(subscription.getId());
            }
        } catch (SubscriptionStoreException e) {
            log.error("Could not persist repository {} of subscription {}", action.value(), subscription.getId(), e);
        }
    }

    private void deleteSubscription(Subscription subscription) {
        try {
            registry.delete(subscription.getId());
        } catch (SubscriptionStoreException e) {
            log.error("Could not delete subscription {}", subscription.getId(), e);
        }
    }

    private void deliverNow(Notification notification) {
        try {
            handler.deliver(notification);
        } catch (DeliveryException e) {
            log.error("Delivery of {} failed: {}", notification, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering {}", notification, e);
        }
    }
}
