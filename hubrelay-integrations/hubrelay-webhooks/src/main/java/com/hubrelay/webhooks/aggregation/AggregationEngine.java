package com.hubrelay.webhooks.aggregation;

import com.hubrelay.webhooks.handler.DeliveryException;
import com.hubrelay.webhooks.handler.DeliveryHandler;
import com.hubrelay.webhooks.handler.Notification;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.subscription.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Coalesces bursts of related events into single notifications.
 *
 * <p>Every subscription owns a FIFO queue of {@link PendingAggregation}s.
 * A submitted event is offered to the queue oldest first and absorbed by the
 * first aggregation that accepts it; otherwise it starts a new aggregation
 * (if its kind and action have an {@link AggregationPolicy}) or is delivered
 * right away.
 *
 * <p>Each aggregation has a deadline that merges may push back.  The timer
 * armed at start re-arms itself for the remaining time when that happened,
 * and otherwise removes the aggregation from its queue and marks it flushed,
 * both under the queue lock.  The {@link DeliveryHandler} is then called on
 * the delivery executor with no lock held.
 *
 * <p>Queues of different subscriptions never share a lock.
 */
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final DeadlineScheduler scheduler;
    private final long              timeoutNanos;
    private final DeliveryHandler   handler;
    private final Executor          deliveryExecutor;

    private final Map<UUID, SubscriptionQueue> queues = new ConcurrentHashMap<>();

    private volatile boolean shutDown;

    /**
     * @param timeout          how long an aggregation waits for related events; must not be negative
     * @param deliveryExecutor runs {@link DeliveryHandler#deliver}; use a direct executor to deliver on the timer thread
     */
    public AggregationEngine(DeadlineScheduler scheduler, Duration timeout,
                             DeliveryHandler handler, Executor deliveryExecutor) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
        }
        this.scheduler = scheduler;
        this.timeoutNanos = timeout.toNanos();
        this.handler = handler;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Merges {@code event} into a pending aggregation of {@code subscription},
     * starts a new one, or delivers it on its own.
     *
     * @param pushMetrics derived commit counts for push events, otherwise {@code null}
     */
    public void submit(Subscription subscription, GitHubEvent event, String deliveryId, PushMetrics pushMetrics) {
        if (shutDown) {
            log.warn("Engine shut down, delivering {} without aggregation", deliveryId);
            deliver(solo(subscription, event, deliveryId, pushMetrics));
            return;
        }
        Notification immediate;
        boolean lateForShutdown = false;
        while (true) {
            SubscriptionQueue queue = queues.computeIfAbsent(subscription.getId(), SubscriptionQueue::new);
            synchronized (queue) {
                if (queue.retired) {
                    // emptied and unmapped while we waited for the lock
                    continue;
                }
                if (shutDown) {
                    // shutdown() began after the check above; nothing may be queued behind its flush
                    retireIfEmpty(queue);
                    immediate = solo(subscription, event, deliveryId, pushMetrics);
                    lateForShutdown = true;
                    break;
                }
                immediate = offerOrStart(queue, subscription, event, deliveryId, pushMetrics);
                retireIfEmpty(queue);
                break;
            }
        }
        if (immediate != null) {
            if (lateForShutdown) {
                deliver(immediate);
            } else {
                handOff(immediate);
            }
        }
    }

    /** Called with the queue lock held. Returns a notification to deliver now, if any. */
    private Notification offerOrStart(SubscriptionQueue queue, Subscription subscription, GitHubEvent event,
                                      String deliveryId, PushMetrics pushMetrics) {
        long now = scheduler.nanoTime();
        Iterator<PendingAggregation> it = queue.pending.iterator();
        while (it.hasNext()) {
            PendingAggregation pending = it.next();
            try {
                if (pending.offer(event, deliveryId, now, timeoutNanos)) {
                    log.debug("Merged delivery {} into {}", deliveryId, pending);
                    return null;
                }
            } catch (RuntimeException e) {
                log.error("Merging delivery {} into {} failed, abandoning the aggregation", deliveryId, pending, e);
                pending.abandon();
                it.remove();
            }
        }

        Optional<AggregationPolicy> policy = AggregationPolicy.forEvent(event.getKind(), event.getAction());
        if (policy.isEmpty()) {
            return solo(subscription, event, deliveryId, pushMetrics);
        }

        PendingAggregation created = new PendingAggregation(subscription, policy.get(), event, deliveryId, pushMetrics);
        try {
            created.start(now + timeoutNanos);
            queue.pending.addLast(created);
            scheduler.schedule(() -> onDeadline(queue, created), timeoutNanos);
        } catch (RuntimeException e) {
            log.error("Starting {} failed, abandoning it", created, e);
            created.abandon();
            queue.pending.remove(created);
            return null;
        }
        log.debug("Started {}", created);
        return null;
    }

    private void onDeadline(SubscriptionQueue queue, PendingAggregation pending) {
        Notification notification;
        synchronized (queue) {
            if (pending.getState() != AggregationState.AGGREGATING) {
                return;
            }
            try {
                long remaining = pending.getDeadlineNanos() - scheduler.nanoTime();
                if (remaining > 0) {
                    scheduler.schedule(() -> onDeadline(queue, pending), remaining);
                    return;
                }
                queue.pending.remove(pending);
                notification = pending.flush();
            } catch (RuntimeException e) {
                log.error("Flushing {} failed, abandoning it", pending, e);
                pending.abandon();
                queue.pending.remove(pending);
                retireIfEmpty(queue);
                return;
            }
            retireIfEmpty(queue);
        }
        log.debug("Flushed {}", notification);
        handOff(notification);
    }

    /**
     * Flushes every pending aggregation now and delivers the results on the
     * calling thread.  Events submitted afterwards, or concurrently with this
     * call, are delivered without aggregation.
     *
     * @return the number of notifications flushed
     */
    public int shutdown() {
        shutDown = true;
        List<Notification> flushed = new ArrayList<>();
        for (SubscriptionQueue queue : queues.values()) {
            synchronized (queue) {
                for (PendingAggregation pending : queue.pending) {
                    if (pending.getState() != AggregationState.AGGREGATING) {
                        continue;
                    }
                    try {
                        flushed.add(pending.flush());
                    } catch (RuntimeException e) {
                        log.error("Flushing {} on shutdown failed", pending, e);
                        pending.abandon();
                    }
                }
                queue.pending.clear();
                queue.retired = true;
                queues.remove(queue.subscriptionId, queue);
            }
        }
        log.info("Aggregation engine shut down, flushed {} pending aggregation(s)", flushed.size());
        flushed.forEach(this::deliver);
        return flushed.size();
    }

    /** Number of aggregations of {@code subscriptionId} still waiting for their deadline. */
    public int pendingCount(UUID subscriptionId) {
        SubscriptionQueue queue = queues.get(subscriptionId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.pending.size();
        }
    }

    /** Number of subscriptions with at least one pending aggregation. */
    public int activeSubscriptions() {
        return queues.size();
    }

    // ------------------------------------------------------------------
    // Delivery
    // ------------------------------------------------------------------

    private static Notification solo(Subscription subscription, GitHubEvent event, String deliveryId,
                                     PushMetrics pushMetrics) {
        return new Notification(subscription.getId(), subscription.getChannelId(), event, event.getAction(),
                null, pushMetrics, Set.of(deliveryId));
    }

    private void handOff(Notification notification) {
        try {
            deliveryExecutor.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected {}, delivering on the calling thread", notification);
            deliver(notification);
        }
    }

    private void deliver(Notification notification) {
        try {
            handler.deliver(notification);
        } catch (DeliveryException e) {
            log.error("Delivery of {} failed: {}", notification, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering {}", notification, e);
        }
    }

    private void retireIfEmpty(SubscriptionQueue queue) {
        if (queue.pending.isEmpty()) {
            queue.retired = true;
            queues.remove(queue.subscriptionId, queue);
        }
    }

    /** Guarded by its own monitor. */
    private static final class SubscriptionQueue {
        final UUID subscriptionId;
        final Deque<PendingAggregation> pending = new ArrayDeque<>();
        boolean retired;

        SubscriptionQueue(UUID subscriptionId) {
            this.subscriptionId = subscriptionId;
        }
    }
}
