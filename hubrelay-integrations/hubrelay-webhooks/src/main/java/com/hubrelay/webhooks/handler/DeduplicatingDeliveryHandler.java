package com.hubrelay.webhooks.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decorator that drops notifications GitHub already had delivered.
 *
 * <p>GitHub retries a delivery (same {@code X-GitHub-Delivery} id) when it
 * did not see a timely 2xx, and users can redeliver by hand.  A notification
 * is suppressed when every one of its delivery ids is among the most recent
 * {@code capacity} ids passed on.  Ids are claimed before the delegate runs,
 * so a copy arriving while the first is still in flight is dropped too, and
 * released again when the delegate fails, so a failed delivery can be retried.
 */
public class DeduplicatingDeliveryHandler implements DeliveryHandler {

    private static final Logger log = LoggerFactory.getLogger(DeduplicatingDeliveryHandler.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final DeliveryHandler delegate;
    private final Map<String, Boolean> seen;

    public DeduplicatingDeliveryHandler(DeliveryHandler delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public DeduplicatingDeliveryHandler(DeliveryHandler delegate, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.delegate = delegate;
        // access-ordered LRU
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public void deliver(Notification notification) throws DeliveryException {
        List<String> claimed = new ArrayList<>();
        synchronized (seen) {
            if (!notification.getDeliveryIds().isEmpty()
                    && notification.getDeliveryIds().stream().allMatch(seen::containsKey)) {
                log.info("Skipping duplicate notification {} for channel {}",
                        notification.getDeliveryIds(), notification.getChannelId());
                return;
            }
            for (String id : notification.getDeliveryIds()) {
                if (seen.putIfAbsent(id, Boolean.TRUE) == null) {
                    claimed.add(id);
                }
            }
        }
        try {
            delegate.deliver(notification);
        } catch (DeliveryException | RuntimeException e) {
            synchronized (seen) {
                claimed.forEach(seen::remove);
            }
            throw e;
        }
    }

    /** Number of delivery ids currently remembered. */
    public int rememberedCount() {
        synchronized (seen) {
            return seen.size();
        }
    }
}
