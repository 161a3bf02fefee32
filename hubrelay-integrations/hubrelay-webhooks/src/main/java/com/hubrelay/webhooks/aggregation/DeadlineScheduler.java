package com.hubrelay.webhooks.aggregation;

/**
 * Clock and one-shot timer used by the {@link AggregationEngine}.
 *
 * <p>Both methods work in nanoseconds of the same monotonic clock.
 */
public interface DeadlineScheduler {

    /** Current reading of the monotonic clock. */
    long nanoTime();

    /** Runs {@code task} once, no earlier than {@code delayNanos} from now. */
    void schedule(Runnable task, long delayNanos);
}
