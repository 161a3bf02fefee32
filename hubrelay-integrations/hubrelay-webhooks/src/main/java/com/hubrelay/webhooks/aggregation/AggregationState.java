package com.hubrelay.webhooks.aggregation;

/**
 * Lifecycle of a {@link PendingAggregation}.
 *
 * <pre>
 *   STARTING --start--&gt; AGGREGATING --deadline--&gt; FLUSHED
 *       \                    |
 *        \---- error --------+--&gt; ABANDONED
 * </pre>
 *
 * {@code FLUSHED} and {@code ABANDONED} are terminal.
 */
public enum AggregationState {
    STARTING,
    AGGREGATING,
    FLUSHED,
    ABANDONED
}
