package com.hubrelay.webhooks.aggregation;

/** Outcome of offering an event to a {@link PendingAggregation}. */
enum MergeResult {

    /** Not absorbed; the next aggregation in the queue gets a chance. */
    REJECTED,

    /** Absorbed, deadline pushed back to now + timeout. */
    MERGED,

    /** Absorbed, deadline unchanged. */
    MERGED_KEEP_DEADLINE;

    boolean isMerged() { return this != REJECTED; }
}
