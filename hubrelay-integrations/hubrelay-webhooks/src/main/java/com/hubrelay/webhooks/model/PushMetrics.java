package com.hubrelay.webhooks.model;

import com.hubrelay.webhooks.model.payload.Commit;

import java.util.List;
import java.util.Objects;

/**
 * Commit counts of a push, computed once by the dispatcher and carried next
 * to the {@link PushEvent} rather than written into it.
 */
public final class PushMetrics {

    private final int size;
    private final int distinctSize;

    public PushMetrics(int size, int distinctSize) {
        this.size = size;
        this.distinctSize = distinctSize;
    }

    /**
     * Uses {@code size} / {@code distinct_size} from the payload when GitHub sent
     * both, otherwise counts the listed commits, skipping {@code null} entries.
     */
    public static PushMetrics of(PushEvent push) {
        if (push.getSize() != null && push.getDistinctSize() != null) {
            return new PushMetrics(push.getSize(), push.getDistinctSize());
        }
        List<Commit> commits = push.getCommits().stream().filter(Objects::nonNull).toList();
        int distinct = (int) commits.stream().filter(Commit::isDistinct).count();
        return new PushMetrics(commits.size(), distinct);
    }

    /** Total number of commits in the push. */
    public int getSize()         { return size; }
    /** Commits not previously pushed to any other ref. */
    public int getDistinctSize() { return distinctSize; }

    @Override
    public boolean equals(Object o) {
        return o instanceof PushMetrics other && size == other.size && distinctSize == other.distinctSize;
    }

    @Override
    public int hashCode() { return 31 * size + distinctSize; }

    @Override
    public String toString() {
        return "PushMetrics{size=" + size + ", distinctSize=" + distinctSize + '}';
    }
}
