package com.hubrelay.webhooks.aggregation;

import com.hubrelay.webhooks.model.payload.Label;
import com.hubrelay.webhooks.model.payload.Milestone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Data folded into a {@link PendingAggregation} by its merges.
 *
 * <p>Only the fields relevant to the aggregation's {@link AggregationPolicy}
 * are ever filled; everything else stays empty / {@code null} / {@code false}.
 * Mutated only under the owning subscription's queue lock; once the
 * aggregation has flushed the instance is handed to delivery and no longer
 * changes.
 */
public final class Accumulator {

    private final List<Label> addedLabels   = new ArrayList<>();
    private final List<Label> removedLabels = new ArrayList<>();
    private final Set<Long>   initialLabelIds = new HashSet<>();
    private Milestone milestoneFrom;
    private Milestone milestoneTo;
    // a slot filled by an event without a milestone object is still filled
    private boolean   milestoneFromSet;
    private boolean   milestoneToSet;
    private boolean   closed;
    private boolean   reopened;

    public List<Label> getAddedLabels()      { return Collections.unmodifiableList(addedLabels); }
    public List<Label> getRemovedLabels()    { return Collections.unmodifiableList(removedLabels); }
    /** Label ids the subject already had when it was opened. */
    public Set<Long>   getInitialLabelIds()  { return Collections.unmodifiableSet(initialLabelIds); }
    public Milestone   getMilestoneFrom()    { return milestoneFrom; }
    public Milestone   getMilestoneTo()      { return milestoneTo; }
    public boolean     hasMilestoneFrom()    { return milestoneFromSet; }
    public boolean     hasMilestoneTo()      { return milestoneToSet; }
    public boolean     isClosed()            { return closed; }
    public boolean     isReopened()          { return reopened; }

    /** A label added after being removed in the same window cancels the removal. */
    void addLabel(Label label) {
        removedLabels.remove(label);
        if (!addedLabels.contains(label)) {
            addedLabels.add(label);
        }
    }

    /** A label removed after being added in the same window cancels the addition. */
    void removeLabel(Label label) {
        addedLabels.remove(label);
        if (!removedLabels.contains(label)) {
            removedLabels.add(label);
        }
    }

    void recordInitialLabels(List<Label> labels) {
        for (Label label : labels) {
            initialLabelIds.add(label.getId());
        }
    }

    void setMilestoneFrom(Milestone milestoneFrom) { this.milestoneFrom = milestoneFrom; this.milestoneFromSet = true; }
    void setMilestoneTo(Milestone milestoneTo)     { this.milestoneTo = milestoneTo; this.milestoneToSet = true; }
    void markClosed()                              { this.closed = true; }
    void markReopened()                            { this.reopened = true; }

    @Override
    public String toString() {
        return "Accumulator{added=" + addedLabels + ", removed=" + removedLabels +
               ", from=" + milestoneFrom + ", to=" + milestoneTo +
               ", closed=" + closed + ", reopened=" + reopened + '}';
    }
}
