package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actions of the {@code issues} event.
 *
 * <p>{@link #LABELS_CHANGED} and {@link #MILESTONE_CHANGED} are never sent by
 * GitHub.  The aggregation engine switches a coalesced notification to one of
 * them once several label or milestone events were folded together.
 */
public enum IssueAction implements EventAction {

    OPENED("opened"),
    EDITED("edited"),
    DELETED("deleted"),
    PINNED("pinned"),
    UNPINNED("unpinned"),
    CLOSED("closed"),
    REOPENED("reopened"),
    ASSIGNED("assigned"),
    UNASSIGNED("unassigned"),
    LABELED("labeled"),
    UNLABELED("unlabeled"),
    LOCKED("locked"),
    UNLOCKED("unlocked"),
    TRANSFERRED("transferred"),
    MILESTONED("milestoned"),
    DEMILESTONED("demilestoned"),

    // aggregate pseudo-actions
    LABELS_CHANGED("x_labels_changed"),
    MILESTONE_CHANGED("x_milestone_changed"),

    UNKNOWN("unknown");

    private final String value;

    IssueAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static IssueAction fromValue(String value) {
        return EventAction.lookup(IssueAction.class, value, UNKNOWN);
    }
}
