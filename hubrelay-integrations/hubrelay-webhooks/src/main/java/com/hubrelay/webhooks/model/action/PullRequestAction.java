package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actions of the {@code pull_request} event.
 *
 * <p>As with {@link IssueAction}, the {@code x_} values are aggregate
 * pseudo-actions produced by the relay, not by GitHub.
 */
public enum PullRequestAction implements EventAction {

    OPENED("opened"),
    EDITED("edited"),
    CLOSED("closed"),
    REOPENED("reopened"),
    ASSIGNED("assigned"),
    UNASSIGNED("unassigned"),
    REVIEW_REQUESTED("review_requested"),
    REVIEW_REQUEST_REMOVED("review_request_removed"),
    READY_FOR_REVIEW("ready_for_review"),
    CONVERTED_TO_DRAFT("converted_to_draft"),
    LABELED("labeled"),
    UNLABELED("unlabeled"),
    SYNCHRONIZE("synchronize"),
    LOCKED("locked"),
    UNLOCKED("unlocked"),
    MILESTONED("milestoned"),
    DEMILESTONED("demilestoned"),
    AUTO_MERGE_ENABLED("auto_merge_enabled"),
    AUTO_MERGE_DISABLED("auto_merge_disabled"),

    // aggregate pseudo-actions
    LABELS_CHANGED("x_labels_changed"),
    MILESTONE_CHANGED("x_milestone_changed"),

    UNKNOWN("unknown");

    private final String value;

    PullRequestAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static PullRequestAction fromValue(String value) {
        return EventAction.lookup(PullRequestAction.class, value, UNKNOWN);
    }
}
