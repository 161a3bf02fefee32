package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions shared by {@code issue_comment} and {@code pull_request_review_comment}. */
public enum CommentAction implements EventAction {

    CREATED("created"),
    EDITED("edited"),
    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String value;

    CommentAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static CommentAction fromValue(String value) {
        return EventAction.lookup(CommentAction.class, value, UNKNOWN);
    }
}
