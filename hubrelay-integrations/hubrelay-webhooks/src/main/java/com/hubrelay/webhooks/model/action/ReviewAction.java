package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code pull_request_review} event. */
public enum ReviewAction implements EventAction {

    SUBMITTED("submitted"),
    EDITED("edited"),
    DISMISSED("dismissed"),
    UNKNOWN("unknown");

    private final String value;

    ReviewAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static ReviewAction fromValue(String value) {
        return EventAction.lookup(ReviewAction.class, value, UNKNOWN);
    }
}
