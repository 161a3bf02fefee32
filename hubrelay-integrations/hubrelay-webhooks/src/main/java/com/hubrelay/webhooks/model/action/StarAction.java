package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code star} event. */
public enum StarAction implements EventAction {

    CREATED("created"),
    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String value;

    StarAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static StarAction fromValue(String value) {
        return EventAction.lookup(StarAction.class, value, UNKNOWN);
    }
}
