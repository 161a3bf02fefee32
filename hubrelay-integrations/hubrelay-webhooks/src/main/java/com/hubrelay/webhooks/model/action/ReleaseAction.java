package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code release} event. */
public enum ReleaseAction implements EventAction {

    PUBLISHED("published"),
    UNPUBLISHED("unpublished"),
    CREATED("created"),
    EDITED("edited"),
    DELETED("deleted"),
    PRERELEASED("prereleased"),
    RELEASED("released"),
    UNKNOWN("unknown");

    private final String value;

    ReleaseAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static ReleaseAction fromValue(String value) {
        return EventAction.lookup(ReleaseAction.class, value, UNKNOWN);
    }
}
