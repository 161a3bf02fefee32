package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code milestone} event. */
public enum MilestoneAction implements EventAction {

    CREATED("created"),
    CLOSED("closed"),
    OPENED("opened"),
    EDITED("edited"),
    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String value;

    MilestoneAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static MilestoneAction fromValue(String value) {
        return EventAction.lookup(MilestoneAction.class, value, UNKNOWN);
    }
}
