package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code label} event. */
public enum LabelAction implements EventAction {

    CREATED("created"),
    EDITED("edited"),
    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String value;

    LabelAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static LabelAction fromValue(String value) {
        return EventAction.lookup(LabelAction.class, value, UNKNOWN);
    }
}
