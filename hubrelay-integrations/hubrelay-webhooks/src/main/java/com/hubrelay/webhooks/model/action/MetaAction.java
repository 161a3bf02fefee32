package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code meta} event, which concerns the hook itself. */
public enum MetaAction implements EventAction {

    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String value;

    MetaAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static MetaAction fromValue(String value) {
        return EventAction.lookup(MetaAction.class, value, UNKNOWN);
    }
}
