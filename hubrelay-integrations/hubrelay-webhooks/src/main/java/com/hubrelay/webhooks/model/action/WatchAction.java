package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code watch} event. GitHub only ever sends "started". */
public enum WatchAction implements EventAction {

    STARTED("started"),
    UNKNOWN("unknown");

    private final String value;

    WatchAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static WatchAction fromValue(String value) {
        return EventAction.lookup(WatchAction.class, value, UNKNOWN);
    }
}
