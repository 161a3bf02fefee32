package com.hubrelay.webhooks.model.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Actions of the {@code repository} event. */
public enum RepositoryAction implements EventAction {

    CREATED("created"),
    DELETED("deleted"),
    ARCHIVED("archived"),
    UNARCHIVED("unarchived"),
    EDITED("edited"),
    RENAMED("renamed"),
    TRANSFERRED("transferred"),
    PUBLICIZED("publicized"),
    PRIVATIZED("privatized"),
    UNKNOWN("unknown");

    private final String value;

    RepositoryAction(String value) { this.value = value; }

    @JsonValue
    @Override
    public String value() { return value; }

    @JsonCreator
    public static RepositoryAction fromValue(String value) {
        return EventAction.lookup(RepositoryAction.class, value, UNKNOWN);
    }
}
