package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.WatchAction;

/** Despite the name, GitHub sends this when a repository is starred. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WatchEvent extends GitHubEvent {

    @JsonProperty("action")
    private WatchAction action;

    @Override
    public EventKind getKind() { return EventKind.WATCH; }

    @Override
    public WatchAction getAction() { return action; }

    public void setAction(WatchAction action) { this.action = action; }
}
