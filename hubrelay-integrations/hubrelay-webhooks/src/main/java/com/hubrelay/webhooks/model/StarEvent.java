package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.StarAction;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StarEvent extends GitHubEvent {

    @JsonProperty("action")
    private StarAction action;

    /** Null when the star was removed. */
    @JsonProperty("starred_at")
    private Instant starredAt;

    @Override
    public EventKind getKind() { return EventKind.STAR; }

    @Override
    public StarAction getAction() { return action; }

    public Instant getStarredAt() { return starredAt; }

    public void setAction(StarAction action)     { this.action = action; }
    public void setStarredAt(Instant starredAt)  { this.starredAt = starredAt; }
}
