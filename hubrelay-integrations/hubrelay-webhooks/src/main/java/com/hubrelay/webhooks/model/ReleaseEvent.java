package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.ReleaseAction;
import com.hubrelay.webhooks.model.payload.Release;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ReleaseEvent extends GitHubEvent {

    @JsonProperty("action")
    private ReleaseAction action;

    @JsonProperty("release")
    private Release release;

    @Override
    public EventKind getKind() { return EventKind.RELEASE; }

    @Override
    public ReleaseAction getAction() { return action; }

    public Release getRelease() { return release; }

    public void setAction(ReleaseAction action) { this.action = action; }
    public void setRelease(Release release)     { this.release = release; }
}
