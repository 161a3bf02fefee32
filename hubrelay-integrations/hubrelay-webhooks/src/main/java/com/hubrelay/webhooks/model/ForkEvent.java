package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.payload.Repository;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ForkEvent extends GitHubEvent {

    /** The newly created fork. */
    @JsonProperty("forkee")
    private Repository forkee;

    @Override
    public EventKind getKind() { return EventKind.FORK; }

    public Repository getForkee() { return forkee; }

    public void setForkee(Repository forkee) { this.forkee = forkee; }
}
