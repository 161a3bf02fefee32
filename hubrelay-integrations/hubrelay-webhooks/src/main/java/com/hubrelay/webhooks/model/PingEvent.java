package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.payload.Hook;

/** Sent once when a hook is registered and whenever it is pinged manually. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PingEvent extends GitHubEvent {

    @JsonProperty("zen")
    private String zen;

    @JsonProperty("hook_id")
    private long hookId;

    @JsonProperty("hook")
    private Hook hook;

    @Override
    public EventKind getKind() { return EventKind.PING; }

    public String getZen()  { return zen; }
    public long getHookId() { return hookId; }
    public Hook getHook()   { return hook; }

    public void setZen(String zen)       { this.zen = zen; }
    public void setHookId(long hookId)   { this.hookId = hookId; }
    public void setHook(Hook hook)       { this.hook = hook; }
}
