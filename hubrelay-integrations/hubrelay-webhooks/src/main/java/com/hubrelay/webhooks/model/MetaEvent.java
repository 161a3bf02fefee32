package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.MetaAction;
import com.hubrelay.webhooks.model.payload.Hook;

/** Concerns the hook itself; GitHub sends it when the hook is deleted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetaEvent extends GitHubEvent {

    @JsonProperty("action")
    private MetaAction action;

    @JsonProperty("hook_id")
    private long hookId;

    @JsonProperty("hook")
    private Hook hook;

    public MetaEvent() {}

    public MetaEvent(MetaAction action) { this.action = action; }

    @Override
    public EventKind getKind() { return EventKind.META; }

    @Override
    public MetaAction getAction() { return action; }

    public long getHookId() { return hookId; }
    public Hook getHook()   { return hook; }

    public void setAction(MetaAction action) { this.action = action; }
    public void setHookId(long hookId)       { this.hookId = hookId; }
    public void setHook(Hook hook)           { this.hook = hook; }
}
