package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.MilestoneAction;
import com.hubrelay.webhooks.model.payload.Milestone;

/** A milestone itself was created, edited, closed, reopened or deleted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MilestoneEvent extends GitHubEvent {

    @JsonProperty("action")
    private MilestoneAction action;

    @JsonProperty("milestone")
    private Milestone milestone;

    @JsonProperty("changes")
    private JsonNode changes;

    @Override
    public EventKind getKind() { return EventKind.MILESTONE; }

    @Override
    public MilestoneAction getAction() { return action; }

    public Milestone getMilestone() { return milestone; }
    public JsonNode getChanges()    { return changes; }

    public void setAction(MilestoneAction action)  { this.action = action; }
    public void setMilestone(Milestone milestone)  { this.milestone = milestone; }
    public void setChanges(JsonNode changes)       { this.changes = changes; }
}
