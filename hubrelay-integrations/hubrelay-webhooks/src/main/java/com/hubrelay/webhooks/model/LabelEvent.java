package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.LabelAction;
import com.hubrelay.webhooks.model.payload.Label;

/** A repository label was created, edited or deleted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelEvent extends GitHubEvent {

    @JsonProperty("action")
    private LabelAction action;

    @JsonProperty("label")
    private Label label;

    /** For edits: old {@code name}, {@code color} and {@code description} under {@code from}. */
    @JsonProperty("changes")
    private JsonNode changes;

    @Override
    public EventKind getKind() { return EventKind.LABEL; }

    @Override
    public LabelAction getAction() { return action; }

    public Label getLabel()       { return label; }
    public JsonNode getChanges()  { return changes; }

    public void setAction(LabelAction action)  { this.action = action; }
    public void setLabel(Label label)          { this.label = label; }
    public void setChanges(JsonNode changes)   { this.changes = changes; }
}
