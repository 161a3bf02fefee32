package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.PullRequestAction;
import com.hubrelay.webhooks.model.payload.Label;
import com.hubrelay.webhooks.model.payload.Milestone;
import com.hubrelay.webhooks.model.payload.PullRequest;
import com.hubrelay.webhooks.model.payload.User;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestEvent extends GitHubEvent {

    @JsonProperty("action")
    private PullRequestAction action;

    @JsonProperty("number")
    private int number;

    @JsonProperty("pull_request")
    private PullRequest pullRequest;

    @JsonProperty("label")
    private Label label;

    @JsonProperty("milestone")
    private Milestone milestone;

    @JsonProperty("assignee")
    private User assignee;

    @JsonProperty("requested_reviewer")
    private User requestedReviewer;

    @JsonProperty("changes")
    private JsonNode changes;

    public PullRequestEvent() {}

    public PullRequestEvent(PullRequestAction action, PullRequest pullRequest) {
        this.action = action;
        this.pullRequest = pullRequest;
        this.number = pullRequest.getNumber();
    }

    @Override
    public EventKind getKind() { return EventKind.PULL_REQUEST; }

    @Override
    public PullRequestAction getAction() { return action; }

    @Override
    public Integer getSubjectNumber() {
        if (pullRequest != null) {
            return pullRequest.getNumber();
        }
        return number != 0 ? number : null;
    }

    public int getNumber()                { return number; }
    public PullRequest getPullRequest()   { return pullRequest; }
    public Label getLabel()               { return label; }
    public Milestone getMilestone()       { return milestone; }
    public User getAssignee()             { return assignee; }
    public User getRequestedReviewer()    { return requestedReviewer; }
    public JsonNode getChanges()          { return changes; }

    public void setAction(PullRequestAction action)    { this.action = action; }
    public void setNumber(int number)                  { this.number = number; }
    public void setPullRequest(PullRequest pullRequest) { this.pullRequest = pullRequest; }
    public void setLabel(Label label)                  { this.label = label; }
    public void setMilestone(Milestone milestone)      { this.milestone = milestone; }
    public void setAssignee(User assignee)             { this.assignee = assignee; }
    public void setRequestedReviewer(User requestedReviewer) { this.requestedReviewer = requestedReviewer; }
    public void setChanges(JsonNode changes)           { this.changes = changes; }
}
