package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.IssueAction;
import com.hubrelay.webhooks.model.payload.Issue;
import com.hubrelay.webhooks.model.payload.Label;
import com.hubrelay.webhooks.model.payload.Milestone;
import com.hubrelay.webhooks.model.payload.User;

/**
 * Everything that changes an issue itself (comments arrive as {@link IssueCommentEvent}).
 *
 * <p>{@code label} is set for labeled/unlabeled, {@code milestone} for
 * milestoned/demilestoned, {@code assignee} for assigned/unassigned and
 * {@code changes} (old title/body) for edited.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssuesEvent extends GitHubEvent {

    @JsonProperty("action")
    private IssueAction action;

    @JsonProperty("issue")
    private Issue issue;

    @JsonProperty("label")
    private Label label;

    @JsonProperty("milestone")
    private Milestone milestone;

    @JsonProperty("assignee")
    private User assignee;

    @JsonProperty("changes")
    private JsonNode changes;

    public IssuesEvent() {}

    public IssuesEvent(IssueAction action, Issue issue) {
        this.action = action;
        this.issue = issue;
    }

    @Override
    public EventKind getKind() { return EventKind.ISSUES; }

    @Override
    public IssueAction getAction() { return action; }

    @Override
    public Integer getSubjectNumber() { return issue != null ? issue.getNumber() : null; }

    public Issue getIssue()           { return issue; }
    public Label getLabel()           { return label; }
    public Milestone getMilestone()   { return milestone; }
    public User getAssignee()         { return assignee; }
    public JsonNode getChanges()      { return changes; }

    public void setAction(IssueAction action)        { this.action = action; }
    public void setIssue(Issue issue)                { this.issue = issue; }
    public void setLabel(Label label)                { this.label = label; }
    public void setMilestone(Milestone milestone)    { this.milestone = milestone; }
    public void setAssignee(User assignee)           { this.assignee = assignee; }
    public void setChanges(JsonNode changes)         { this.changes = changes; }
}
