package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.CommentAction;
import com.hubrelay.webhooks.model.payload.Comment;
import com.hubrelay.webhooks.model.payload.Issue;

/** A comment on an issue, or on the conversation tab of a pull request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueCommentEvent extends GitHubEvent {

    @JsonProperty("action")
    private CommentAction action;

    @JsonProperty("issue")
    private Issue issue;

    @JsonProperty("comment")
    private Comment comment;

    @JsonProperty("changes")
    private JsonNode changes;

    public IssueCommentEvent() {}

    public IssueCommentEvent(CommentAction action, Issue issue, Comment comment) {
        this.action = action;
        this.issue = issue;
        this.comment = comment;
    }

    @Override
    public EventKind getKind() { return EventKind.ISSUE_COMMENT; }

    @Override
    public CommentAction getAction() { return action; }

    @Override
    public Integer getSubjectNumber() { return issue != null ? issue.getNumber() : null; }

    public Issue getIssue()        { return issue; }
    public Comment getComment()    { return comment; }
    public JsonNode getChanges()   { return changes; }

    public void setAction(CommentAction action)  { this.action = action; }
    public void setIssue(Issue issue)            { this.issue = issue; }
    public void setComment(Comment comment)      { this.comment = comment; }
    public void setChanges(JsonNode changes)     { this.changes = changes; }
}
