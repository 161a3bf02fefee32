package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.CommentAction;
import com.hubrelay.webhooks.model.payload.Comment;
import com.hubrelay.webhooks.model.payload.PullRequest;

/** A comment on the diff of a pull request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestReviewCommentEvent extends GitHubEvent {

    @JsonProperty("action")
    private CommentAction action;

    @JsonProperty("comment")
    private Comment comment;

    @JsonProperty("pull_request")
    private PullRequest pullRequest;

    @Override
    public EventKind getKind() { return EventKind.PULL_REQUEST_REVIEW_COMMENT; }

    @Override
    public CommentAction getAction() { return action; }

    @Override
    public Integer getSubjectNumber() { return pullRequest != null ? pullRequest.getNumber() : null; }

    public Comment getComment()          { return comment; }
    public PullRequest getPullRequest()  { return pullRequest; }

    public void setAction(CommentAction action)         { this.action = action; }
    public void setComment(Comment comment)             { this.comment = comment; }
    public void setPullRequest(PullRequest pullRequest) { this.pullRequest = pullRequest; }
}
