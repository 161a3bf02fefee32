package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.ReviewAction;
import com.hubrelay.webhooks.model.payload.PullRequest;
import com.hubrelay.webhooks.model.payload.Review;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestReviewEvent extends GitHubEvent {

    @JsonProperty("action")
    private ReviewAction action;

    @JsonProperty("review")
    private Review review;

    @JsonProperty("pull_request")
    private PullRequest pullRequest;

    @Override
    public EventKind getKind() { return EventKind.PULL_REQUEST_REVIEW; }

    @Override
    public ReviewAction getAction() { return action; }

    @Override
    public Integer getSubjectNumber() { return pullRequest != null ? pullRequest.getNumber() : null; }

    public Review getReview()            { return review; }
    public PullRequest getPullRequest()  { return pullRequest; }

    public void setAction(ReviewAction action)          { this.action = action; }
    public void setReview(Review review)                { this.review = review; }
    public void setPullRequest(PullRequest pullRequest) { this.pullRequest = pullRequest; }
}
