package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An issue as embedded in {@code issues} and {@code issue_comment} payloads.
 *
 * GitHub also delivers pull request comments as {@code issue_comment}; for
 * those the issue carries a non-null {@link #getPullRequest()} link object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Issue {

    @JsonProperty("id")
    private long id;

    @JsonProperty("number")
    private int number;

    @JsonProperty("title")
    private String title;

    @JsonProperty("body")
    private String body;

    /** "open" or "closed". */
    @JsonProperty("state")
    private String state;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("user")
    private User user;

    @JsonProperty("labels")
    private List<Label> labels = new ArrayList<>();

    @JsonProperty("assignees")
    private List<User> assignees = new ArrayList<>();

    @JsonProperty("milestone")
    private Milestone milestone;

    @JsonProperty("pull_request")
    private JsonNode pullRequest;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("closed_at")
    private Instant closedAt;

    public Issue() {}

    public Issue(int number, String title) {
        this.number = number;
        this.title = title;
    }

    public long getId()                { return id; }
    public int getNumber()             { return number; }
    public String getTitle()           { return title; }
    public String getBody()            { return body; }
    public String getState()           { return state; }
    public String getHtmlUrl()         { return htmlUrl; }
    public User getUser()              { return user; }
    public List<Label> getLabels()     { return labels; }
    public List<User> getAssignees()   { return assignees; }
    public Milestone getMilestone()    { return milestone; }
    public JsonNode getPullRequest()   { return pullRequest; }
    public Instant getCreatedAt()      { return createdAt; }
    public Instant getClosedAt()       { return closedAt; }

    public boolean hasPullRequestLink() { return pullRequest != null && !pullRequest.isNull(); }

    public void setId(long id)                        { this.id = id; }
    public void setNumber(int number)                 { this.number = number; }
    public void setTitle(String title)                { this.title = title; }
    public void setBody(String body)                  { this.body = body; }
    public void setState(String state)                { this.state = state; }
    public void setHtmlUrl(String htmlUrl)            { this.htmlUrl = htmlUrl; }
    public void setUser(User user)                    { this.user = user; }
    public void setLabels(List<Label> labels)         { this.labels = labels != null ? labels : new ArrayList<>(); }
    public void setAssignees(List<User> assignees)    { this.assignees = assignees != null ? assignees : new ArrayList<>(); }
    public void setMilestone(Milestone milestone)     { this.milestone = milestone; }
    public void setPullRequest(JsonNode pullRequest)  { this.pullRequest = pullRequest; }
    public void setCreatedAt(Instant createdAt)       { this.createdAt = createdAt; }
    public void setClosedAt(Instant closedAt)         { this.closedAt = closedAt; }

    @Override
    public String toString() {
        return "Issue{#" + number + ", title='" + title + "'}";
    }
}
