package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequest {

    @JsonProperty("id")
    private long id;

    @JsonProperty("number")
    private int number;

    @JsonProperty("title")
    private String title;

    @JsonProperty("body")
    private String body;

    @JsonProperty("state")
    private String state;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("user")
    private User user;

    @JsonProperty("labels")
    private List<Label> labels = new ArrayList<>();

    @JsonProperty("milestone")
    private Milestone milestone;

    @JsonProperty("draft")
    private boolean draft;

    @JsonProperty("merged")
    private boolean merged;

    @JsonProperty("merged_at")
    private Instant mergedAt;

    @JsonProperty("merge_commit_sha")
    private String mergeCommitSha;

    public PullRequest() {}

    public PullRequest(int number, String title) {
        this.number = number;
        this.title = title;
    }

    public long getId()               { return id; }
    public int getNumber()            { return number; }
    public String getTitle()          { return title; }
    public String getBody()           { return body; }
    public String getState()          { return state; }
    public String getHtmlUrl()        { return htmlUrl; }
    public User getUser()             { return user; }
    public List<Label> getLabels()    { return labels; }
    public Milestone getMilestone()   { return milestone; }
    public boolean isDraft()          { return draft; }
    public boolean isMerged()         { return merged; }
    public Instant getMergedAt()      { return mergedAt; }
    public String getMergeCommitSha() { return mergeCommitSha; }

    public void setId(long id)                           { this.id = id; }
    public void setNumber(int number)                    { this.number = number; }
    public void setTitle(String title)                   { this.title = title; }
    public void setBody(String body)                     { this.body = body; }
    public void setState(String state)                   { this.state = state; }
    public void setHtmlUrl(String htmlUrl)               { this.htmlUrl = htmlUrl; }
    public void setUser(User user)                       { this.user = user; }
    public void setLabels(List<Label> labels)            { this.labels = labels != null ? labels : new ArrayList<>(); }
    public void setMilestone(Milestone milestone)        { this.milestone = milestone; }
    public void setDraft(boolean draft)                  { this.draft = draft; }
    public void setMerged(boolean merged)                { this.merged = merged; }
    public void setMergedAt(Instant mergedAt)            { this.mergedAt = mergedAt; }
    public void setMergeCommitSha(String mergeCommitSha) { this.mergeCommitSha = mergeCommitSha; }

    @Override
    public String toString() {
        return "PullRequest{#" + number + ", title='" + title + "'}";
    }
}
