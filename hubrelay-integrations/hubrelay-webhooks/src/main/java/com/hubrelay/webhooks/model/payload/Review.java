package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A pull request review. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Review {

    @JsonProperty("id")
    private long id;

    /** "approved", "changes_requested", "commented", "dismissed" (GitHub's casing varies). */
    @JsonProperty("state")
    private String state;

    @JsonProperty("body")
    private String body;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("user")
    private User user;

    @JsonProperty("submitted_at")
    private Instant submittedAt;

    public long getId()              { return id; }
    public String getState()         { return state; }
    public String getBody()          { return body; }
    public String getHtmlUrl()       { return htmlUrl; }
    public User getUser()            { return user; }
    public Instant getSubmittedAt()  { return submittedAt; }

    public void setId(long id)                       { this.id = id; }
    public void setState(String state)               { this.state = state; }
    public void setBody(String body)                 { this.body = body; }
    public void setHtmlUrl(String htmlUrl)           { this.htmlUrl = htmlUrl; }
    public void setUser(User user)                   { this.user = user; }
    public void setSubmittedAt(Instant submittedAt)  { this.submittedAt = submittedAt; }
}
