package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** An issue, pull request or review comment. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Comment {

    @JsonProperty("id")
    private long id;

    @JsonProperty("body")
    private String body;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("user")
    private User user;

    /** Only set on review comments. */
    @JsonProperty("path")
    private String path;

    @JsonProperty("created_at")
    private Instant createdAt;

    public Comment() {}

    public Comment(long id, String body) {
        this.id = id;
        this.body = body;
    }

    public long getId()            { return id; }
    public String getBody()        { return body; }
    public String getHtmlUrl()     { return htmlUrl; }
    public User getUser()          { return user; }
    public String getPath()        { return path; }
    public Instant getCreatedAt()  { return createdAt; }

    public void setId(long id)                   { this.id = id; }
    public void setBody(String body)             { this.body = body; }
    public void setHtmlUrl(String htmlUrl)       { this.htmlUrl = htmlUrl; }
    public void setUser(User user)               { this.user = user; }
    public void setPath(String path)             { this.path = path; }
    public void setCreatedAt(Instant createdAt)  { this.createdAt = createdAt; }
}
