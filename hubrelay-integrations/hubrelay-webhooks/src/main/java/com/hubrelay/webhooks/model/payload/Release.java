package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Release {

    @JsonProperty("id")
    private long id;

    @JsonProperty("tag_name")
    private String tagName;

    @JsonProperty("name")
    private String name;

    @JsonProperty("body")
    private String body;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("draft")
    private boolean draft;

    @JsonProperty("prerelease")
    private boolean prerelease;

    @JsonProperty("author")
    private User author;

    @JsonProperty("published_at")
    private Instant publishedAt;

    public long getId()              { return id; }
    public String getTagName()       { return tagName; }
    public String getName()          { return name; }
    public String getBody()          { return body; }
    public String getHtmlUrl()       { return htmlUrl; }
    public boolean isDraft()         { return draft; }
    public boolean isPrerelease()    { return prerelease; }
    public User getAuthor()          { return author; }
    public Instant getPublishedAt()  { return publishedAt; }

    public void setId(long id)                       { this.id = id; }
    public void setTagName(String tagName)           { this.tagName = tagName; }
    public void setName(String name)                 { this.name = name; }
    public void setBody(String body)                 { this.body = body; }
    public void setHtmlUrl(String htmlUrl)           { this.htmlUrl = htmlUrl; }
    public void setDraft(boolean draft)              { this.draft = draft; }
    public void setPrerelease(boolean prerelease)    { this.prerelease = prerelease; }
    public void setAuthor(User author)               { this.author = author; }
    public void setPublishedAt(Instant publishedAt)  { this.publishedAt = publishedAt; }
}
