package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The repository an event happened in, as embedded in every repository-scoped payload. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Repository {

    @JsonProperty("id")
    private long id;

    @JsonProperty("name")
    private String name;

    /** "owner/name"; the key subscriptions are registered under. */
    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("private")
    private boolean privateRepository;

    @JsonProperty("owner")
    private User owner;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("description")
    private String description;

    @JsonProperty("default_branch")
    private String defaultBranch;

    public Repository() {}

    public Repository(String fullName) {
        this.fullName = fullName;
        this.name = fullName.substring(fullName.indexOf('/') + 1);
    }

    public long getId()                 { return id; }
    public String getName()             { return name; }
    public String getFullName()         { return fullName; }
    public boolean isPrivateRepository() { return privateRepository; }
    public User getOwner()              { return owner; }
    public String getHtmlUrl()          { return htmlUrl; }
    public String getDescription()      { return description; }
    public String getDefaultBranch()    { return defaultBranch; }

    public void setId(long id)                              { this.id = id; }
    public void setName(String name)                        { this.name = name; }
    public void setFullName(String fullName)                { this.fullName = fullName; }
    public void setPrivateRepository(boolean privateRepository) { this.privateRepository = privateRepository; }
    public void setOwner(User owner)                        { this.owner = owner; }
    public void setHtmlUrl(String htmlUrl)                  { this.htmlUrl = htmlUrl; }
    public void setDescription(String description)          { this.description = description; }
    public void setDefaultBranch(String defaultBranch)      { this.defaultBranch = defaultBranch; }

    @Override
    public String toString() {
        return "Repository{" + fullName + '}';
    }
}
