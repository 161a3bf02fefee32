package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A GitHub account: the sender of an event, an issue author, an assignee. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class User {

    @JsonProperty("id")
    private long id;

    @JsonProperty("login")
    private String login;

    /** Display name; GitHub only includes it in some payloads. */
    @JsonProperty("name")
    private String name;

    @JsonProperty("html_url")
    private String htmlUrl;

    /** "User", "Organization" or "Bot". */
    @JsonProperty("type")
    private String type;

    public User() {}

    public User(long id, String login) {
        this.id = id;
        this.login = login;
    }

    public long getId()         { return id; }
    public String getLogin()    { return login; }
    public String getName()     { return name; }
    public String getHtmlUrl()  { return htmlUrl; }
    public String getType()     { return type; }

    public void setId(long id)              { this.id = id; }
    public void setLogin(String login)      { this.login = login; }
    public void setName(String name)        { this.name = name; }
    public void setHtmlUrl(String htmlUrl)  { this.htmlUrl = htmlUrl; }
    public void setType(String type)        { this.type = type; }

    @Override
    public String toString() {
        return "User{id=" + id + ", login='" + login + "'}";
    }
}
