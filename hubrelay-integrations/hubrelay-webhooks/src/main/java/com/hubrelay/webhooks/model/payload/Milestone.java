package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Milestone {

    @JsonProperty("id")
    private long id;

    @JsonProperty("number")
    private int number;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    /** "open" or "closed". */
    @JsonProperty("state")
    private String state;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("due_on")
    private Instant dueOn;

    public Milestone() {}

    public Milestone(long id, int number, String title) {
        this.id = id;
        this.number = number;
        this.title = title;
    }

    public long getId()             { return id; }
    public int getNumber()          { return number; }
    public String getTitle()        { return title; }
    public String getDescription()  { return description; }
    public String getState()        { return state; }
    public String getHtmlUrl()      { return htmlUrl; }
    public Instant getDueOn()       { return dueOn; }

    public void setId(long id)                      { this.id = id; }
    public void setNumber(int number)               { this.number = number; }
    public void setTitle(String title)              { this.title = title; }
    public void setDescription(String description)  { this.description = description; }
    public void setState(String state)              { this.state = state; }
    public void setHtmlUrl(String htmlUrl)          { this.htmlUrl = htmlUrl; }
    public void setDueOn(Instant dueOn)             { this.dueOn = dueOn; }

    @Override
    public String toString() {
        return "Milestone{number=" + number + ", title='" + title + "'}";
    }
}
