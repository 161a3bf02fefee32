package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.payload.WikiPage;

import java.util.ArrayList;
import java.util.List;

/** Wiki pages were created or edited. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GollumEvent extends GitHubEvent {

    @JsonProperty("pages")
    private List<WikiPage> pages = new ArrayList<>();

    @Override
    public EventKind getKind() { return EventKind.GOLLUM; }

    public List<WikiPage> getPages() { return pages; }

    public void setPages(List<WikiPage> pages) { this.pages = pages != null ? pages : new ArrayList<>(); }
}
