package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One page entry of a {@code gollum} (wiki) payload. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WikiPage {

    @JsonProperty("page_name")
    private String pageName;

    @JsonProperty("title")
    private String title;

    /** "created" or "edited". */
    @JsonProperty("action")
    private String action;

    @JsonProperty("sha")
    private String sha;

    @JsonProperty("html_url")
    private String htmlUrl;

    public String getPageName()  { return pageName; }
    public String getTitle()     { return title; }
    public String getAction()    { return action; }
    public String getSha()       { return sha; }
    public String getHtmlUrl()   { return htmlUrl; }

    public void setPageName(String pageName)  { this.pageName = pageName; }
    public void setTitle(String title)        { this.title = title; }
    public void setAction(String action)      { this.action = action; }
    public void setSha(String sha)            { this.sha = sha; }
    public void setHtmlUrl(String htmlUrl)    { this.htmlUrl = htmlUrl; }
}
