package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/** A commit listed in a {@code push} payload. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Commit {

    @JsonProperty("id")
    private String id;

    @JsonProperty("tree_id")
    private String treeId;

    /** False when the commit was already pushed to another ref of the repository. */
    @JsonProperty("distinct")
    private boolean distinct;

    @JsonProperty("message")
    private String message;

    @JsonProperty("timestamp")
    private OffsetDateTime timestamp;

    @JsonProperty("url")
    private String url;

    @JsonProperty("author")
    private GitUser author;

    @JsonProperty("committer")
    private GitUser committer;

    @JsonProperty("added")
    private List<String> added = new ArrayList<>();

    @JsonProperty("removed")
    private List<String> removed = new ArrayList<>();

    @JsonProperty("modified")
    private List<String> modified = new ArrayList<>();

    public Commit() {}

    public Commit(String id, String message, boolean distinct) {
        this.id = id;
        this.message = message;
        this.distinct = distinct;
    }

    public String getId()                 { return id; }
    public String getTreeId()             { return treeId; }
    public boolean isDistinct()           { return distinct; }
    public String getMessage()            { return message; }
    public OffsetDateTime getTimestamp()  { return timestamp; }
    public String getUrl()                { return url; }
    public GitUser getAuthor()            { return author; }
    public GitUser getCommitter()         { return committer; }
    public List<String> getAdded()        { return added; }
    public List<String> getRemoved()      { return removed; }
    public List<String> getModified()     { return modified; }

    public void setId(String id)                           { this.id = id; }
    public void setTreeId(String treeId)                   { this.treeId = treeId; }
    public void setDistinct(boolean distinct)              { this.distinct = distinct; }
    public void setMessage(String message)                 { this.message = message; }
    public void setTimestamp(OffsetDateTime timestamp)     { this.timestamp = timestamp; }
    public void setUrl(String url)                         { this.url = url; }
    public void setAuthor(GitUser author)                  { this.author = author; }
    public void setCommitter(GitUser committer)            { this.committer = committer; }
    public void setAdded(List<String> added)               { this.added = added; }
    public void setRemoved(List<String> removed)           { this.removed = removed; }
    public void setModified(List<String> modified)         { this.modified = modified; }
}
