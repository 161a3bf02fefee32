package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.payload.Commit;
import com.hubrelay.webhooks.model.payload.GitUser;

import java.util.ArrayList;
import java.util.List;

/**
 * A push to a branch or tag.
 *
 * <p>{@code size} and {@code distinct_size} are only present in some
 * deliveries; when they are missing the dispatcher derives them from
 * {@link #getCommits()} into a separate {@code PushMetrics}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushEvent extends GitHubEvent {

    @JsonProperty("ref")
    private String ref;

    @JsonProperty("before")
    private String before;

    @JsonProperty("after")
    private String after;

    @JsonProperty("created")
    private boolean created;

    @JsonProperty("deleted")
    private boolean deleted;

    @JsonProperty("forced")
    private boolean forced;

    @JsonProperty("base_ref")
    private String baseRef;

    @JsonProperty("compare")
    private String compare;

    @JsonProperty("commits")
    private List<Commit> commits = new ArrayList<>();

    @JsonProperty("head_commit")
    private Commit headCommit;

    @JsonProperty("pusher")
    private GitUser pusher;

    @JsonProperty("size")
    private Integer size;

    @JsonProperty("distinct_size")
    private Integer distinctSize;

    @Override
    public EventKind getKind() { return EventKind.PUSH; }

    public String getRef()             { return ref; }
    public String getBefore()          { return before; }
    public String getAfter()           { return after; }
    public boolean isCreated()         { return created; }
    public boolean isDeleted()         { return deleted; }
    public boolean isForced()          { return forced; }
    public String getBaseRef()         { return baseRef; }
    public String getCompare()         { return compare; }
    public List<Commit> getCommits()   { return commits; }
    public Commit getHeadCommit()      { return headCommit; }
    public GitUser getPusher()         { return pusher; }
    public Integer getSize()           { return size; }
    public Integer getDistinctSize()   { return distinctSize; }

    public void setRef(String ref)                    { this.ref = ref; }
    public void setBefore(String before)              { this.before = before; }
    public void setAfter(String after)                { this.after = after; }
    public void setCreated(boolean created)           { this.created = created; }
    public void setDeleted(boolean deleted)           { this.deleted = deleted; }
    public void setForced(boolean forced)             { this.forced = forced; }
    public void setBaseRef(String baseRef)            { this.baseRef = baseRef; }
    public void setCompare(String compare)            { this.compare = compare; }
    public void setCommits(List<Commit> commits)      { this.commits = commits != null ? commits : new ArrayList<>(); }
    public void setHeadCommit(Commit headCommit)      { this.headCommit = headCommit; }
    public void setPusher(GitUser pusher)             { this.pusher = pusher; }
    public void setSize(Integer size)                 { this.size = size; }
    public void setDistinctSize(Integer distinctSize) { this.distinctSize = distinctSize; }
}
