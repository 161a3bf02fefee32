package com.hubrelay.webhooks.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GitHub webhook event kinds understood by the relay.
 *
 * Each constant carries the string GitHub places in the {@code X-GitHub-Event}
 * header and the payload class the request body is bound to.  Header values
 * that do not appear here are acknowledged but never processed.
 */
public enum EventKind {

    // ---------------------------------------------------------------
    // Hook lifecycle
    // ---------------------------------------------------------------
    PING("ping", PingEvent.class, "hook_id"),
    META("meta", MetaEvent.class, "action", "hook_id"),

    // ---------------------------------------------------------------
    // Repository
    // ---------------------------------------------------------------
    REPOSITORY("repository", RepositoryEvent.class, "action", "repository"),
    PUSH("push", PushEvent.class, "ref", "commits"),
    CREATE("create", CreateEvent.class, "ref", "ref_type"),
    DELETE("delete", DeleteEvent.class, "ref", "ref_type"),
    RELEASE("release", ReleaseEvent.class, "action", "release"),
    STAR("star", StarEvent.class, "action"),
    WATCH("watch", WatchEvent.class, "action"),
    FORK("fork", ForkEvent.class, "forkee"),
    GOLLUM("gollum", GollumEvent.class, "pages"),

    // ---------------------------------------------------------------
    // Issues and pull requests
    // ---------------------------------------------------------------
    ISSUES("issues", IssuesEvent.class, "action", "issue"),
    ISSUE_COMMENT("issue_comment", IssueCommentEvent.class, "action", "issue", "comment"),
    PULL_REQUEST("pull_request", PullRequestEvent.class, "action", "pull_request"),
    PULL_REQUEST_REVIEW("pull_request_review", PullRequestReviewEvent.class, "action", "review", "pull_request"),
    PULL_REQUEST_REVIEW_COMMENT("pull_request_review_comment", PullRequestReviewCommentEvent.class, "action", "comment", "pull_request"),
    MILESTONE("milestone", MilestoneEvent.class, "action", "milestone"),
    LABEL("label", LabelEvent.class, "action", "label");

    private static final Map<String, EventKind> BY_HEADER;

    static {
        Map<String, EventKind> byHeader = new HashMap<>();
        for (EventKind kind : values()) {
            byHeader.put(kind.headerValue, kind);
        }
        BY_HEADER = Collections.unmodifiableMap(byHeader);
    }

    private final String headerValue;
    private final Class<? extends GitHubEvent> payloadType;
    private final List<String> requiredFields;

    EventKind(String headerValue, Class<? extends GitHubEvent> payloadType, String... requiredFields) {
        this.headerValue = headerValue;
        this.payloadType = payloadType;
        this.requiredFields = List.of(requiredFields);
    }

    public String getHeaderValue()                       { return headerValue; }
    public Class<? extends GitHubEvent> getPayloadType() { return payloadType; }
    /** Top-level JSON fields a payload of this kind must carry to be processed. */
    public List<String> getRequiredFields()              { return requiredFields; }

    /**
     * Resolves the value of an {@code X-GitHub-Event} header.
     *
     * @return the matching kind, or empty if the relay does not know it
     */
    public static Optional<EventKind> fromHeader(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_HEADER.get(headerValue.trim()));
    }

    @Override
    public String toString() { return headerValue; }
}
