package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hubrelay.webhooks.model.action.EventAction;
import com.hubrelay.webhooks.model.payload.Repository;
import com.hubrelay.webhooks.model.payload.User;

/**
 * Common envelope of every GitHub webhook payload the relay understands.
 *
 * <p>There is exactly one subclass per {@link EventKind}; the constructor is
 * package-private so the set of variants cannot grow outside this package.
 * Unknown fields are silently ignored so that new GitHub additions do not
 * break decoding.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class GitHubEvent {

    /** The account that triggered the event. */
    @JsonProperty("sender")
    private User sender;

    /** Absent only for organisation-level hooks. */
    @JsonProperty("repository")
    private Repository repository;

    GitHubEvent() {}

    /** Discriminant of this variant. */
    @JsonIgnore
    public abstract EventKind getKind();

    /**
     * The kind-specific action, or {@code null} for kinds GitHub sends
     * without one (push, fork, ping, ...).
     */
    public EventAction getAction() { return null; }

    /**
     * Number of the issue or pull request this event concerns, or {@code null}
     * if the event is not about one.
     */
    @JsonIgnore
    public Integer getSubjectNumber() { return null; }

    /** Id of {@link #getSender()}, or {@code null} when GitHub sent none. */
    @JsonIgnore
    public Long getSenderId() { return sender != null ? sender.getId() : null; }

    public User getSender()             { return sender; }
    public Repository getRepository()   { return repository; }

    public void setSender(User sender)                 { this.sender = sender; }
    public void setRepository(Repository repository)   { this.repository = repository; }

    @Override
    public String toString() {
        EventAction action = getAction();
        return getClass().getSimpleName() + "{kind=" + getKind() +
               (action != null ? ", action=" + action.value() : "") +
               (getSubjectNumber() != null ? ", subject=#" + getSubjectNumber() : "") +
               ", repository=" + (repository != null ? repository.getFullName() : null) + '}';
    }
}
