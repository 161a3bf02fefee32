package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.hubrelay.webhooks.model.action.RepositoryAction;

/**
 * Repository lifecycle: renames, transfers, visibility changes, deletion.
 *
 * For {@code renamed} the previous name is at {@code changes.repository.name.from};
 * for {@code transferred} the previous owner is under {@code changes.owner.from}.
 * {@link #getRepository()} always describes the repository after the change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepositoryEvent extends GitHubEvent {

    @JsonProperty("action")
    private RepositoryAction action;

    @JsonProperty("changes")
    private JsonNode changes;

    public RepositoryEvent() {}

    public RepositoryEvent(RepositoryAction action) { this.action = action; }

    @Override
    public EventKind getKind() { return EventKind.REPOSITORY; }

    @Override
    public RepositoryAction getAction() { return action; }

    public JsonNode getChanges() { return changes; }

    public void setAction(RepositoryAction action) { this.action = action; }
    public void setChanges(JsonNode changes)       { this.changes = changes; }
}
