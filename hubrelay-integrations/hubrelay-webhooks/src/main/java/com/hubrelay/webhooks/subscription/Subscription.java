package com.hubrelay.webhooks.subscription;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * One binding of an upstream repository's webhook to one destination chat channel.
 *
 * <p>The id and owning user never change.  Repository, channel and upstream
 * hook id are updated by {@link SubscriptionRegistry} in response to
 * lifecycle events; readers on other threads always see the latest value.
 * The webhook secret is not stored here, it is derived on demand
 * (see {@link com.hubrelay.webhooks.security.WebhookSecrets}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Subscription {

    private final UUID   id;
    private final String userId;
    private volatile String repository;
    private volatile String channelId;
    private volatile Long   upstreamId;

    @JsonCreator
    public Subscription(@JsonProperty("id") UUID id,
                        @JsonProperty("repository") String repository,
                        @JsonProperty("userId") String userId,
                        @JsonProperty("channelId") String channelId,
                        @JsonProperty("upstreamId") Long upstreamId) {
        this.id         = Objects.requireNonNull(id, "id");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.userId     = Objects.requireNonNull(userId, "userId");
        this.channelId  = Objects.requireNonNull(channelId, "channelId");
        this.upstreamId = upstreamId;
    }

    @JsonProperty("id")         public UUID   getId()         { return id; }
    @JsonProperty("repository") public String getRepository() { return repository; }
    @JsonProperty("userId")     public String getUserId()     { return userId; }
    @JsonProperty("channelId")  public String getChannelId()  { return channelId; }
    /** GitHub's hook id; {@code null} until the first ping arrives. */
    @JsonProperty("upstreamId") public Long   getUpstreamId() { return upstreamId; }

    void setRepository(String repository) { this.repository = repository; }
    void setChannelId(String channelId)   { this.channelId = channelId; }
    void setUpstreamId(Long upstreamId)   { this.upstreamId = upstreamId; }

    /** Detached copy, used by stores so cached and persisted state never alias. */
    public Subscription copy() {
        return new Subscription(id, repository, userId, channelId, upstreamId);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Subscription other && id.equals(other.id);
    }

    @Override
    public int hashCode() { return id.hashCode(); }

    @Override
    public String toString() {
        return "subscription " + id + " (GH" + upstreamId + ") from " + repository +
               " to " + channelId + " added by " + userId;
    }
}
