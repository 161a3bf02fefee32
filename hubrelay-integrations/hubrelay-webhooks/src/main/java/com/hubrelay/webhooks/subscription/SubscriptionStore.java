package com.hubrelay.webhooks.subscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SPI for the durable side of subscription state.
 *
 * <p>Implementations cover process memory ({@link InMemorySubscriptionStore})
 * and a local JSON file ({@link JsonFileSubscriptionStore}).  The store is
 * the source of truth on restart; {@link SubscriptionRegistry} keeps the
 * in-process cache in front of it.
 *
 * <p>Implementations must be thread-safe and must never hand out instances
 * that the caller could mutate behind the store's back.
 */
public interface SubscriptionStore {

    Optional<Subscription> load(UUID id) throws SubscriptionStoreException;

    Optional<Subscription> findByRepositoryAndChannel(String repository, String channelId)
            throws SubscriptionStoreException;

    List<Subscription> findByChannel(String channelId) throws SubscriptionStoreException;

    /**
     * Persists a new subscription.
     *
     * @throws DuplicateSubscriptionException if the id or the (repository, channel) pair is taken
     */
    void insert(Subscription subscription) throws SubscriptionStoreException;

    /**
     * Overwrites the mutable fields of an existing subscription.  Updating an
     * unknown id is a no-op.
     */
    void update(Subscription subscription) throws SubscriptionStoreException;

    /** Removes a subscription; removing an unknown id is a no-op. */
    void delete(UUID id) throws SubscriptionStoreException;
}
