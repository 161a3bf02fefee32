package com.hubrelay.webhooks.subscription;

import com.hubrelay.webhooks.security.WebhookSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe cache of {@link Subscription}s in front of a {@link SubscriptionStore}.
 *
 * <p>The registry is the only component that mutates subscriptions.  Every
 * update is written to the store on a detached copy first and applied to the
 * cached instance only once that write succeeded, so request decoding and
 * pending aggregations never see a state the store refused.
 *
 * <p>Deleted ids are remembered for the life of the process.  A store read
 * that raced a delete never puts the subscription back into the cache.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final SubscriptionStore store;
    private final WebhookSecrets    secrets;

    private final Map<UUID, Subscription> cache   = new ConcurrentHashMap<>();
    private final Set<UUID>               deleted = ConcurrentHashMap.newKeySet();

    public SubscriptionRegistry(SubscriptionStore store, WebhookSecrets secrets) {
        this.store = store;
        this.secrets = secrets;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Registers a new subscription of {@code repository} into {@code channelId}.
     *
     * @throws DuplicateSubscriptionException if the channel already follows the repository
     */
    public Subscription create(String repository, String userId, String channelId) throws SubscriptionStoreException {
        if (store.findByRepositoryAndChannel(repository, channelId).isPresent()) {
            throw new DuplicateSubscriptionException(repository, channelId);
        }
        Subscription subscription = new Subscription(UUID.randomUUID(), repository, userId, channelId, null);
        store.insert(subscription);
        cache.put(subscription.getId(), subscription);
        log.info("Created {}", subscription);
        return subscription;
    }

    /**
     * Looks a subscription up in the cache, falling back to the store.
     */
    public Optional<Subscription> get(UUID id) throws SubscriptionStoreException {
        Subscription cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (deleted.contains(id)) {
            return Optional.empty();
        }
        return store.load(id).flatMap(this::cacheLoaded);
    }

    public Optional<Subscription> find(String repository, String channelId) throws SubscriptionStoreException {
        return store.findByRepositoryAndChannel(repository, channelId).flatMap(this::cacheLoaded);
    }

    public List<Subscription> findAllForChannel(String channelId) throws SubscriptionStoreException {
        return store.findByChannel(channelId).stream()
                .flatMap(s -> cacheLoaded(s).stream())
                .toList();
    }

    /**
     * Caches a subscription read from the store.  A concurrent load of the same
     * id must not replace an instance already handed out, and a delete that ran
     * while the store was read wins.
     */
    private Optional<Subscription> cacheLoaded(Subscription loaded) {
        UUID id = loaded.getId();
        Subscription cached = cache.computeIfAbsent(id, k -> loaded);
        // delete() tombstones before it unmaps, so one of the two sees the other
        if (deleted.contains(id)) {
            cache.remove(id, cached);
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    /** The secret GitHub signs deliveries for {@code subscription} with. */
    public String secretFor(Subscription subscription) {
        return secrets.secretFor(subscription.getId(), subscription.getUserId());
    }

    // ------------------------------------------------------------------
    // Lifecycle updates
    // ------------------------------------------------------------------

    /** Records GitHub's hook id, learned from the first {@code ping}. */
    public void setUpstreamId(Subscription subscription, long upstreamId) throws SubscriptionStoreException {
        Subscription updated = subscription.copy();
        updated.setUpstreamId(upstreamId);
        store.update(updated);
        subscription.setUpstreamId(upstreamId);
        log.info("Attached upstream hook id {} to subscription {}", upstreamId, subscription.getId());
    }

    /** Follows a repository rename or transfer to {@code newRepository} ("owner/name"). */
    public void transfer(Subscription subscription, String newRepository) throws SubscriptionStoreException {
        String previous = subscription.getRepository();
        Subscription updated = subscription.copy();
        updated.setRepository(newRepository);
        store.update(updated);
        subscription.setRepository(newRepository);
        log.info("Subscription {} moved from {} to {}", subscription.getId(), previous, newRepository);
    }

    /**
     * Points every subscription of {@code oldChannelId} at its replacement channel.
     * Subscriptions whose store write fails keep their old channel; the first
     * failure is rethrown once every subscription was tried.
     *
     * @return the number of subscriptions moved
     */
    public int migrateChannel(String oldChannelId, String newChannelId) throws SubscriptionStoreException {
        List<Subscription> affected = findAllForChannel(oldChannelId);
        SubscriptionStoreException failure = null;
        int moved = 0;
        for (Subscription subscription : affected) {
            Subscription updated = subscription.copy();
            updated.setChannelId(newChannelId);
            try {
                store.update(updated);
                subscription.setChannelId(newChannelId);
                moved++;
            } catch (SubscriptionStoreException e) {
                log.error("Failed to persist channel migration of subscription {}", subscription.getId(), e);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        log.info("Migrated {} of {} subscription(s) from channel {} to {}",
                moved, affected.size(), oldChannelId, newChannelId);
        if (failure != null) {
            throw failure;
        }
        return moved;
    }

    /**
     * Removes a subscription from the cache and the store.  The id stays
     * unknown to this registry even when the store delete fails.
     */
    public void delete(UUID id) throws SubscriptionStoreException {
        deleted.add(id);
        Subscription removed = cache.remove(id);
        log.info("Deleted subscription {}{}", id, removed != null ? " (" + removed.getRepository() + ")" : "");
        store.delete(id);
    }

    /** Number of subscriptions currently cached. */
    public int cachedCount() { return cache.size(); }
}
