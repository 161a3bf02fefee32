package com.hubrelay.webhooks.subscription;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SubscriptionStore} held in process memory.
 *
 * <p>Nothing survives a restart; useful for tests and for deployments where
 * subscriptions are provisioned on start-up.  {@link JsonFileSubscriptionStore}
 * builds on this class and adds a file snapshot after every write.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {

    private final Map<UUID, Subscription> rows = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Subscription> load(UUID id) {
        Subscription row = rows.get(id);
        return row != null ? Optional.of(row.copy()) : Optional.empty();
    }

    @Override
    public synchronized Optional<Subscription> findByRepositoryAndChannel(String repository, String channelId) {
        return rows.values().stream()
                .filter(s -> s.getRepository().equals(repository) && s.getChannelId().equals(channelId))
                .findFirst()
                .map(Subscription::copy);
    }

    @Override
    public synchronized List<Subscription> findByChannel(String channelId) {
        return rows.values().stream()
                .filter(s -> s.getChannelId().equals(channelId))
                .map(Subscription::copy)
                .toList();
    }

    @Override
    public synchronized void insert(Subscription subscription) throws SubscriptionStoreException {
        if (rows.containsKey(subscription.getId())) {
            throw new SubscriptionStoreException("Subscription id already in use: " + subscription.getId());
        }
        requireUniquePair(subscription);
        rows.put(subscription.getId(), subscription.copy());
        try {
            written();
        } catch (SubscriptionStoreException e) {
            rows.remove(subscription.getId());
            throw e;
        }
    }

    @Override
    public synchronized void update(Subscription subscription) throws SubscriptionStoreException {
        if (!rows.containsKey(subscription.getId())) {
            return;
        }
        requireUniquePair(subscription);
        Subscription previous = rows.put(subscription.getId(), subscription.copy());
        try {
            written();
        } catch (SubscriptionStoreException e) {
            rows.put(subscription.getId(), previous);
            throw e;
        }
    }

    @Override
    public synchronized void delete(UUID id) throws SubscriptionStoreException {
        Subscription removed = rows.remove(id);
        if (removed == null) {
            return;
        }
        try {
            written();
        } catch (SubscriptionStoreException e) {
            rows.put(id, removed);
            throw e;
        }
    }

    /** Number of stored subscriptions. */
    public synchronized int size() { return rows.size(); }

    /** Snapshot of every row, in insertion order. */
    protected synchronized List<Subscription> snapshot() {
        Collection<Subscription> values = rows.values();
        List<Subscription> copy = new ArrayList<>(values.size());
        for (Subscription row : values) {
            copy.add(row.copy());
        }
        return copy;
    }

    /** Replaces every row, used when loading persisted state. */
    protected synchronized void replaceAll(List<Subscription> loaded) {
        rows.clear();
        for (Subscription row : loaded) {
            rows.put(row.getId(), row.copy());
        }
    }

    /**
     * Hook invoked while still holding the store lock after each mutation.
     * A failure rolls the mutation back and is reported to its caller.
     */
    protected void written() throws SubscriptionStoreException {
    }

    private void requireUniquePair(Subscription subscription) throws DuplicateSubscriptionException {
        for (Subscription row : rows.values()) {
            if (!row.getId().equals(subscription.getId())
                    && row.getRepository().equals(subscription.getRepository())
                    && row.getChannelId().equals(subscription.getChannelId())) {
                throw new DuplicateSubscriptionException(subscription.getRepository(), subscription.getChannelId());
            }
        }
    }
}
