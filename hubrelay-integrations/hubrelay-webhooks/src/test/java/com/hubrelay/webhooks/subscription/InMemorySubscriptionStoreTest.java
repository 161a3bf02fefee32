package com.hubrelay.webhooks.subscription;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemorySubscriptionStore Tests")
class InMemorySubscriptionStoreTest {

    private InMemorySubscriptionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySubscriptionStore();
    }

    private static Subscription subscription(String repository, String channelId) {
        return new Subscription(UUID.randomUUID(), repository, "U-owner", channelId, null);
    }

    @Nested
    @DisplayName("Queries")
    class QueryTest {

        @Test
        @DisplayName("Should find rows by id, pair and channel")
        void shouldFindRows() throws SubscriptionStoreException {
            Subscription first = subscription("octo/a", "C-1");
            Subscription second = subscription("octo/b", "C-1");
            Subscription third = subscription("octo/a", "C-2");
            store.insert(first);
            store.insert(second);
            store.insert(third);

            assertThat(store.load(first.getId())).contains(first);
            assertThat(store.findByRepositoryAndChannel("octo/a", "C-2")).contains(third);
            assertThat(store.findByRepositoryAndChannel("octo/b", "C-2")).isEmpty();
            assertThat(store.findByChannel("C-1")).containsExactly(first, second);
        }

        @Test
        @DisplayName("Should hand out detached copies")
        void shouldReturnCopies() throws SubscriptionStoreException {
            Subscription original = subscription("octo/a", "C-1");
            store.insert(original);

            Subscription loaded = store.load(original.getId()).orElseThrow();
            loaded.setChannelId("C-changed");

            assertThat(loaded).isNotSameAs(original);
            assertThat(store.load(original.getId()).orElseThrow().getChannelId()).isEqualTo("C-1");
        }
    }

    @Nested
    @DisplayName("Mutations")
    class MutationTest {

        @Test
        @DisplayName("Should reject a second subscription of the same repository and channel")
        void shouldRejectDuplicatePair() throws SubscriptionStoreException {
            store.insert(subscription("octo/a", "C-1"));

            assertThatThrownBy(() -> store.insert(subscription("octo/a", "C-1")))
                    .isInstanceOf(DuplicateSubscriptionException.class);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should update and delete rows")
        void shouldUpdateAndDelete() throws SubscriptionStoreException {
            Subscription subscription = subscription("octo/a", "C-1");
            store.insert(subscription);

            subscription.setRepository("octo/renamed");
            store.update(subscription);
            assertThat(store.load(subscription.getId()).orElseThrow().getRepository()).isEqualTo("octo/renamed");

            store.delete(subscription.getId());
            assertThat(store.load(subscription.getId())).isEmpty();
        }

        @Test
        @DisplayName("Should ignore updates and deletes of unknown rows")
        void shouldIgnoreUnknownRows() throws SubscriptionStoreException {
            Subscription unknown = subscription("octo/a", "C-1");

            store.update(unknown);
            store.delete(unknown.getId());

            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("Should roll back when the write hook fails")
        void shouldRollBackFailedWrite() throws SubscriptionStoreException {
            Subscription kept = subscription("octo/a", "C-1");
            store.insert(kept);
            InMemorySubscriptionStore failing = new InMemorySubscriptionStore() {
                @Override
                protected void written() throws SubscriptionStoreException {
                    throw new SubscriptionStoreException("disk full");
                }
            };

            assertThatThrownBy(() -> failing.insert(kept)).hasMessage("disk full");
            assertThat(failing.size()).isZero();
        }
    }
}
