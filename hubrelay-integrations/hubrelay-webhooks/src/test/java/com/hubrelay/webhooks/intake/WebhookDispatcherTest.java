package com.hubrelay.webhooks.intake;

import com.hubrelay.webhooks.aggregation.AggregationEngine;
import com.hubrelay.webhooks.handler.DeliveryException;
import com.hubrelay.webhooks.handler.DeliveryHandler;
import com.hubrelay.webhooks.handler.Notification;
import com.hubrelay.webhooks.model.MetaEvent;
import com.hubrelay.webhooks.model.PingEvent;
import com.hubrelay.webhooks.model.PushEvent;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.model.RepositoryEvent;
import com.hubrelay.webhooks.model.action.IssueAction;
import com.hubrelay.webhooks.model.action.MetaAction;
import com.hubrelay.webhooks.model.action.RepositoryAction;
import com.hubrelay.webhooks.model.payload.Repository;
import com.hubrelay.webhooks.security.WebhookSecrets;
import com.hubrelay.webhooks.subscription.InMemorySubscriptionStore;
import com.hubrelay.webhooks.subscription.Subscription;
import com.hubrelay.webhooks.subscription.SubscriptionRegistry;
import com.hubrelay.webhooks.subscription.SubscriptionStore;
import com.hubrelay.webhooks.subscription.SubscriptionStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.hubrelay.webhooks.TestEvents.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("WebhookDispatcher Tests")
@ExtendWith(MockitoExtension.class)
class WebhookDispatcherTest {

    @Mock
    private AggregationEngine engine;

    @Mock
    private DeliveryHandler handler;

    private InMemorySubscriptionStore store;
    private SubscriptionRegistry registry;
    private Subscription subscription;

    @BeforeEach
    void setUp() throws SubscriptionStoreException {
        store = new InMemorySubscriptionStore();
        registry = new SubscriptionRegistry(store, new WebhookSecrets("root-secret"));
        subscription = registry.create(REPOSITORY, "U-owner", "C-general");
    }

    @Nested
    @DisplayName("Lifecycle events")
    class LifecycleTest {

        private WebhookDispatcher dispatcher;

        @BeforeEach
        void setUp() {
            dispatcher = new WebhookDispatcher(registry, handler, engine);
        }

        @Test
        @DisplayName("Should attach the upstream hook id on ping")
        void shouldRecordUpstreamIdOnPing() throws SubscriptionStoreException {
            PingEvent ping = new PingEvent();
            ping.setHookId(4242L);

            dispatcher.handle(ping, "d-1", subscription);

            assertThat(subscription.getUpstreamId()).isEqualTo(4242L);
            assertThat(store.load(subscription.getId()).orElseThrow().getUpstreamId()).isEqualTo(4242L);
            verify(engine).submit(subscription, ping, "d-1", null);
        }

        @Test
        @DisplayName("Should delete the subscription and stop on meta deleted")
        void shouldDeleteOnMetaDeleted() throws SubscriptionStoreException {
            dispatcher.handle(new MetaEvent(MetaAction.DELETED), "d-1", subscription);

            assertThat(registry.get(subscription.getId())).isEmpty();
            verifyNoInteractions(engine, handler);
        }

        @Test
        @DisplayName("Should follow a repository rename")
        void shouldFollowRename() throws SubscriptionStoreException {
            RepositoryEvent renamed = new RepositoryEvent(RepositoryAction.RENAMED);
            renamed.setRepository(new Repository("octo-org/hello-universe"));

            dispatcher.handle(renamed, "d-1", subscription);

            assertThat(subscription.getRepository()).isEqualTo("octo-org/hello-universe");
            assertThat(store.load(subscription.getId()).orElseThrow().getRepository()).isEqualTo("octo-org/hello-universe");
            verify(engine).submit(subscription, renamed, "d-1", null);
        }

        @Test
        @DisplayName("Should delete the subscription but still deliver a repository deletion")
        void shouldDeliverRepositoryDeletion() throws SubscriptionStoreException {
            RepositoryEvent deleted = new RepositoryEvent(RepositoryAction.DELETED);
            deleted.setRepository(new Repository(REPOSITORY));

            dispatcher.handle(deleted, "d-1", subscription);

            assertThat(registry.get(subscription.getId())).isEmpty();
            verify(engine).submit(subscription, deleted, "d-1", null);
        }
    }

    @Nested
    @DisplayName("Push metrics")
    class PushMetricsTest {

        @Test
        @DisplayName("Should count commits when the payload lacks sizes")
        void shouldDeriveMetrics() {
            WebhookDispatcher dispatcher = new WebhookDispatcher(registry, handler, engine);
            PushEvent push = push(3, 2);

            dispatcher.handle(push, "d-1", subscription);

            verify(engine).submit(subscription, push, "d-1", new PushMetrics(3, 2));
        }

        @Test
        @DisplayName("Should trust sizes sent by GitHub")
        void shouldUsePayloadSizes() {
            WebhookDispatcher dispatcher = new WebhookDispatcher(registry, handler, engine);
            PushEvent push = push(1, 1);
            push.setSize(25);
            push.setDistinctSize(20);

            dispatcher.handle(push, "d-1", subscription);

            verify(engine).submit(subscription, push, "d-1", new PushMetrics(25, 20));
        }
    }

    @Nested
    @DisplayName("Aggregation disabled")
    class DisabledTest {

        @Test
        @DisplayName("Should deliver every event on its own")
        void shouldDeliverImmediately() throws DeliveryException {
            WebhookDispatcher dispatcher = new WebhookDispatcher(registry, handler);

            dispatcher.handle(issueLabeled(7, BUG, ALICE), "d-1", subscription);

            ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
            verify(handler).deliver(captor.capture());
            Notification notification = captor.getValue();
            assertThat(notification.getAction()).isEqualTo(IssueAction.LABELED);
            assertThat(notification.getDeliveryIds()).containsExactly("d-1");
            assertThat(notification.getChannelId()).isEqualTo("C-general");
            assertThat(dispatcher.isAggregating()).isFalse();
        }

        @Test
        @DisplayName("Should swallow delivery failures")
        void shouldSwallowDeliveryFailure() throws DeliveryException {
            WebhookDispatcher dispatcher = new WebhookDispatcher(registry, handler);
            doThrow(new DeliveryException("down")).when(handler).deliver(any());

            assertThatCode(() -> dispatcher.handle(push(1, 1), "d-1", subscription)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTest {

        @Test
        @DisplayName("Should still process the event when housekeeping cannot be persisted")
        void shouldContinueAfterStoreFailure() throws SubscriptionStoreException {
            SubscriptionStore failingStore = mock(SubscriptionStore.class);
            Subscription stored = subscription();
            when(failingStore.load(stored.getId())).thenReturn(Optional.of(stored));
            doThrow(new SubscriptionStoreException("db down")).when(failingStore).update(any());
            SubscriptionRegistry failingRegistry = new SubscriptionRegistry(failingStore, new WebhookSecrets("root-secret"));
            Subscription cached = failingRegistry.get(stored.getId()).orElseThrow();
            WebhookDispatcher dispatcher = new WebhookDispatcher(failingRegistry, handler, engine);
            PingEvent ping = new PingEvent();
            ping.setHookId(99L);

            dispatcher.handle(ping, "d-1", cached);

            assertThat(cached.getUpstreamId()).isNull();
            verify(engine).submit(cached, ping, "d-1", null);
        }
    }
}
