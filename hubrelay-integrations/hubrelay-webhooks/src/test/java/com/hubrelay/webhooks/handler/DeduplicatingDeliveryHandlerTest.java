package com.hubrelay.webhooks.handler;

import com.hubrelay.webhooks.model.action.IssueAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.hubrelay.webhooks.TestEvents.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("DeduplicatingDeliveryHandler Tests")
@ExtendWith(MockitoExtension.class)
class DeduplicatingDeliveryHandlerTest {

    @Mock
    private DeliveryHandler delegate;

    private DeduplicatingDeliveryHandler handler;

    private final UUID subscriptionId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        handler = new DeduplicatingDeliveryHandler(delegate, 3);
    }

    private Notification notification(String... deliveryIds) {
        return new Notification(subscriptionId, "C-general", issueLabeled(7, BUG, ALICE), IssueAction.LABELED,
                null, null, new LinkedHashSet<>(List.of(deliveryIds)));
    }

    @Nested
    @DisplayName("Redelivery")
    class RedeliveryTest {

        @Test
        @DisplayName("Should pass a new delivery through")
        void shouldPassNewDelivery() throws DeliveryException {
            Notification notification = notification("d-1");

            handler.deliver(notification);

            verify(delegate).deliver(notification);
            assertThat(handler.rememberedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should drop a delivery id seen before")
        void shouldDropRedelivery() throws DeliveryException {
            handler.deliver(notification("d-1"));
            handler.deliver(notification("d-1"));

            verify(delegate, times(1)).deliver(any());
        }

        @Test
        @DisplayName("Should pass an aggregate that contains at least one new id")
        void shouldPassPartiallyNewAggregate() throws DeliveryException {
            handler.deliver(notification("d-1"));
            handler.deliver(notification("d-1", "d-2"));

            verify(delegate, times(2)).deliver(any());
        }

        @Test
        @DisplayName("Should forget the oldest ids beyond capacity")
        void shouldEvictOldestIds() throws DeliveryException {
            handler.deliver(notification("d-1"));
            handler.deliver(notification("d-2", "d-3", "d-4"));
            handler.deliver(notification("d-1"));

            verify(delegate, times(3)).deliver(any());
            assertThat(handler.rememberedCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTest {

        @Test
        @DisplayName("Should not remember ids of a failed delivery")
        void shouldAllowRetryAfterFailure() throws DeliveryException {
            doThrow(new DeliveryException("down")).doNothing().when(delegate).deliver(any());

            assertThatThrownBy(() -> handler.deliver(notification("d-1")))
                    .isInstanceOf(DeliveryException.class)
                    .hasMessage("down");
            handler.deliver(notification("d-1"));

            verify(delegate, times(2)).deliver(any());
            assertThat(handler.rememberedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject a non-positive capacity")
        void shouldRejectInvalidCapacity() {
            assertThatThrownBy(() -> new DeduplicatingDeliveryHandler(delegate, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Concurrent redelivery")
    class ConcurrencyTest {

        @Test
        @DisplayName("Should relay a delivery id only once while the first copy is in flight")
        void shouldRelayInFlightDuplicateOnce() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            DeduplicatingDeliveryHandler slow = new DeduplicatingDeliveryHandler(n -> {
                calls.incrementAndGet();
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> first = executor.submit(() -> {
                    slow.deliver(notification("d-1"));
                    return null;
                });
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

                slow.deliver(notification("d-1"));
                release.countDown();
                first.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertThat(calls).hasValue(1);
            assertThat(slow.rememberedCount()).isEqualTo(1);
        }
    }
}
