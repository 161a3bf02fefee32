package com.hubrelay.webhooks.aggregation;

import com.hubrelay.webhooks.handler.DeliveryException;
import com.hubrelay.webhooks.handler.Notification;
import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.PushMetrics;
import com.hubrelay.webhooks.model.action.CommentAction;
import com.hubrelay.webhooks.model.action.IssueAction;
import com.hubrelay.webhooks.model.action.PullRequestAction;
import com.hubrelay.webhooks.security.WebhookSecrets;
import com.hubrelay.webhooks.subscription.InMemorySubscriptionStore;
import com.hubrelay.webhooks.subscription.Subscription;
import com.hubrelay.webhooks.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.hubrelay.webhooks.TestEvents.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("AggregationEngine Tests")
class AggregationEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private ManualDeadlineScheduler scheduler;
    private List<Notification> delivered;
    private AggregationEngine engine;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        scheduler = new ManualDeadlineScheduler();
        delivered = new CopyOnWriteArrayList<>();
        engine = new AggregationEngine(scheduler, TIMEOUT, delivered::add, Runnable::run);
        subscription = subscription();
    }

    private void advance(long millis) {
        scheduler.advance(Duration.ofMillis(millis));
    }

    @Nested
    @DisplayName("Events without a policy")
    class SoloTest {

        @Test
        @DisplayName("Should deliver a push immediately with its metrics")
        void shouldDeliverPushImmediately() {
            engine.submit(subscription, push(3, 2), "d-1", new PushMetrics(3, 2));

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getKind()).isEqualTo(EventKind.PUSH);
            assertThat(notification.getPushMetrics()).isEqualTo(new PushMetrics(3, 2));
            assertThat(notification.getDeliveryIds()).containsExactly("d-1");
            assertThat(notification.getChannelId()).isEqualTo("C-general");
            assertThat(engine.pendingCount(subscription.getId())).isZero();
            assertThat(scheduler.armedTimers()).isZero();
        }

        @Test
        @DisplayName("Should deliver unmapped actions of aggregatable kinds immediately")
        void shouldDeliverUnmappedActionImmediately() {
            engine.submit(subscription, issue(IssueAction.ASSIGNED, 7, ALICE), "d-1", null);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getAction()).isEqualTo(IssueAction.ASSIGNED);
        }

        @Test
        @DisplayName("Should not let unrelated events join a pending aggregation")
        void shouldNotAbsorbUnrelatedEvents() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(subscription, push(1, 1), "d-2", new PushMetrics(1, 1));

            assertThat(delivered).extracting(Notification::getKind).containsExactly(EventKind.PUSH);
            assertThat(engine.pendingCount(subscription.getId())).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTest {

        @Test
        @DisplayName("Should flush exactly when the timeout elapses")
        void shouldFlushAtDeadline() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);

            advance(999);
            assertThat(delivered).isEmpty();

            advance(1);
            assertThat(delivered).hasSize(1);
            assertThat(engine.pendingCount(subscription.getId())).isZero();
        }

        @Test
        @DisplayName("Should push the deadline back on a resetting merge")
        void shouldResetDeadlineOnMerge() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            advance(600);
            engine.submit(subscription, issueLabeled(7, UI, ALICE), "d-2", null);

            advance(600);
            assertThat(delivered).isEmpty();

            advance(399);
            assertThat(delivered).isEmpty();

            advance(1);
            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getDeliveryIds()).containsExactly("d-1", "d-2");
        }

        @Test
        @DisplayName("Should start a new aggregation once the previous one flushed")
        void shouldNotMergeIntoFlushedAggregation() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            advance(1000);
            engine.submit(subscription, issueLabeled(7, UI, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered.get(0).getDeliveryIds()).containsExactly("d-1");
            assertThat(delivered.get(0).getAccumulator().getAddedLabels()).containsExactly(BUG);
            assertThat(delivered.get(1).getDeliveryIds()).containsExactly("d-2");
        }
    }

    @Nested
    @DisplayName("Label aggregation")
    class LabelTest {

        @Test
        @DisplayName("Should cancel a label added and removed in the same window")
        void shouldCancelAddedThenRemovedLabel() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(subscription, issueUnlabeled(7, BUG, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getAction()).isEqualTo(IssueAction.LABELS_CHANGED);
            assertThat(notification.getAccumulator().getAddedLabels()).isEmpty();
            assertThat(notification.getAccumulator().getRemovedLabels()).containsExactly(BUG);
            assertThat(notification.getDeliveryIds()).containsExactly("d-1", "d-2");
        }

        @Test
        @DisplayName("Should collect several labels in arrival order")
        void shouldCollectSeveralLabels() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(subscription, issueLabeled(7, UI, BOB), "d-2", null);
            engine.submit(subscription, issueUnlabeled(7, DOCS, ALICE), "d-3", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getAccumulator().getAddedLabels()).containsExactly(BUG, UI);
            assertThat(delivered.get(0).getAccumulator().getRemovedLabels()).containsExactly(DOCS);
        }

        @Test
        @DisplayName("Should keep label changes of different issues apart")
        void shouldSeparateSubjects() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(subscription, issueLabeled(8, BUG, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered).extracting(n -> n.getEvent().getSubjectNumber()).containsExactly(7, 8);
        }

        @Test
        @DisplayName("Should switch pull request label bursts to the pull request pseudo-action")
        void shouldAggregatePullRequestLabels() {
            engine.submit(subscription, pullRequest(PullRequestAction.LABELED, 3, BUG, ALICE), "d-1", null);
            engine.submit(subscription, pullRequest(PullRequestAction.LABELED, 3, UI, ALICE), "d-2", null);
            // same number on an issue is a different subject
            engine.submit(subscription, issueLabeled(3, DOCS, ALICE), "d-3", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered.get(0).getAction()).isEqualTo(PullRequestAction.LABELS_CHANGED);
            assertThat(delivered.get(0).getAccumulator().getAddedLabels()).containsExactly(BUG, UI);
            assertThat(delivered.get(1).getAction()).isEqualTo(IssueAction.LABELS_CHANGED);
        }
    }

    @Nested
    @DisplayName("Open label dropping")
    class OpenLabelTest {

        @Test
        @DisplayName("Should swallow the labeled events that follow an opened issue")
        void shouldSwallowInitialLabels() {
            engine.submit(subscription, issueOpened(7, ALICE, BUG, UI), "d-1", null);
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-2", null);
            engine.submit(subscription, issueLabeled(7, UI, ALICE), "d-3", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getAction()).isEqualTo(IssueAction.OPENED);
            assertThat(notification.getAccumulator().getAddedLabels()).isEmpty();
            assertThat(notification.getDeliveryIds()).containsExactly("d-1", "d-2", "d-3");
        }

        @Test
        @DisplayName("Should report labels the issue was not opened with")
        void shouldReportNewLabels() {
            engine.submit(subscription, issueOpened(7, ALICE, BUG), "d-1", null);
            engine.submit(subscription, issueLabeled(7, DOCS, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered.get(0).getAction()).isEqualTo(IssueAction.OPENED);
            assertThat(delivered.get(1).getAction()).isEqualTo(IssueAction.LABELS_CHANGED);
            assertThat(delivered.get(1).getAccumulator().getAddedLabels()).containsExactly(DOCS);
        }
    }

    @Nested
    @DisplayName("Milestone aggregation")
    class MilestoneTest {

        @Test
        @DisplayName("Should pair demilestoned and milestoned into one change")
        void shouldPairMilestoneChange() {
            engine.submit(subscription, issueDemilestoned(7, V1, ALICE), "d-1", null);
            engine.submit(subscription, issueMilestoned(7, V2, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getAction()).isEqualTo(IssueAction.MILESTONE_CHANGED);
            assertThat(notification.getAccumulator().getMilestoneFrom()).isSameAs(V1);
            assertThat(notification.getAccumulator().getMilestoneTo()).isSameAs(V2);
        }

        @Test
        @DisplayName("Should keep the original deadline when the pair completes")
        void shouldNotResetDeadline() {
            engine.submit(subscription, issueMilestoned(7, V2, ALICE), "d-1", null);
            advance(800);
            engine.submit(subscription, issueDemilestoned(7, V1, ALICE), "d-2", null);

            advance(200);
            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getAction()).isEqualTo(IssueAction.MILESTONE_CHANGED);
        }

        @Test
        @DisplayName("Should reject a repeat of the same action")
        void shouldRejectRepeatedAction() {
            engine.submit(subscription, issueMilestoned(7, V1, ALICE), "d-1", null);
            engine.submit(subscription, issueMilestoned(7, V2, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered).extracting(Notification::getAction)
                    .containsExactly(IssueAction.MILESTONED, IssueAction.MILESTONED);
        }

        @Test
        @DisplayName("Should count a slot filled without a milestone object as filled")
        void shouldRejectRepeatAfterMissingMilestone() {
            engine.submit(subscription, issueMilestoned(7, null, ALICE), "d-1", null);
            engine.submit(subscription, issueMilestoned(7, V2, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered).extracting(Notification::getDeliveryIds)
                    .containsExactly(Set.of("d-1"), Set.of("d-2"));
        }
    }

    @Nested
    @DisplayName("State and comment coupling")
    class StateCommentTest {

        @Test
        @DisplayName("Should fold a close into the comment posted with it")
        void shouldFoldCloseIntoComment() {
            engine.submit(subscription, commentCreated(5, ALICE), "d-1", null);
            engine.submit(subscription, issue(IssueAction.CLOSED, 5, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getKind()).isEqualTo(EventKind.ISSUE_COMMENT);
            assertThat(notification.getAction()).isEqualTo(CommentAction.CREATED);
            assertThat(notification.getAccumulator().isClosed()).isTrue();
            assertThat(notification.getAccumulator().isReopened()).isFalse();
        }

        @Test
        @DisplayName("Should replace a close with the comment that follows it")
        void shouldReplaceCloseWithComment() {
            engine.submit(subscription, issue(IssueAction.CLOSED, 5, ALICE), "d-1", null);
            engine.submit(subscription, commentCreated(5, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            Notification notification = delivered.get(0);
            assertThat(notification.getKind()).isEqualTo(EventKind.ISSUE_COMMENT);
            assertThat(notification.getAccumulator().isClosed()).isTrue();
            assertThat(notification.getDeliveryIds()).containsExactly("d-1", "d-2");
        }

        @Test
        @DisplayName("Should carry the reopened flag when a reopen precedes the comment")
        void shouldCarryReopenedFlag() {
            engine.submit(subscription, issue(IssueAction.REOPENED, 5, ALICE), "d-1", null);
            engine.submit(subscription, commentCreated(5, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getAccumulator().isReopened()).isTrue();
            assertThat(delivered.get(0).getAccumulator().isClosed()).isFalse();
        }

        @Test
        @DisplayName("Should not couple events of different senders")
        void shouldRequireSameSender() {
            engine.submit(subscription, commentCreated(5, ALICE), "d-1", null);
            engine.submit(subscription, issue(IssueAction.CLOSED, 5, BOB), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered.get(0).getAccumulator().isClosed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Queue semantics")
    class QueueTest {

        @Test
        @DisplayName("Should offer events to the oldest aggregation first")
        void shouldPreferOldestAggregation() {
            engine.submit(subscription, issueOpened(7, ALICE, BUG), "d-1", null);
            engine.submit(subscription, issueUnlabeled(7, BUG, ALICE), "d-2", null);
            // both pending aggregations would accept this one
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-3", null);
            assertThat(engine.pendingCount(subscription.getId())).isEqualTo(2);

            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered.get(0).getAction()).isEqualTo(IssueAction.OPENED);
            assertThat(delivered.get(0).getDeliveryIds()).containsExactly("d-1", "d-3");
            assertThat(delivered.get(1).getAccumulator().getRemovedLabels()).containsExactly(BUG);
            assertThat(delivered.get(1).getAccumulator().getAddedLabels()).isEmpty();
            assertThat(delivered.get(1).getDeliveryIds()).containsExactly("d-2");
        }

        @Test
        @DisplayName("Should keep subscriptions isolated")
        void shouldIsolateSubscriptions() {
            Subscription other = subscription("C-random");
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(other, issueLabeled(7, UI, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(2);
            assertThat(delivered).extracting(Notification::getChannelId).containsExactly("C-general", "C-random");
            assertThat(delivered.get(0).getAccumulator().getAddedLabels()).containsExactly(BUG);
            assertThat(delivered.get(1).getAccumulator().getAddedLabels()).containsExactly(UI);
        }

        @Test
        @DisplayName("Should read the destination channel at flush time")
        void shouldUseChannelAtFlushTime() throws Exception {
            SubscriptionRegistry registry = new SubscriptionRegistry(new InMemorySubscriptionStore(),
                    new WebhookSecrets("root"));
            Subscription registered = registry.create(REPOSITORY, "U-owner", "C-old");

            engine.submit(registered, issueLabeled(7, BUG, ALICE), "d-1", null);
            registry.migrateChannel("C-old", "C-new");
            advance(1000);

            assertThat(delivered).extracting(Notification::getChannelId).containsExactly("C-new");
        }
    }

    @Nested
    @DisplayName("Failures and shutdown")
    class FailureTest {

        @Test
        @DisplayName("Should abandon an aggregation whose starter fails")
        void shouldAbandonFailedStart() {
            // labeled without a label cannot be seeded
            engine.submit(subscription, issueLabeled(7, null, ALICE), "d-1", null);
            engine.submit(subscription, issueLabeled(8, BUG, ALICE), "d-2", null);
            advance(1000);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getDeliveryIds()).containsExactly("d-2");
        }

        @Test
        @DisplayName("Should survive a failing delivery handler")
        void shouldSurviveDeliveryFailure() {
            List<Notification> attempts = new CopyOnWriteArrayList<>();
            AggregationEngine failing = new AggregationEngine(scheduler, TIMEOUT, n -> {
                attempts.add(n);
                throw new DeliveryException("chat platform unavailable");
            }, Runnable::run);

            failing.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            assertThatCode(() -> advance(1000)).doesNotThrowAnyException();
            failing.submit(subscription, push(1, 1), "d-2", new PushMetrics(1, 1));

            assertThat(attempts).hasSize(2);
        }

        @Test
        @DisplayName("Should flush pending aggregations on shutdown")
        void shouldFlushOnShutdown() {
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);
            engine.submit(subscription(), issueMilestoned(3, V1, ALICE), "d-2", null);

            int flushed = engine.shutdown();

            assertThat(flushed).isEqualTo(2);
            assertThat(delivered).hasSize(2);
            assertThat(engine.activeSubscriptions()).isZero();

            // armed timers find nothing left to flush
            advance(1000);
            assertThat(delivered).hasSize(2);
        }

        @Test
        @DisplayName("Should deliver directly after shutdown")
        void shouldDeliverDirectlyAfterShutdown() {
            engine.shutdown();
            engine.submit(subscription, issueLabeled(7, BUG, ALICE), "d-1", null);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getAction()).isEqualTo(IssueAction.LABELED);
        }

        @Test
        @DisplayName("Should deliver an event whose submit overlaps shutdown")
        void shouldDeliverSubmitOverlappingShutdown() {
            AtomicBoolean shutDownOnLookup = new AtomicBoolean();
            // the queue key is read after the shutdown check and before the queue lock
            Subscription racing = new Subscription(UUID.randomUUID(), REPOSITORY, "U-owner", "C-general", null) {
                @Override
                public UUID getId() {
                    if (shutDownOnLookup.compareAndSet(true, false)) {
                        engine.shutdown();
                    }
                    return super.getId();
                }
            };
            shutDownOnLookup.set(true);

            engine.submit(racing, issueLabeled(7, BUG, ALICE), "d-1", null);

            assertThat(delivered).hasSize(1);
            assertThat(delivered.get(0).getDeliveryIds()).containsExactly("d-1");
            assertThat(engine.pendingCount(racing.getId())).isZero();
            assertThat(engine.activeSubscriptions()).isZero();
            assertThat(scheduler.armedTimers()).isZero();
        }

        @Test
        @DisplayName("Should reject a negative timeout")
        void shouldRejectNegativeTimeout() {
            assertThatThrownBy(() -> new AggregationEngine(scheduler, Duration.ofMillis(-1), delivered::add, Runnable::run))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Concurrent submits against real deadlines")
    class ConcurrencyTest {

        private static final int THREADS = 8;
        private static final int PER_THREAD = 1_000;

        @Test
        @DisplayName("Should flush every delivery exactly once and drain every queue")
        void shouldFlushEveryDeliveryOnce() throws Exception {
            Map<String, Integer> seen = new ConcurrentHashMap<>();
            AtomicInteger notifications = new AtomicInteger();
            List<Subscription> subscriptions = List.of(subscription("C-1"), subscription("C-2"), subscription("C-3"));
            int total = THREADS * PER_THREAD;

            try (ExecutorDeadlineScheduler deadlines = new ExecutorDeadlineScheduler("test-deadlines")) {
                AggregationEngine concurrent = new AggregationEngine(deadlines, Duration.ofMillis(2), n -> {
                    notifications.incrementAndGet();
                    n.getDeliveryIds().forEach(id -> seen.merge(id, 1, Integer::sum));
                }, Runnable::run);

                ExecutorService submitters = Executors.newFixedThreadPool(THREADS);
                CountDownLatch go = new CountDownLatch(1);
                try {
                    List<Future<?>> futures = new ArrayList<>();
                    for (int t = 0; t < THREADS; t++) {
                        int thread = t;
                        futures.add(submitters.submit(() -> {
                            go.await();
                            for (int i = 0; i < PER_THREAD; i++) {
                                Subscription target = subscriptions.get(i % subscriptions.size());
                                int issue = i % 4;
                                String id = "d-" + thread + "-" + i;
                                if (i % 5 == 0) {
                                    concurrent.submit(target, push(1, 1), id, new PushMetrics(1, 1));
                                } else if (i % 2 == 0) {
                                    concurrent.submit(target, issueLabeled(issue, BUG, ALICE), id, null);
                                } else {
                                    concurrent.submit(target, issueUnlabeled(issue, UI, ALICE), id, null);
                                }
                            }
                            return null;
                        }));
                    }
                    go.countDown();
                    for (Future<?> future : futures) {
                        future.get(30, TimeUnit.SECONDS);
                    }
                } finally {
                    submitters.shutdownNow();
                }

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
                while ((seen.size() < total || concurrent.activeSubscriptions() > 0) && System.nanoTime() < deadline) {
                    Thread.sleep(10);
                }

                assertThat(seen).hasSize(total);
                assertThat(seen.values()).containsOnly(1);
                assertThat(notifications.get()).isLessThanOrEqualTo(total);
                assertThat(concurrent.activeSubscriptions()).isZero();
                subscriptions.forEach(sub -> assertThat(concurrent.pendingCount(sub.getId())).isZero());
            }
        }
    }
}
