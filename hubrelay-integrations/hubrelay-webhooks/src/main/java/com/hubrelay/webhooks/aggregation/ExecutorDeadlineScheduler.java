package com.hubrelay.webhooks.aggregation;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link DeadlineScheduler} backed by {@link System#nanoTime()} and a single
 * daemon timer thread.  Timer tasks only move state under a queue lock;
 * the notification itself is delivered elsewhere.
 */
public class ExecutorDeadlineScheduler implements DeadlineScheduler, AutoCloseable {

    private final ScheduledExecutorService executor;

    public ExecutorDeadlineScheduler() {
        this("hubrelay-deadlines");
    }

    public ExecutorDeadlineScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public void schedule(Runnable task, long delayNanos) {
        executor.schedule(task, Math.max(0L, delayNanos), TimeUnit.NANOSECONDS);
    }

    /** Cancels every timer still armed. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
