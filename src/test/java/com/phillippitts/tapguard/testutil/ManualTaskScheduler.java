package com.phillippitts.tapguard.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TaskScheduler that only records one-shot tasks; the test decides when they run.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<ManualFuture> scheduled = new ArrayList<>();

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime);
        scheduled.add(future);
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("trigger tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("periodic tasks are not supported");
    }

    /**
     * Runs every pending task due at or before {@code now}, earliest first.
     *
     * @return number of tasks run
     */
    public int runDue(Instant now) {
        List<ManualFuture> due;
        synchronized (this) {
            due = scheduled.stream()
                    .filter(f -> f.pending() && !f.startTime.isAfter(now))
                    .sorted(Comparator.comparing(f -> f.startTime))
                    .toList();
        }
        due.forEach(ManualFuture::run);
        return due.size();
    }

    /**
     * Runs every pending task regardless of its start time.
     */
    public int runAll() {
        return runDue(Instant.MAX);
    }

    public synchronized int pendingCount() {
        return (int) scheduled.stream().filter(ManualFuture::pending).count();
    }

    public synchronized List<Instant> pendingStartTimes() {
        return scheduled.stream().filter(ManualFuture::pending).map(f -> f.startTime).toList();
    }

    static final class ManualFuture implements ScheduledFuture<Object> {
        private final Runnable task;
        private final Instant startTime;
        private volatile boolean cancelled;
        private volatile boolean done;

        ManualFuture(Runnable task, Instant startTime) {
            this.task = task;
            this.startTime = startTime;
        }

        boolean pending() {
            return !cancelled && !done;
        }

        void run() {
            if (!pending()) {
                return;
            }
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0;
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
