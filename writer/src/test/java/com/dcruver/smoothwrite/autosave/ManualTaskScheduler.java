package com.dcruver.smoothwrite.autosave;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Task scheduler driven by a {@link ManualClock}. One-shot tasks run on the
 * test thread when {@link #advance(Duration)} passes their start time.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final ManualClock clock;
    private final List<Task> tasks = new ArrayList<>();

    public ManualTaskScheduler(ManualClock clock) {
        this.clock = clock;
    }

    /**
     * Move time forward, running due tasks in start-time order with the
     * clock set to each task's start time.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<Task> next = tasks.stream()
                .filter(t -> !t.cancelled && !t.startTime.isAfter(target))
                .min(Comparator.comparing((Task t) -> t.startTime));
            if (next.isEmpty()) {
                break;
            }
            Task task = next.get();
            tasks.remove(task);
            clock.set(task.startTime);
            task.done = true;
            task.runnable.run();
        }
        clock.set(target);
    }

    public int scheduledCount() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        Task scheduled = new Task(task, startTime);
        tasks.add(scheduled);
        return scheduled;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Triggers are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    private final class Task implements ScheduledFuture<Object> {
        private final Runnable runnable;
        private final Instant startTime;
        private boolean cancelled;
        private boolean done;

        private Task(Runnable runnable, Instant startTime) {
            this.runnable = runnable;
            this.startTime = startTime;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), startTime));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done || cancelled) {
                return false;
            }
            cancelled = true;
            tasks.remove(this);
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
