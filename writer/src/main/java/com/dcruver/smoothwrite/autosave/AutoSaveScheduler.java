package com.dcruver.smoothwrite.autosave;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Debounces "content changed" signals into save calls.
 *
 * Every {@link #trigger()} pushes the deadline out to now plus the delay; the
 * save callback runs once the deadline passes without another trigger.
 * {@link #saveNow()} runs it immediately and drops whatever was pending.
 *
 * The callback is never invoked while this object's lock is held, and a
 * failing callback is logged and otherwise ignored: a timer thread has no
 * caller to report to.
 */
@Slf4j
public class AutoSaveScheduler {

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(1000);

    /**
     * The save action. Reads whatever content is current when it runs.
     */
    @FunctionalInterface
    public interface SaveCallback {
        void save() throws Exception;
    }

    private final TaskScheduler taskScheduler;
    private final SaveCallback saveCallback;

    private Duration delay;
    private boolean enabled = true;
    private boolean shutdown;
    private ScheduledFuture<?> pending;
    private Instant deadline;
    // Bumped on every schedule and cancel so a superseded timer that already started does nothing.
    private long generation;

    public AutoSaveScheduler(TaskScheduler taskScheduler, SaveCallback saveCallback) {
        this(taskScheduler, saveCallback, DEFAULT_DELAY);
    }

    public AutoSaveScheduler(TaskScheduler taskScheduler, SaveCallback saveCallback, Duration delay) {
        this.taskScheduler = taskScheduler;
        this.saveCallback = saveCallback;
        this.delay = requireValidDelay(delay);
        log.info("Auto-save initialized with {}ms delay", delay.toMillis());
    }

    /**
     * Restart the idle countdown. Ignored while disabled or after shutdown.
     */
    public synchronized void trigger() {
        if (!enabled || shutdown) {
            return;
        }
        cancelPending();
        long scheduled = generation;
        deadline = taskScheduler.getClock().instant().plus(delay);
        pending = taskScheduler.schedule(() -> onDeadline(scheduled), deadline);
        log.debug("Auto-save triggered, due at {}", deadline);
    }

    /**
     * Run the save callback now on the calling thread, cancelling any
     * pending deadline.
     */
    public void saveNow() {
        synchronized (this) {
            cancelPending();
        }
        runCallback();
    }

    public synchronized void enable() {
        if (shutdown) {
            log.warn("Ignoring enable on a shut down auto-save scheduler");
            return;
        }
        enabled = true;
        log.info("Auto-save enabled");
    }

    /**
     * Stop accepting triggers and drop a pending save without running it.
     */
    public synchronized void disable() {
        enabled = false;
        cancelPending();
        log.info("Auto-save disabled");
    }

    /**
     * Change the debounce window. An already pending deadline keeps its time.
     */
    public synchronized void setDelay(Duration delay) {
        this.delay = requireValidDelay(delay);
        log.info("Auto-save delay changed to {}ms", delay.toMillis());
    }

    /**
     * Cancel the pending timer for good. Does not flush; owners with unsaved
     * edits call {@link #saveNow()} first.
     */
    public synchronized void shutdown() {
        cancelPending();
        shutdown = true;
        enabled = false;
        log.debug("Auto-save scheduler shut down");
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized Duration getDelay() {
        return delay;
    }

    /**
     * Deadline of the pending save, or null when idle.
     */
    public synchronized Instant getDeadline() {
        return deadline;
    }

    private void onDeadline(long scheduled) {
        synchronized (this) {
            if (scheduled != generation || pending == null) {
                return;
            }
            pending = null;
            deadline = null;
            generation++;
        }
        log.debug("Executing auto-save");
        runCallback();
    }

    private void runCallback() {
        try {
            saveCallback.save();
        } catch (Exception e) {
            log.error("Auto-save failed: {}", e.getMessage(), e);
        }
    }

    private void cancelPending() {
        generation++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        deadline = null;
    }

    private static Duration requireValidDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Auto-save delay must be zero or positive: " + delay);
        }
        return delay;
    }
}
