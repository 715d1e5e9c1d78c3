package com.vaultpost.sync;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Registry of pending retry timers, keyed by queue item or action id.
 *
 * At most one timer exists per id: scheduling again replaces the previous timer.
 * A timer leaves the registry when it fires or is cancelled.
 */
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final Scheduler scheduler;
    private final Map<String, Disposable> timers = new ConcurrentHashMap<>();

    public RetryScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void schedule(String id, Duration delay, Runnable task) {
        Disposable.Swap slot = Disposables.swap();
        Disposable previous = timers.put(id, slot);
        if (previous != null) {
            previous.dispose();
        }
        slot.update(Mono.delay(delay, scheduler).subscribe(tick -> {
            if (timers.remove(id, slot)) {
                task.run();
            }
        }, e -> log.warn("Retry timer for {} failed: {}", id, e.getMessage())));
        log.debug("Scheduled retry of {} in {} ms", id, delay.toMillis());
    }

    /** Returns true when a pending timer was cancelled. */
    public boolean cancel(String id) {
        Disposable timer = timers.remove(id);
        if (timer == null) {
            return false;
        }
        timer.dispose();
        return true;
    }

    public void cancelAll() {
        timers.keySet().forEach(this::cancel);
    }

    public boolean isScheduled(String id) {
        return timers.containsKey(id);
    }

    public int size() {
        return timers.size();
    }
}
