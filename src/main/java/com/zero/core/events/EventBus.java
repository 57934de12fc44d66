package com.zero.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for scan job events.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations; analyzer pool threads
 * publish directly.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-job subscribers keyed by jobId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ZeroEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all jobs. */
    private final CopyOnWriteArrayList<Consumer<ZeroEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (job-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(ZeroEvent event) {
        log.debug("Publishing event: {} for job {}", event.eventType(), event.jobId());

        List<Consumer<ZeroEvent>> jobSubs = jobSubscribers.get(event.jobId());
        if (jobSubs != null) {
            for (Consumer<ZeroEvent> subscriber : jobSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ZeroEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific job.
     *
     * @param jobId    the job to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<ZeroEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to job {}", jobId);
        return () -> jobSubscribers.computeIfPresent(jobId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all jobs.
     *
     * @param consumer callback invoked for each event regardless of job
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<ZeroEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of live per-job subscriptions, excluding global subscribers. */
    public int subscriberCount(String jobId) {
        var subs = jobSubscribers.get(jobId);
        return subs != null ? subs.size() : 0;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ZeroEvent> subscriber, ZeroEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
