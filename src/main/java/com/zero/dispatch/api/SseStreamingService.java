package com.zero.dispatch.api;

import com.zero.core.events.EventBus;
import com.zero.core.events.ZeroEvent;
import com.zero.core.model.JobSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each client gets an emitter subscribed to its job's events. The stream opens with a
 * {@code job.snapshot} event and completes after the job's terminal event (or at once
 * when the job had already finished). Heartbeat comments keep idle connections open
 * through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (for long-running scans). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for job {} (connection likely closed): {}",
                        registration.jobId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for job {} (emitter not active)", registration.jobId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given job.
     *
     * @param snapshot current state of the job, sent as the first event
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter createEmitter(JobSnapshot snapshot) {
        String jobId = snapshot.id();
        SseEmitter emitter = new SseEmitter(timeoutMs);

        var holder = new EmitterRegistration[1];
        EventBus.Subscription subscription = eventBus.subscribe(jobId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminal() && holder[0] != null) {
                finish(holder[0]);
            }
        });

        var registration = new EmitterRegistration(jobId, emitter, subscription);
        holder[0] = registration;
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for job {}", jobId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for job {}", jobId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for job {}: {}", jobId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().name("job.snapshot").data(JobResponse.from(snapshot)));
        } catch (IOException e) {
            log.warn("Failed to send initial snapshot for job {}: {}", jobId, e.getMessage());
        }
        if (snapshot.isTerminal()) {
            finish(registration);
        }

        log.info("SSE emitter created for job {} (timeout={}ms)", jobId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, ZeroEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("jobId", event.jobId());
            if (event.analyzerId() != null) {
                data.put("analyzerId", event.analyzerId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for job {}: {}",
                    event.eventType(), event.jobId(), e.getMessage());
        }
    }

    /** Completes the stream; the completion callback does not fire outside a servlet request. */
    private void finish(EmitterRegistration registration) {
        registration.emitter.complete();
        cleanup(registration);
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for job {} ({} subscriber(s) left)",
                registration.jobId, eventBus.subscriberCount(registration.jobId));
    }

    private record EmitterRegistration(
            String jobId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
