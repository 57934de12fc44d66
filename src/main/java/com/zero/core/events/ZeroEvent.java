package com.zero.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a scan job runs, used for SSE streaming and CLI watch output.
 *
 * @param eventType  e.g. "job.started", "wave.started", "analyzer.completed"
 * @param jobId      the job this event belongs to
 * @param analyzerId the analyzer this event relates to (nullable for job- and wave-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record ZeroEvent(
    String eventType,
    String jobId,
    String analyzerId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ZeroEvent of(String eventType, String jobId, String analyzerId,
                               Map<String, Object> payload, Instant timestamp) {
        return new ZeroEvent(eventType, jobId, analyzerId, payload != null ? Map.copyOf(payload) : Map.of(), timestamp);
    }

    /** True for the events that end a job's stream. */
    public boolean isTerminal() {
        return "job.completed".equals(eventType)
                || "job.failed".equals(eventType)
                || "job.cancelled".equals(eventType);
    }
}
