package com.zero.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable per-analyzer progress entry of a job.
 *
 * @param status     current status
 * @param cached     true when DONE was satisfied by a cached artifact
 * @param error      failure message when FAILED
 * @param skipReason why the analyzer was SKIPPED (e.g. "dependency failed: package-sbom")
 * @param startedAt  when the run function was invoked
 * @param finishedAt when a terminal status was reached
 * @param durationMs run duration; 0 for cached or skipped analyzers
 */
public record AnalyzerState(
    AnalyzerStatus status,
    boolean cached,
    String error,
    @JsonProperty("skip_reason") String skipReason,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("duration_ms") long durationMs
) {

    public static AnalyzerState pending() {
        return new AnalyzerState(AnalyzerStatus.PENDING, false, null, null, null, null, 0);
    }

    public AnalyzerState running(Instant now) {
        return new AnalyzerState(AnalyzerStatus.RUNNING, false, null, null, now, null, 0);
    }

    public AnalyzerState done(Instant now) {
        return new AnalyzerState(AnalyzerStatus.DONE, false, null, null, startedAt, now, elapsed(now));
    }

    public AnalyzerState cachedHit(Instant now) {
        return new AnalyzerState(AnalyzerStatus.DONE, true, null, null, null, now, 0);
    }

    public AnalyzerState failed(String message, Instant now) {
        return new AnalyzerState(AnalyzerStatus.FAILED, false, message, null, startedAt, now, elapsed(now));
    }

    public AnalyzerState skipped(String reason, Instant now) {
        return new AnalyzerState(AnalyzerStatus.SKIPPED, false, null, reason, null, now, 0);
    }

    private long elapsed(Instant now) {
        return startedAt != null ? Math.max(0, now.toEpochMilli() - startedAt.toEpochMilli()) : 0;
    }
}
