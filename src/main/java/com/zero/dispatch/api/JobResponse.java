package com.zero.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zero.core.model.AnalyzerState;
import com.zero.core.model.AnalyzerStatus;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.ScanOptions;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON response for scan job endpoints.
 */
public record JobResponse(
    @JsonProperty("job_id") String jobId,
    String target,
    String profile,
    String status,
    @JsonProperty("requested_analyzers") List<String> requestedAnalyzers,
    List<List<String>> waves,
    Map<String, AnalyzerState> analyzers,
    Map<String, Long> counts,
    ScanOptions options,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    String error
) {

    public static JobResponse from(JobSnapshot snapshot) {
        var counts = new LinkedHashMap<String, Long>();
        for (AnalyzerStatus status : AnalyzerStatus.values()) {
            counts.put(status.name().toLowerCase(), snapshot.countIn(status));
        }
        return new JobResponse(
                snapshot.id(),
                snapshot.target(),
                snapshot.profile(),
                snapshot.status().name(),
                snapshot.requestedAnalyzers(),
                snapshot.plan().waves(),
                snapshot.analyzers(),
                counts,
                snapshot.options(),
                snapshot.createdAt(),
                snapshot.startedAt(),
                snapshot.finishedAt(),
                snapshot.error());
    }
}
