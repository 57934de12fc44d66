package com.zero.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, consistent view of a job taken under the job's lock.
 */
public record JobSnapshot(
    String id,
    String target,
    String profile,
    List<String> requestedAnalyzers,
    ExecutionPlan plan,
    ScanOptions options,
    JobStatus status,
    Map<String, AnalyzerState> analyzers,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String error
) {

    public JobSnapshot {
        requestedAnalyzers = List.copyOf(requestedAnalyzers);
        // keep plan order for display
        analyzers = Collections.unmodifiableMap(new LinkedHashMap<>(analyzers));
    }

    public AnalyzerStatus analyzerStatus(String analyzerId) {
        var state = analyzers.get(analyzerId);
        return state != null ? state.status() : null;
    }

    public long countIn(AnalyzerStatus status) {
        return analyzers.values().stream().filter(s -> s.status() == status).count();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
