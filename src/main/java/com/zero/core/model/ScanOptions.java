package com.zero.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Per-request execution options.
 *
 * @param force       ignore cached artifacts and re-run every analyzer
 * @param bestEffort  accept STALE artifacts instead of re-running (offline/degraded operation)
 * @param ttlOverride TTL used for freshness instead of each analyzer's own; nullable
 * @param skip        analyzer ids excluded from the run, together with everything depending on them
 * @param commit      commit of the target being scanned; artifacts produced from another commit are re-run
 */
public record ScanOptions(
    boolean force,
    @JsonProperty("best_effort") boolean bestEffort,
    @JsonProperty("ttl_override") Duration ttlOverride,
    List<String> skip,
    String commit
) {

    public ScanOptions {
        if (skip == null) {
            skip = List.of();
        } else {
            var ids = new LinkedHashSet<String>();
            for (String id : skip) {
                if (id != null && !id.isBlank()) {
                    ids.add(id.strip());
                }
            }
            skip = List.copyOf(ids);
        }
        commit = commit == null || commit.isBlank() ? null : commit.strip();
    }

    public ScanOptions(boolean force, boolean bestEffort, Duration ttlOverride) {
        this(force, bestEffort, ttlOverride, List.of(), null);
    }

    public static ScanOptions defaults() {
        return new ScanOptions(false, false, null);
    }

    public boolean excludes(String analyzerId) {
        return skip.contains(analyzerId);
    }

    public ScanOptions withForce(boolean force) {
        return new ScanOptions(force, bestEffort, ttlOverride, skip, commit);
    }

    public ScanOptions withBestEffort(boolean bestEffort) {
        return new ScanOptions(force, bestEffort, ttlOverride, skip, commit);
    }

    public ScanOptions withSkip(List<String> skip) {
        return new ScanOptions(force, bestEffort, ttlOverride, skip, commit);
    }

    public ScanOptions withCommit(String commit) {
        return new ScanOptions(force, bestEffort, ttlOverride, skip, commit);
    }
}
