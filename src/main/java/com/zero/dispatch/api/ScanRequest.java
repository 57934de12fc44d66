package com.zero.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/scans.
 *
 * @param target      repository to scan, e.g. "owner/repo"
 * @param profile     profile name or comma separated analyzer ids; nullable, defaults to the configured profile
 * @param analyzers   explicit analyzer ids; takes precedence over {@code profile} when non-empty
 * @param force       re-run every analyzer regardless of cached artifacts
 * @param bestEffort  accept stale artifacts; nullable, defaults to {@code zero.cache.best-effort}
 * @param ttlOverride ISO-8601 duration used for freshness instead of each analyzer's TTL
 * @param skip        analyzer ids to leave out; their dependents are left out too
 * @param commit      current commit of the target; cached artifacts from other commits are re-run
 */
public record ScanRequest(
    String target,
    String profile,
    List<String> analyzers,
    Boolean force,
    @JsonProperty("best_effort") Boolean bestEffort,
    @JsonProperty("ttl_override") Duration ttlOverride,
    List<String> skip,
    String commit
) {}
