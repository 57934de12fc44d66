package com.zero.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zero.core.cache.CacheLookup;
import com.zero.core.cache.FreshnessPolicy;

import java.time.Instant;

/**
 * JSON view of a stored artifact and its freshness.
 *
 * @param age           human-readable age, e.g. "3 days ago"
 * @param sourceCommit  commit the artifact was produced from; null when unknown
 * @param commitChanged the artifact predates the commit the caller asked about
 * @param payload       UTF-8 text of the artifact; omitted in listings
 */
public record ArtifactResponse(
    String target,
    @JsonProperty("analyzer_id") String analyzerId,
    String status,
    String freshness,
    @JsonProperty("produced_at") Instant producedAt,
    @JsonProperty("age_seconds") long ageSeconds,
    @JsonProperty("ttl_seconds") long ttlSeconds,
    String age,
    @JsonProperty("source_commit") String sourceCommit,
    @JsonProperty("commit_changed") boolean commitChanged,
    String error,
    String payload
) {

    public static ArtifactResponse from(CacheLookup lookup, boolean includePayload) {
        var artifact = lookup.artifact();
        return new ArtifactResponse(
                lookup.target(),
                lookup.analyzerId(),
                artifact.status().name(),
                lookup.freshness().name(),
                artifact.producedAt(),
                lookup.age().toSeconds(),
                lookup.ttl().toSeconds(),
                FreshnessPolicy.describeAge(lookup.age()),
                artifact.sourceCommit(),
                lookup.commitChanged(),
                artifact.error(),
                includePayload ? artifact.payloadAsString() : null);
    }
}
