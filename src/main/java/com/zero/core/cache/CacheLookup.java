package com.zero.core.cache;

import com.zero.core.model.Artifact;
import com.zero.core.model.FreshnessLevel;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of a cache lookup. {@code artifact}, {@code freshness} and {@code age} are
 * null when nothing is stored for the key.
 *
 * @param ttl           the TTL the freshness was computed against
 * @param commitChanged the artifact was produced from a different commit than the one asked about
 */
public record CacheLookup(
    String target,
    String analyzerId,
    Artifact artifact,
    FreshnessLevel freshness,
    Duration age,
    Duration ttl,
    boolean commitChanged
) {

    public CacheLookup(String target, String analyzerId, Artifact artifact, FreshnessLevel freshness,
                       Duration age, Duration ttl) {
        this(target, analyzerId, artifact, freshness, age, ttl, false);
    }

    public static CacheLookup absent(String target, String analyzerId, Duration ttl) {
        return new CacheLookup(target, analyzerId, null, null, null, ttl, false);
    }

    public boolean found() {
        return artifact != null;
    }

    public Optional<Artifact> artifactIfPresent() {
        return Optional.ofNullable(artifact);
    }
}
