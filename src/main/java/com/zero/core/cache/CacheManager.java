package com.zero.core.cache;

import com.zero.core.metrics.ZeroMetrics;
import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.model.Artifact;
import com.zero.core.model.CacheDecision;
import com.zero.core.model.FreshnessLevel;
import com.zero.core.model.ScanOptions;
import com.zero.core.registry.AnalyzerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Lookup, store and invalidation of artifacts plus the freshness decision that
 * tells the engine whether an analyzer has to run.
 * <p>
 * TTL resolution: per-request override, else the analyzer's descriptor TTL, else
 * the configured default (for ids no longer registered).
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final ArtifactStore store;
    private final AnalyzerRegistry registry;
    private final FreshnessPolicy policy;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ZeroMetrics metrics;

    public CacheManager(ArtifactStore store, AnalyzerRegistry registry, FreshnessPolicy policy,
                        Duration defaultTtl, Clock clock, ZeroMetrics metrics) {
        this.store = store;
        this.registry = registry;
        this.policy = policy;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CacheLookup lookup(String target, String analyzerId) {
        return lookup(target, analyzerId, null);
    }

    /**
     * Reads the stored artifact for the key and classifies its freshness. Has no
     * side effects, so repeated lookups without intervening writes agree.
     */
    public CacheLookup lookup(String target, String analyzerId, Duration ttlOverride) {
        return lookup(target, analyzerId, ttlOverride, null);
    }

    /**
     * Same as {@link #lookup(String, String, Duration)}, also comparing the artifact's
     * source commit against {@code currentCommit} when both are known.
     */
    public CacheLookup lookup(String target, String analyzerId, Duration ttlOverride, String currentCommit) {
        Duration ttl = ttlFor(analyzerId, ttlOverride);
        var stored = store.get(target, analyzerId);
        if (stored.isEmpty()) {
            return CacheLookup.absent(target, analyzerId, ttl);
        }
        Artifact artifact = stored.get();
        Duration age = artifact.age(clock.instant());
        FreshnessLevel freshness = policy.classify(age, ttl);
        return new CacheLookup(target, analyzerId, artifact, freshness, age, ttl,
                artifact.commitChanged(currentCommit));
    }

    /**
     * Decides what the engine does with a lookup.
     * <ul>
     *   <li>nothing stored, forced refresh, last run failed, or produced from another commit: MISS</li>
     *   <li>FRESH, or STALE with best effort: HIT</li>
     *   <li>otherwise STALE (re-run)</li>
     * </ul>
     */
    public CacheDecision decide(CacheLookup lookup, ScanOptions options) {
        CacheDecision decision;
        if (!lookup.found() || options.force() || !lookup.artifact().isOk()
                || lookup.commitChanged() || lookup.artifact().commitChanged(options.commit())) {
            decision = CacheDecision.MISS;
        } else if (lookup.freshness() == FreshnessLevel.FRESH
                || (options.bestEffort() && lookup.freshness() == FreshnessLevel.STALE)) {
            decision = CacheDecision.HIT;
        } else {
            decision = CacheDecision.STALE;
        }
        if (metrics != null) {
            metrics.recordCacheDecision(decision);
        }
        log.debug("Cache {} for {}/{} (freshness={}, age={})", decision, lookup.target(), lookup.analyzerId(),
                lookup.freshness(), lookup.age());
        return decision;
    }

    public Artifact store(String target, String analyzerId, byte[] payload) {
        return store(target, analyzerId, payload, null);
    }

    public Artifact store(String target, String analyzerId, byte[] payload, String sourceCommit) {
        Artifact artifact = Artifact.ok(target, analyzerId, payload, clock.instant(), sourceCommit);
        store.put(artifact);
        return artifact;
    }

    /**
     * Records a failed run. A good artifact is never replaced by an error, so a
     * previously produced result stays available.
     *
     * @return true if an error artifact was written
     */
    public boolean recordFailure(String target, String analyzerId, String message) {
        boolean written = store.putUnlessOk(Artifact.error(target, analyzerId, message, clock.instant()));
        if (!written) {
            log.debug("Keeping previous artifact for {}/{} after failure", target, analyzerId);
        }
        return written;
    }

    /**
     * Removes one artifact, or every artifact of the target when {@code analyzerId} is null.
     *
     * @return number of artifacts removed
     */
    public int invalidate(String target, String analyzerId) {
        int removed = analyzerId == null
                ? store.removeAll(target)
                : (store.remove(target, analyzerId) ? 1 : 0);
        log.info("Invalidated {} artifact(s) for {}{}", removed, target,
                analyzerId != null ? "/" + analyzerId : "");
        return removed;
    }

    /** Freshness of every stored artifact of a target. */
    public List<CacheLookup> inspect(String target) {
        Instant now = clock.instant();
        return store.list(target).stream()
                .map(a -> {
                    Duration ttl = ttlFor(a.analyzerId(), null);
                    Duration age = a.age(now);
                    return new CacheLookup(target, a.analyzerId(), a, policy.classify(age, ttl), age, ttl);
                })
                .toList();
    }

    public FreshnessPolicy policy() {
        return policy;
    }

    public ArtifactStore artifactStore() {
        return store;
    }

    Duration ttlFor(String analyzerId, Duration ttlOverride) {
        if (ttlOverride != null && !ttlOverride.isNegative() && !ttlOverride.isZero()) {
            return ttlOverride;
        }
        return registry.descriptor(analyzerId)
                .map(AnalyzerDescriptor::defaultTtl)
                .orElse(defaultTtl);
    }
}
