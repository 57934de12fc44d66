package com.zero.core.model;

/**
 * What the engine does with a cached artifact before running an analyzer.
 */
public enum CacheDecision {
    /** Reuse the stored artifact. */
    HIT,
    /** No usable artifact (absent, failed, or refresh forced). */
    MISS,
    /** Artifact exists but is older than its TTL; re-run. */
    STALE
}
