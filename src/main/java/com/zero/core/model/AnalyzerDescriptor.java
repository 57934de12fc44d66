package com.zero.core.model;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Static description of a registered analyzer.
 *
 * @param id           unique analyzer identifier (e.g. "package-sbom")
 * @param description  human-readable summary; may be empty
 * @param dependencies analyzer ids that must reach a terminal state first, in declaration order
 * @param defaultTtl   how long an artifact produced by this analyzer stays fresh
 * @param timeout      per-run timeout; {@code null} means the engine default applies
 */
public record AnalyzerDescriptor(
    String id,
    String description,
    List<String> dependencies,
    Duration defaultTtl,
    Duration timeout
) {

    public AnalyzerDescriptor {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Analyzer id must not be blank");
        }
        description = description != null ? description : "";
        // de-duplicate while keeping declaration order
        dependencies = dependencies != null ? List.copyOf(new LinkedHashSet<>(dependencies)) : List.of();
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Analyzer " + id + " must have a positive TTL");
        }
    }

    public static AnalyzerDescriptor of(String id, Duration ttl, String... dependencies) {
        return new AnalyzerDescriptor(id, "", List.of(dependencies), ttl, null);
    }

    public boolean dependsOn(String analyzerId) {
        return dependencies.contains(analyzerId);
    }
}
