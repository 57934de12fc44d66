package com.zero.core.registry;

import com.zero.core.model.Artifact;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Inputs and cancellation state handed to an {@link Analyzer} run.
 */
public final class AnalyzerContext {

    private final String jobId;
    private final String target;
    private final String analyzerId;
    private final Instant deadline;
    private final Map<String, Artifact> dependencies;
    private final BooleanSupplier cancelled;
    private final Clock clock;

    public AnalyzerContext(String jobId, String target, String analyzerId, Instant deadline,
                           Map<String, Artifact> dependencies, BooleanSupplier cancelled, Clock clock) {
        this.jobId = jobId;
        this.target = target;
        this.analyzerId = analyzerId;
        this.deadline = deadline;
        this.dependencies = Map.copyOf(dependencies);
        this.cancelled = cancelled;
        this.clock = clock;
    }

    /** Context for running an analyzer outside of a job (CLI one-offs, tests). */
    public static AnalyzerContext standalone(String target, String analyzerId, Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new AnalyzerContext(null, target, analyzerId, clock.instant().plus(timeout),
                Map.of(), () -> false, clock);
    }

    public String jobId() {
        return jobId;
    }

    public String target() {
        return target;
    }

    public String analyzerId() {
        return analyzerId;
    }

    public Instant deadline() {
        return deadline;
    }

    /** Time left before the run is timed out; never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Map<String, Artifact> dependencies() {
        return dependencies;
    }

    public Optional<Artifact> dependency(String dependencyId) {
        return Optional.ofNullable(dependencies.get(dependencyId));
    }

    public byte[] dependencyPayload(String dependencyId) {
        return dependency(dependencyId)
                .map(Artifact::payload)
                .orElseThrow(() -> new IllegalStateException(
                        "Analyzer " + analyzerId + " has no artifact for dependency " + dependencyId));
    }

    /** True once the job is cancelled or this run's timeout has expired. */
    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Analyzer " + analyzerId + " cancelled");
        }
    }
}
