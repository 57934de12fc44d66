package com.zero.core.engine;

import com.zero.core.cache.CacheLookup;
import com.zero.core.cache.CacheManager;
import com.zero.core.cache.ConflictingRunException;
import com.zero.core.cache.RunClaims;
import com.zero.core.events.EventBus;
import com.zero.core.events.ZeroEvent;
import com.zero.core.logging.MdcContext;
import com.zero.core.metrics.ZeroMetrics;
import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.model.AnalyzerState;
import com.zero.core.model.AnalyzerStatus;
import com.zero.core.model.Artifact;
import com.zero.core.model.CacheDecision;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import com.zero.core.registry.AnalyzerContext;
import com.zero.core.registry.AnalyzerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a job's execution plan wave by wave.
 * <p>
 * Per wave: analyzers excluded by the request (and everything depending on them)
 * are skipped, analyzers blocked by a FAILED or SKIPPED dependency are skipped, fresh
 * cache hits complete immediately, and the rest are dispatched to a fixed pool of
 * {@code parallelScanners} threads, each guarded by its own timeout. The wave must
 * fully settle before the next one is considered. Analyzer failures never escape:
 * they become FAILED states and siblings keep running.
 * <p>
 * Cancellation is checked at every wave boundary and interrupts in-flight runs;
 * the job then ends CANCELLED with the undispatched analyzers SKIPPED.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final AnalyzerRegistry registry;
    private final CacheManager cache;
    private final RunClaims claims;
    private final EventBus eventBus;
    private final ZeroMetrics metrics;
    private final int parallelScanners;
    private final Duration defaultTimeout;
    private final Clock clock;

    public ExecutionEngine(AnalyzerRegistry registry, CacheManager cache, RunClaims claims, EventBus eventBus,
                           ZeroMetrics metrics, int parallelScanners, Duration defaultTimeout, Clock clock) {
        if (parallelScanners < 1) {
            throw new IllegalArgumentException("parallelScanners must be at least 1, got " + parallelScanners);
        }
        this.registry = registry;
        this.cache = cache;
        this.claims = claims;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.parallelScanners = parallelScanners;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    public int parallelScanners() {
        return parallelScanners;
    }

    /**
     * Executes the job on the calling thread and returns its final snapshot.
     * A job cancelled while still queued is returned unchanged.
     */
    public JobSnapshot execute(Job job) {
        MdcContext.setJob(job.id());
        try {
            if (!job.markRunning()) {
                log.info("Job {} was cancelled before it started", job.id());
                return job.snapshot();
            }
            var plan = job.plan();
            log.info("Starting job {} for {}: {} analyzer(s) in {} wave(s)",
                    job.id(), job.target(), plan.analyzers().size(), plan.waveCount());
            publish("job.started", job, null, Map.of(
                    "target", job.target(),
                    "waves", plan.waves(),
                    "requested", plan.requested()));

            ExecutorService pool = Executors.newFixedThreadPool(parallelScanners, threadFactory(job.id() + "-analyzer"));
            ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(threadFactory(job.id() + "-timeout"));
            var excluded = new HashSet<String>();
            try {
                for (int wave = 0; wave < plan.waveCount(); wave++) {
                    if (job.isCancellationRequested()) {
                        log.info("Job {} cancelled; not dispatching wave {} of {}", job.id(), wave + 1, plan.waveCount());
                        break;
                    }
                    runWave(job, wave, plan.waves().get(wave), excluded, pool, watchdog);
                }
                complete(job);
            } catch (RuntimeException e) {
                log.error("Job {} aborted by unexpected engine error: {}", job.id(), e.getMessage(), e);
                job.finish(JobStatus.ERROR, "Engine error: " + e.getMessage(), "job aborted");
                if (metrics != null) {
                    metrics.recordJobResult(JobStatus.ERROR);
                }
                publish("job.failed", job, null, Map.of("error", String.valueOf(e.getMessage())));
            } finally {
                pool.shutdownNow();
                watchdog.shutdownNow();
            }
            return job.snapshot();
        } finally {
            MdcContext.clear();
        }
    }

    private void runWave(Job job, int wave, List<String> analyzerIds, Set<String> excluded,
                         ExecutorService pool, ScheduledExecutorService watchdog) {
        MdcContext.setWave(job.id(), wave + 1);
        log.info("Wave {} of job {}: {}", wave + 1, job.id(), analyzerIds);
        publish("wave.started", job, null, Map.of("wave", wave + 1, "analyzers", analyzerIds));
        if (metrics != null) {
            metrics.recordWaveSize(analyzerIds.size());
        }

        var futures = new ArrayList<CompletableFuture<Void>>();
        for (String analyzerId : analyzerIds) {
            if (isExcluded(job, analyzerId, excluded)) {
                excluded.add(analyzerId);
                skip(job, analyzerId, Job.EXCLUDED_REASON);
                continue;
            }
            Optional<String> blocker = blockingDependency(job, analyzerId);
            if (blocker.isPresent()) {
                skip(job, analyzerId, "dependency failed: " + blocker.get());
                continue;
            }
            if (cacheHit(job, analyzerId)) {
                continue;
            }
            futures.add(CompletableFuture.runAsync(() -> runAnalyzer(job, wave, analyzerId, watchdog), pool));
        }

        // every analyzer of this wave must be terminal before the next wave is looked at
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var snapshot = job.snapshot();
        long failed = analyzerIds.stream().filter(id -> snapshot.analyzerStatus(id) == AnalyzerStatus.FAILED).count();
        long skipped = analyzerIds.stream().filter(id -> snapshot.analyzerStatus(id) == AnalyzerStatus.SKIPPED).count();
        log.info("Wave {} of job {} settled: {} analyzer(s), {} failed, {} skipped",
                wave + 1, job.id(), analyzerIds.size(), failed, skipped);
        publish("wave.completed", job, null, Map.of(
                "wave", wave + 1,
                "failed", failed,
                "skipped", skipped));
    }

    private Optional<String> blockingDependency(Job job, String analyzerId) {
        AnalyzerDescriptor descriptor = descriptor(analyzerId);
        for (String dependency : descriptor.dependencies()) {
            AnalyzerState state = job.analyzerState(dependency);
            if (state == null || state.status() != AnalyzerStatus.DONE) {
                return Optional.of(dependency);
            }
        }
        return Optional.empty();
    }

    // waves are in dependency order, so every dependency has been classified already
    private boolean isExcluded(Job job, String analyzerId, Set<String> excluded) {
        if (job.options().excludes(analyzerId)) {
            return true;
        }
        return descriptor(analyzerId).dependencies().stream().anyMatch(excluded::contains);
    }

    private boolean cacheHit(Job job, String analyzerId) {
        CacheDecision decision;
        try {
            CacheLookup lookup = cache.lookup(job.target(), analyzerId, job.options().ttlOverride(),
                    job.options().commit());
            decision = cache.decide(lookup, job.options());
        } catch (RuntimeException e) {
            log.warn("Cache lookup for {}/{} failed, running analyzer: {}", job.target(), analyzerId, e.getMessage());
            return false;
        }
        if (decision != CacheDecision.HIT) {
            return false;
        }
        job.updateAnalyzer(analyzerId, s -> s.cachedHit(clock.instant()));
        log.debug("Analyzer {} satisfied from cache", analyzerId);
        publish("analyzer.cached", job, analyzerId, Map.of("status", AnalyzerStatus.DONE.name()));
        return true;
    }

    private void runAnalyzer(Job job, int wave, String analyzerId, ScheduledExecutorService watchdog) {
        MdcContext.setAnalyzer(job.id(), wave + 1, analyzerId);
        try {
            if (job.isCancellationRequested()) {
                skip(job, analyzerId, Job.CANCELLED_REASON);
                return;
            }
            if (!claims.tryClaim(job.target(), analyzerId)) {
                conflict(job, analyzerId);
                return;
            }
            try {
                invoke(job, analyzerId, watchdog);
            } finally {
                claims.release(job.target(), analyzerId);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void invoke(Job job, String analyzerId, ScheduledExecutorService watchdog) {
        AnalyzerDescriptor descriptor = descriptor(analyzerId);
        Duration timeout = descriptor.timeout() != null ? descriptor.timeout() : defaultTimeout;
        Instant start = clock.instant();
        long startNanos = System.nanoTime();

        var handle = new RunHandle(Thread.currentThread());
        job.updateAnalyzer(analyzerId, s -> s.running(start));
        publish("analyzer.started", job, analyzerId, Map.of("timeout", timeout.toString()));
        job.registerRun(analyzerId, handle);
        ScheduledFuture<?> timer = watchdog.schedule(handle::timeout, timeout.toMillis(), TimeUnit.MILLISECONDS);

        var context = new AnalyzerContext(job.id(), job.target(), analyzerId, start.plus(timeout),
                dependencyArtifacts(job, descriptor),
                () -> job.isCancellationRequested() || handle.isTimedOut(), clock);

        byte[] payload = null;
        Exception failure = null;
        boolean timedOut;
        try {
            payload = registry.analyzer(analyzerId).run(context);
        } catch (Exception e) {
            failure = e;
        } finally {
            timer.cancel(false);
            job.unregisterRun(analyzerId);
            timedOut = handle.finish();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        if (timedOut) {
            // a result arriving after the deadline is discarded
            fail(job, analyzerId, "timed out after " + timeout, elapsedMs);
        } else if (failure != null && (job.isCancellationRequested() || handle.wasCancelled())) {
            skip(job, analyzerId, Job.CANCELLED_REASON);
        } else if (failure != null) {
            fail(job, analyzerId, describe(failure), elapsedMs);
        } else {
            succeed(job, analyzerId, payload, elapsedMs);
        }
    }

    private void succeed(Job job, String analyzerId, byte[] payload, long elapsedMs) {
        Artifact artifact;
        try {
            artifact = cache.store(job.target(), analyzerId, payload != null ? payload : new byte[0],
                    job.options().commit());
        } catch (RuntimeException e) {
            fail(job, analyzerId, "could not store artifact: " + e.getMessage(), elapsedMs);
            return;
        }
        job.updateAnalyzer(analyzerId, s -> s.done(clock.instant()));
        if (metrics != null) {
            metrics.recordAnalyzerRun(analyzerId, AnalyzerStatus.DONE, elapsedMs);
        }
        log.info("Analyzer {} completed in {}ms ({} bytes)", analyzerId, elapsedMs, artifact.payload().length);
        publish("analyzer.completed", job, analyzerId, Map.of(
                "status", AnalyzerStatus.DONE.name(),
                "durationMs", elapsedMs));
    }

    private void fail(Job job, String analyzerId, String message, long elapsedMs) {
        try {
            cache.recordFailure(job.target(), analyzerId, message);
        } catch (RuntimeException e) {
            log.warn("Could not record failure of {}/{}: {}", job.target(), analyzerId, e.getMessage());
        }
        markFailed(job, analyzerId, message, elapsedMs);
    }

    /**
     * Another job holds the run for this key. Its result, not ours, is what the
     * store should hold, so nothing is written here.
     */
    private void conflict(Job job, String analyzerId) {
        markFailed(job, analyzerId, new ConflictingRunException(job.target(), List.of(analyzerId)).getMessage(), 0);
    }

    private void markFailed(Job job, String analyzerId, String message, long elapsedMs) {
        job.updateAnalyzer(analyzerId, s -> s.failed(message, clock.instant()));
        if (metrics != null) {
            metrics.recordAnalyzerRun(analyzerId, AnalyzerStatus.FAILED, elapsedMs);
        }
        log.warn("Analyzer {} failed: {}", analyzerId, message);
        publish("analyzer.failed", job, analyzerId, Map.of(
                "status", AnalyzerStatus.FAILED.name(),
                "error", message));
    }

    private void skip(Job job, String analyzerId, String reason) {
        if (job.updateAnalyzer(analyzerId, s -> s.skipped(reason, clock.instant()))) {
            log.info("Analyzer {} skipped: {}", analyzerId, reason);
            publish("analyzer.skipped", job, analyzerId, Map.of(
                    "status", AnalyzerStatus.SKIPPED.name(),
                    "reason", reason));
        }
    }

    private void complete(Job job) {
        if (job.isCancellationRequested()) {
            for (String analyzerId : job.unfinishedAnalyzers()) {
                skip(job, analyzerId, Job.CANCELLED_REASON);
            }
            job.finish(JobStatus.CANCELLED, null, Job.CANCELLED_REASON);
            log.info("Job {} cancelled", job.id());
            record(job, JobStatus.CANCELLED, "job.cancelled", Map.of());
            return;
        }

        var snapshot = job.snapshot();
        var failedRequested = snapshot.requestedAnalyzers().stream()
                .filter(id -> snapshot.analyzerStatus(id) == AnalyzerStatus.FAILED)
                .toList();
        if (failedRequested.isEmpty()) {
            job.finish(JobStatus.DONE, null, "not executed");
            log.info("Job {} completed", job.id());
            record(job, JobStatus.DONE, "job.completed", Map.of("status", JobStatus.DONE.name()));
        } else {
            String error = "Requested analyzer(s) failed: " + String.join(", ", failedRequested);
            job.finish(JobStatus.ERROR, error, "not executed");
            log.warn("Job {} finished with errors: {}", job.id(), error);
            record(job, JobStatus.ERROR, "job.failed", Map.of("error", error));
        }
    }

    private void record(Job job, JobStatus status, String eventType, Map<String, Object> payload) {
        if (metrics != null) {
            metrics.recordJobResult(status);
        }
        publish(eventType, job, null, payload);
    }

    private Map<String, Artifact> dependencyArtifacts(Job job, AnalyzerDescriptor descriptor) {
        var artifacts = new HashMap<String, Artifact>();
        for (String dependency : descriptor.dependencies()) {
            cache.lookup(job.target(), dependency).artifactIfPresent()
                    .filter(Artifact::isOk)
                    .ifPresent(a -> artifacts.put(dependency, a));
        }
        return artifacts;
    }

    private AnalyzerDescriptor descriptor(String analyzerId) {
        return registry.descriptor(analyzerId)
                .orElseThrow(() -> new IllegalStateException("Analyzer not registered: " + analyzerId));
    }

    private void publish(String eventType, Job job, String analyzerId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ZeroEvent.of(eventType, job.id(), analyzerId, payload, clock.instant()));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
