package com.zero.core.engine;

import com.zero.core.cache.CacheLookup;
import com.zero.core.cache.CacheManager;
import com.zero.core.model.ExecutionPlan;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.ScanOptions;
import com.zero.core.profile.ProfileResolver;
import com.zero.core.queue.JobQueue;
import com.zero.core.registry.AnalyzerRegistry;
import com.zero.core.scheduler.DependencyScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point used by the REST and CLI layers: resolves the request, plans it,
 * and hands the job to the queue. Reads go straight to the queue and the cache.
 */
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);
    private static final AtomicInteger JOB_COUNTER = new AtomicInteger(0);

    private final AnalyzerRegistry registry;
    private final ProfileResolver profiles;
    private final DependencyScheduler scheduler;
    private final CacheManager cache;
    private final JobQueue queue;
    private final Clock clock;
    private final boolean bestEffortByDefault;

    public ScanService(AnalyzerRegistry registry, ProfileResolver profiles, DependencyScheduler scheduler,
                       CacheManager cache, JobQueue queue, Clock clock, boolean bestEffortByDefault) {
        this.registry = registry;
        this.profiles = profiles;
        this.scheduler = scheduler;
        this.cache = cache;
        this.queue = queue;
        this.clock = clock;
        this.bestEffortByDefault = bestEffortByDefault;
    }

    /** Options for a request that does not set them explicitly. */
    public ScanOptions defaultOptions() {
        return ScanOptions.defaults().withBestEffort(bestEffortByDefault);
    }

    /**
     * Plans and enqueues a scan.
     *
     * @param profileOrAnalyzers profile name, comma separated analyzer ids, or blank for the default profile
     */
    public JobSnapshot submitJob(String target, String profileOrAnalyzers, ScanOptions options) {
        return submit(target, profiles.resolve(profileOrAnalyzers), options);
    }

    public JobSnapshot submitJob(String target, List<String> analyzers, ScanOptions options) {
        return submit(target, profiles.resolve(analyzers), options);
    }

    private JobSnapshot submit(String target, ProfileResolver.Selection selection, ScanOptions options) {
        String normalized = normalizeTarget(target);
        ExecutionPlan plan = scheduler.plan(selection.analyzers(), registry);
        ScanOptions effective = options != null ? options : defaultOptions();
        var unplanned = effective.skip().stream().filter(id -> !plan.analyzers().contains(id)).toList();
        if (!unplanned.isEmpty()) {
            log.info("Skip list names analyzer(s) outside the plan, ignored: {}", unplanned);
        }
        var job = new Job(generateJobId(), normalized, selection.profile(), plan, effective, clock);
        log.info("Submitting job {} for {} with profile {}: {}", job.id(), job.target(), selection.profile(), plan.waves());
        return queue.enqueue(job);
    }

    public JobSnapshot getJob(String jobId) {
        return queue.get(jobId);
    }

    public JobSnapshot cancelJob(String jobId) {
        return queue.cancel(jobId);
    }

    public JobSnapshot awaitJob(String jobId, Duration timeout) throws InterruptedException {
        return queue.await(jobId, timeout);
    }

    public List<JobSnapshot> listActiveJobs() {
        return queue.listActive();
    }

    public List<JobSnapshot> listRecentJobs(Duration window) {
        return queue.listRecent(window);
    }

    public CacheLookup getArtifact(String target, String analyzerId, Duration ttlOverride) {
        return getArtifact(target, analyzerId, ttlOverride, null);
    }

    /**
     * @param commit current commit of the target; when known, the lookup reports whether
     *               the artifact was produced from a different one
     */
    public CacheLookup getArtifact(String target, String analyzerId, Duration ttlOverride, String commit) {
        return cache.lookup(normalizeTarget(target), analyzerId, ttlOverride, commit);
    }

    /**
     * @param analyzerId one analyzer, or null for every artifact of the target
     * @return number of artifacts removed
     */
    public int invalidate(String target, String analyzerId) {
        return cache.invalidate(normalizeTarget(target), analyzerId);
    }

    public List<CacheLookup> freshness(String target) {
        return cache.inspect(normalizeTarget(target));
    }

    /** Resolves and plans without running anything. */
    public PlannedScan plan(String profileOrAnalyzers) {
        var selection = profiles.resolve(profileOrAnalyzers);
        return new PlannedScan(selection.profile(), scheduler.plan(selection.analyzers(), registry));
    }

    /**
     * Generates a unique job ID in the format SCAN-YYYY-NNNN.
     */
    public String generateJobId() {
        int count = JOB_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("SCAN-%d-%04d", year, count);
    }

    // jobs, lookups and invalidation all key the cache by this form
    private static String normalizeTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Target must not be blank");
        }
        return target.strip();
    }

    /** A resolved profile together with its execution plan. */
    public record PlannedScan(String profile, ExecutionPlan plan) {}
}
