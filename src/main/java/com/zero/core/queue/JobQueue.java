package com.zero.core.queue;

import com.zero.core.cache.ConflictingRunException;
import com.zero.core.engine.ExecutionEngine;
import com.zero.core.engine.Job;
import com.zero.core.events.EventBus;
import com.zero.core.events.ZeroEvent;
import com.zero.core.logging.MdcContext;
import com.zero.core.metrics.ZeroMetrics;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits scan jobs and runs at most {@code parallelRepos} of them at a time.
 * <p>
 * Jobs wait FIFO in the worker pool's queue; {@code capacity} bounds how many may be
 * waiting. A job for a target that overlaps, in analyzers, with an active job for the
 * same target is refused so the same artifact is never produced twice concurrently.
 * Finished jobs stay queryable for {@code retention}, then a background sweeper
 * evicts them.
 */
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final ExecutionEngine engine;
    private final int parallelRepos;
    private final int capacity;
    private final Duration retention;
    private final Clock clock;
    private final EventBus eventBus;
    private final ZeroMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final ExecutorService workers;
    private ScheduledExecutorService sweeper;

    public JobQueue(ExecutionEngine engine, int parallelRepos, int capacity, Duration retention,
                    Clock clock, EventBus eventBus, ZeroMetrics metrics) {
        if (parallelRepos < 1) {
            throw new IllegalArgumentException("parallelRepos must be at least 1, got " + parallelRepos);
        }
        this.engine = engine;
        this.parallelRepos = parallelRepos;
        this.capacity = capacity;
        this.retention = retention;
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(parallelRepos, r -> {
            Thread t = new Thread(r, "zero-job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        long periodMs = Math.max(1_000, Math.min(retention.toMillis() / 2, 60_000));
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "zero-job-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::evictExpired, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Job queue started: parallelRepos={}, capacity={}, retention={}", parallelRepos, capacity, retention);
    }

    @PreDestroy
    public void shutdown() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        for (JobSnapshot active : listActive()) {
            cancelQuietly(active.id());
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Job queue stopped");
    }

    /**
     * Admits a job.
     *
     * @throws QueueFullException       if {@code capacity} jobs are already waiting
     * @throws ConflictingRunException  if an active job for the same target shares analyzers
     */
    public JobSnapshot enqueue(Job job) {
        synchronized (lock) {
            long waiting = jobs.values().stream().filter(j -> j.status() == JobStatus.QUEUED).count();
            if (waiting >= capacity) {
                reject("queue_full");
                throw new QueueFullException(capacity);
            }
            List<String> overlap = overlappingAnalyzers(job);
            if (!overlap.isEmpty()) {
                reject("conflicting_run");
                throw new ConflictingRunException(job.target(), overlap);
            }
            jobs.put(job.id(), job);
        }
        log.info("Queued job {} for {} ({} analyzer(s))", job.id(), job.target(), job.plan().analyzers().size());
        if (eventBus != null) {
            eventBus.publish(ZeroEvent.of("job.queued", job.id(), null,
                    Map.of("target", job.target()), clock.instant()));
        }
        workers.execute(() -> run(job));
        return job.snapshot();
    }

    private void run(Job job) {
        try {
            engine.execute(job);
        } catch (RuntimeException e) {
            MdcContext.setJob(job.id());
            log.error("Job {} failed outside the engine: {}", job.id(), e.getMessage(), e);
            MdcContext.clear();
        }
    }

    private List<String> overlappingAnalyzers(Job candidate) {
        Set<String> wanted = candidate.plan().analyzerSet();
        var overlap = new ArrayList<String>();
        for (Job active : jobs.values()) {
            if (!active.status().isTerminal() && active.target().equals(candidate.target())) {
                for (String analyzerId : active.plan().analyzers()) {
                    if (wanted.contains(analyzerId) && !overlap.contains(analyzerId)) {
                        overlap.add(analyzerId);
                    }
                }
            }
        }
        return overlap;
    }

    /**
     * @throws JobNotFoundException if the job is unknown or evicted
     */
    public JobSnapshot get(String jobId) {
        return find(jobId).snapshot();
    }

    /**
     * Cancels a job. A queued job ends CANCELLED immediately; a running job stops at
     * its next wave boundary.
     *
     * @throws JobNotFoundException         if the job is unknown or evicted
     * @throws JobAlreadyTerminalException if the job has already finished
     */
    public JobSnapshot cancel(String jobId) {
        Job job = find(jobId);
        switch (job.cancel()) {
            case ALREADY_TERMINAL -> throw new JobAlreadyTerminalException(jobId, job.status());
            case CANCELLED_WHILE_QUEUED -> {
                log.info("Cancelled queued job {}", jobId);
                if (metrics != null) {
                    metrics.recordJobResult(JobStatus.CANCELLED);
                }
                if (eventBus != null) {
                    eventBus.publish(ZeroEvent.of("job.cancelled", jobId, null, Map.of(), clock.instant()));
                }
            }
            case CANCELLATION_REQUESTED -> log.info("Cancellation requested for running job {}", jobId);
        }
        return job.snapshot();
    }

    /**
     * Waits for a job to reach a terminal status.
     *
     * @return the latest snapshot, terminal unless the timeout elapsed first
     */
    public JobSnapshot await(String jobId, Duration timeout) throws InterruptedException {
        Job job = find(jobId);
        job.awaitTermination(timeout);
        return job.snapshot();
    }

    /** QUEUED and RUNNING jobs, oldest first. */
    public List<JobSnapshot> listActive() {
        return snapshots().stream()
                .filter(s -> !s.isTerminal())
                .toList();
    }

    /** Jobs created within {@code window}, newest first. */
    public List<JobSnapshot> listRecent(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return snapshots().stream()
                .filter(s -> !s.createdAt().isBefore(cutoff))
                .sorted(Comparator.comparing(JobSnapshot::createdAt).reversed())
                .toList();
    }

    /**
     * Removes terminal jobs that finished more than {@code retention} ago.
     *
     * @return number of jobs evicted
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        synchronized (lock) {
            var it = jobs.values().iterator();
            while (it.hasNext()) {
                Job job = it.next();
                Instant finishedAt = job.finishedAt();
                if (job.status().isTerminal() && finishedAt != null && finishedAt.isBefore(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} finished job(s) older than {}", evicted, retention);
        }
        return evicted;
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    private List<JobSnapshot> snapshots() {
        List<Job> copy;
        synchronized (lock) {
            copy = new ArrayList<>(jobs.values());
        }
        return copy.stream().map(Job::snapshot).toList();
    }

    private Job find(String jobId) {
        synchronized (lock) {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            return job;
        }
    }

    private void reject(String reason) {
        if (metrics != null) {
            metrics.recordQueueRejection(reason);
        }
    }

    private void cancelQuietly(String jobId) {
        try {
            cancel(jobId);
        } catch (JobNotFoundException | JobAlreadyTerminalException e) {
            log.debug("Job {} finished during shutdown: {}", jobId, e.getMessage());
        }
    }
}
