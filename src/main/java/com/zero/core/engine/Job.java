package com.zero.core.engine;

import com.zero.core.model.AnalyzerState;
import com.zero.core.model.ExecutionPlan;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import com.zero.core.model.ScanOptions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Live, mutable state of one scan job.
 * <p>
 * All mutable fields are guarded by the job's lock; readers only ever get a
 * {@link JobSnapshot} copied under that lock. Once the job reaches a terminal status
 * nothing about it changes any more.
 */
public class Job {

    /** Result of a cancellation request. */
    public enum CancelOutcome {
        /** Job had not started; it is now CANCELLED. */
        CANCELLED_WHILE_QUEUED,
        /** Job is running; the engine stops at the next wave boundary. */
        CANCELLATION_REQUESTED,
        /** Job was already DONE, ERROR or CANCELLED. */
        ALREADY_TERMINAL
    }

    static final String CANCELLED_REASON = "job cancelled";
    static final String EXCLUDED_REASON = "excluded by request";

    private final String id;
    private final String target;
    private final String profile;
    private final ExecutionPlan plan;
    private final ScanOptions options;
    private final Instant createdAt;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, AnalyzerState> analyzers = new LinkedHashMap<>();
    private final Map<String, RunHandle> inFlight = new ConcurrentHashMap<>();
    private final CountDownLatch terminal = new CountDownLatch(1);

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;
    private volatile boolean cancelRequested;

    public Job(String id, String target, String profile, ExecutionPlan plan, ScanOptions options, Clock clock) {
        this.id = id;
        this.target = target;
        this.profile = profile;
        this.plan = plan;
        this.options = options != null ? options : ScanOptions.defaults();
        this.clock = clock;
        this.createdAt = clock.instant();
        for (String analyzerId : plan.analyzers()) {
            analyzers.put(analyzerId, AnalyzerState.pending());
        }
    }

    public String id() {
        return id;
    }

    public String target() {
        return target;
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public ScanOptions options() {
        return options;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public JobStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isCancellationRequested() {
        return cancelRequested;
    }

    /**
     * QUEUED to RUNNING.
     *
     * @return false if the job was cancelled before it could start
     */
    boolean markRunning() {
        synchronized (lock) {
            if (status != JobStatus.QUEUED) {
                return false;
            }
            status = JobStatus.RUNNING;
            startedAt = clock.instant();
            return true;
        }
    }

    AnalyzerState analyzerState(String analyzerId) {
        synchronized (lock) {
            return analyzers.get(analyzerId);
        }
    }

    /**
     * Applies a state transition to one analyzer. Ignored once the analyzer or the
     * job is terminal, so late results cannot rewrite history.
     *
     * @return true if the transition was applied
     */
    boolean updateAnalyzer(String analyzerId, UnaryOperator<AnalyzerState> transition) {
        synchronized (lock) {
            AnalyzerState current = analyzers.get(analyzerId);
            if (current == null || current.status().isTerminal() || status.isTerminal()) {
                return false;
            }
            analyzers.put(analyzerId, transition.apply(current));
            return true;
        }
    }

    /** Analyzers still PENDING or RUNNING, in plan order. */
    List<String> unfinishedAnalyzers() {
        synchronized (lock) {
            var ids = new ArrayList<String>();
            analyzers.forEach((analyzerId, state) -> {
                if (!state.status().isTerminal()) {
                    ids.add(analyzerId);
                }
            });
            return ids;
        }
    }

    void registerRun(String analyzerId, RunHandle handle) {
        inFlight.put(analyzerId, handle);
        // cancel() may have raced with registration
        if (cancelRequested) {
            handle.cancel();
        }
    }

    void unregisterRun(String analyzerId) {
        inFlight.remove(analyzerId);
    }

    /**
     * Requests cancellation. A queued job is cancelled on the spot; a running job is
     * flagged and its in-flight runs are interrupted.
     */
    public CancelOutcome cancel() {
        synchronized (lock) {
            if (status.isTerminal()) {
                return CancelOutcome.ALREADY_TERMINAL;
            }
            cancelRequested = true;
            if (status == JobStatus.QUEUED) {
                Instant now = clock.instant();
                analyzers.replaceAll((analyzerId, state) -> state.skipped(CANCELLED_REASON, now));
                complete(JobStatus.CANCELLED, null, now);
                return CancelOutcome.CANCELLED_WHILE_QUEUED;
            }
        }
        inFlight.values().forEach(RunHandle::cancel);
        return CancelOutcome.CANCELLATION_REQUESTED;
    }

    /**
     * Moves the job to a terminal status. Analyzers that never reached a terminal state
     * are recorded as SKIPPED with {@code skipReason}.
     */
    void finish(JobStatus finalStatus, String errorMessage, String skipReason) {
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            Instant now = clock.instant();
            analyzers.replaceAll((analyzerId, state) ->
                    state.status().isTerminal() ? state : state.skipped(skipReason, now));
            complete(finalStatus, errorMessage, now);
        }
    }

    private void complete(JobStatus finalStatus, String errorMessage, Instant now) {
        status = finalStatus;
        error = errorMessage;
        finishedAt = now;
        terminal.countDown();
    }

    /**
     * Blocks until the job is terminal or the timeout elapses.
     *
     * @return true if the job is terminal
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public JobSnapshot snapshot() {
        synchronized (lock) {
            return new JobSnapshot(id, target, profile, plan.requested(), plan, options, status,
                    analyzers, createdAt, startedAt, finishedAt, error);
        }
    }

    /** When the job reached a terminal status, or null. */
    public Instant finishedAt() {
        synchronized (lock) {
            return finishedAt;
        }
    }
}
