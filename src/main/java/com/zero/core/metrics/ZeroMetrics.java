package com.zero.core.metrics;

import com.zero.core.model.AnalyzerStatus;
import com.zero.core.model.CacheDecision;
import com.zero.core.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for scan execution.
 */
@Service
public class ZeroMetrics {

    private final MeterRegistry registry;

    public ZeroMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(JobStatus status) {
        Counter.builder("zero.jobs.total")
                .description("Scan jobs by terminal status")
                .tag("status", tag(status.name()))
                .register(registry)
                .increment();
    }

    public void recordAnalyzerRun(String analyzerId, AnalyzerStatus status, long ms) {
        Timer.builder("zero.analyzer.duration")
                .description("Analyzer run time, cache hits excluded")
                .tag("analyzer", analyzerId)
                .tag("status", tag(status.name()))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheDecision(CacheDecision decision) {
        Counter.builder("zero.cache.lookups")
                .description("Cache lookups by decision")
                .tag("decision", tag(decision.name()))
                .register(registry)
                .increment();
    }

    /**
     * Records the number of analyzers dispatched together in one wave.
     *
     * @param analyzerCount analyzers in the wave, cached ones included
     */
    public void recordWaveSize(int analyzerCount) {
        DistributionSummary.builder("zero.wave.size")
                .description("Analyzers per wave")
                .register(registry)
                .record(analyzerCount);
    }

    /**
     * @param reason "queue_full" or "conflicting_run"
     */
    public void recordQueueRejection(String reason) {
        Counter.builder("zero.queue.rejections")
                .description("Scan submissions refused by the job queue")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
