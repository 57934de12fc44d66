package com.zero.core.config;

import com.zero.core.cache.ArtifactStore;
import com.zero.core.cache.CacheManager;
import com.zero.core.cache.FileSystemArtifactStore;
import com.zero.core.cache.FreshnessPolicy;
import com.zero.core.cache.InMemoryArtifactStore;
import com.zero.core.cache.RunClaims;
import com.zero.core.engine.ExecutionEngine;
import com.zero.core.engine.ScanService;
import com.zero.core.events.EventBus;
import com.zero.core.metrics.ZeroMetrics;
import com.zero.core.profile.ProfileResolver;
import com.zero.core.queue.JobQueue;
import com.zero.core.registry.AnalyzerRegistry;
import com.zero.core.scheduler.DependencyScheduler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the orchestration core from {@link ZeroProperties}. Core classes take plain
 * values, so they are constructed here rather than scanned.
 */
@Configuration
public class ZeroCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "zero.storage.type", havingValue = "filesystem", matchIfMissing = true)
    public ArtifactStore fileSystemArtifactStore(ZeroProperties properties) {
        return new FileSystemArtifactStore(Path.of(properties.getStorage().getPath()));
    }

    @Bean
    @ConditionalOnProperty(name = "zero.storage.type", havingValue = "memory")
    public ArtifactStore inMemoryArtifactStore() {
        return new InMemoryArtifactStore();
    }

    @Bean
    public CacheManager cacheManager(ArtifactStore store, AnalyzerRegistry registry, ZeroProperties properties,
                                     Clock clock, @Autowired(required = false) ZeroMetrics metrics) {
        var cache = properties.getCache();
        return new CacheManager(store, registry,
                new FreshnessPolicy(cache.getStaleMultiplier(), cache.getVeryStaleMultiplier()),
                cache.getDefaultTtl(), clock, metrics);
    }

    @Bean
    public RunClaims runClaims() {
        return new RunClaims();
    }

    @Bean
    public DependencyScheduler dependencyScheduler() {
        return new DependencyScheduler();
    }

    @Bean
    public ExecutionEngine executionEngine(AnalyzerRegistry registry, CacheManager cacheManager, RunClaims runClaims,
                                           EventBus eventBus, @Autowired(required = false) ZeroMetrics metrics,
                                           ZeroProperties properties, Clock clock) {
        var scan = properties.getScan();
        return new ExecutionEngine(registry, cacheManager, runClaims, eventBus, metrics,
                scan.getParallelScanners(), scan.getAnalyzerTimeout(), clock);
    }

    @Bean
    public JobQueue jobQueue(ExecutionEngine engine, ZeroProperties properties, Clock clock,
                             EventBus eventBus, @Autowired(required = false) ZeroMetrics metrics) {
        var scan = properties.getScan();
        return new JobQueue(engine, scan.getParallelRepos(), scan.getQueueCapacity(), scan.getRetention(),
                clock, eventBus, metrics);
    }

    @Bean
    public ScanService scanService(AnalyzerRegistry registry, ProfileResolver profileResolver,
                                   DependencyScheduler scheduler, CacheManager cacheManager,
                                   JobQueue jobQueue, ZeroProperties properties, Clock clock) {
        return new ScanService(registry, profileResolver, scheduler, cacheManager, jobQueue, clock,
                properties.getCache().isBestEffort());
    }
}
