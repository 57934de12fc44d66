package com.zero.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "zero")
public class ZeroProperties {

    private Scan scan = new Scan();
    private Cache cache = new Cache();
    private Storage storage = new Storage();
    /** Analyzer catalog; map order is registration order. */
    private Map<String, AnalyzerProperties> analyzers = new LinkedHashMap<>();
    private Map<String, ProfileProperties> profiles = new LinkedHashMap<>();

    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Map<String, AnalyzerProperties> getAnalyzers() { return analyzers; }
    public void setAnalyzers(Map<String, AnalyzerProperties> analyzers) { this.analyzers = analyzers; }
    public Map<String, ProfileProperties> getProfiles() { return profiles; }
    public void setProfiles(Map<String, ProfileProperties> profiles) { this.profiles = profiles; }

    public static class Scan {
        private int parallelRepos = 2;
        private int parallelScanners = 4;
        private Duration analyzerTimeout = Duration.ofMinutes(5);
        private int queueCapacity = 32;
        private Duration retention = Duration.ofHours(1);
        private String defaultProfile = "standard";

        public int getParallelRepos() { return parallelRepos; }
        public void setParallelRepos(int parallelRepos) { this.parallelRepos = parallelRepos; }
        public int getParallelScanners() { return parallelScanners; }
        public void setParallelScanners(int parallelScanners) { this.parallelScanners = parallelScanners; }
        public Duration getAnalyzerTimeout() { return analyzerTimeout; }
        public void setAnalyzerTimeout(Duration analyzerTimeout) { this.analyzerTimeout = analyzerTimeout; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public String getDefaultProfile() { return defaultProfile; }
        public void setDefaultProfile(String defaultProfile) { this.defaultProfile = defaultProfile; }
    }

    public static class Cache {
        private Duration defaultTtl = Duration.ofHours(24);
        private int staleMultiplier = 7;
        private int veryStaleMultiplier = 30;
        /** Accept STALE artifacts when a request does not say otherwise. */
        private boolean bestEffort = false;

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
        public int getStaleMultiplier() { return staleMultiplier; }
        public void setStaleMultiplier(int staleMultiplier) { this.staleMultiplier = staleMultiplier; }
        public int getVeryStaleMultiplier() { return veryStaleMultiplier; }
        public void setVeryStaleMultiplier(int veryStaleMultiplier) { this.veryStaleMultiplier = veryStaleMultiplier; }
        public boolean isBestEffort() { return bestEffort; }
        public void setBestEffort(boolean bestEffort) { this.bestEffort = bestEffort; }
    }

    public static class Storage {
        /** "filesystem" or "memory". */
        private String type = "filesystem";
        private String path = ".zero";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class AnalyzerProperties {
        private String description = "";
        private List<String> dependencies = new ArrayList<>();
        /** Falls back to {@code zero.cache.default-ttl}. */
        private Duration ttl;
        /** Falls back to {@code zero.scan.analyzer-timeout}. */
        private Duration timeout;
        private List<String> command = new ArrayList<>();
        private boolean enabled = true;

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getDependencies() { return dependencies; }
        public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ProfileProperties {
        private String description = "";
        private List<String> analyzers = new ArrayList<>();

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getAnalyzers() { return analyzers; }
        public void setAnalyzers(List<String> analyzers) { this.analyzers = analyzers; }
    }
}
