package com.zero.core.health;

import com.zero.core.cache.ArtifactStore;
import com.zero.core.cache.FileSystemArtifactStore;
import com.zero.core.queue.JobQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * Actuator health indicator for the artifact store.
 * <p>
 * Reports DOWN when the filesystem store's root exists but is not writable. Includes
 * the backend and current job counts.
 */
@Component("artifactStoreHealthIndicator")
public class ArtifactStoreHealthIndicator implements HealthIndicator {

    private final ArtifactStore store;
    private final JobQueue jobQueue;

    public ArtifactStoreHealthIndicator(ArtifactStore store, JobQueue jobQueue) {
        this.store = store;
        this.jobQueue = jobQueue;
    }

    @Override
    public Health health() {
        var builder = Health.up()
                .withDetail("store", store.describe())
                .withDetail("jobs.tracked", jobQueue.size())
                .withDetail("jobs.active", jobQueue.listActive().size());

        if (store instanceof FileSystemArtifactStore fs && Files.exists(fs.root()) && !Files.isWritable(fs.root())) {
            return builder.down().withDetail("reason", "storage root is not writable").build();
        }
        return builder.build();
    }
}
