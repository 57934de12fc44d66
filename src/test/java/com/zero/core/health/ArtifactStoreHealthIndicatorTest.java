package com.zero.core.health;

import com.zero.core.cache.FileSystemArtifactStore;
import com.zero.core.cache.InMemoryArtifactStore;
import com.zero.core.queue.JobQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ArtifactStoreHealthIndicatorTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("in-memory store reports UP with job counts")
    void inMemoryStore() {
        var queue = mock(JobQueue.class);
        when(queue.size()).thenReturn(3);
        when(queue.listActive()).thenReturn(List.of());

        var health = new ArtifactStoreHealthIndicator(new InMemoryArtifactStore(), queue).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("memory", health.getDetails().get("store"));
        assertEquals(3, health.getDetails().get("jobs.tracked"));
        assertEquals(0, health.getDetails().get("jobs.active"));
    }

    @Test
    @DisplayName("writable filesystem store reports UP")
    void fileSystemStore() {
        var queue = mock(JobQueue.class);
        when(queue.listActive()).thenReturn(List.of());
        var store = new FileSystemArtifactStore(root);

        var health = new ArtifactStoreHealthIndicator(store, queue).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(store.describe(), health.getDetails().get("store"));
        assertFalse(health.getDetails().containsKey("reason"));
    }
}
