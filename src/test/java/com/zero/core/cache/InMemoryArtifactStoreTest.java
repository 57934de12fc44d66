package com.zero.core.cache;

import com.zero.core.model.Artifact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryArtifactStoreTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();

    private static Artifact ok(String target, String id) {
        return Artifact.ok(target, id, id.getBytes(StandardCharsets.UTF_8), Instant.EPOCH);
    }

    @Test
    @DisplayName("put replaces the previous artifact for the key")
    void replace() {
        store.put(ok("t", "sbom"));
        var newer = Artifact.ok("t", "sbom", new byte[]{1}, Instant.EPOCH.plusSeconds(60));
        store.put(newer);
        assertEquals(newer, store.get("t", "sbom").orElseThrow());
    }

    @Test
    @DisplayName("list is sorted and scoped by target")
    void list() {
        store.put(ok("t", "tech-id"));
        store.put(ok("t", "sbom"));
        store.put(ok("u", "sbom"));
        assertEquals(List.of("sbom", "tech-id"), store.list("t").stream().map(Artifact::analyzerId).toList());
    }

    @Test
    @DisplayName("remove and removeAll report what they removed")
    void remove() {
        store.put(ok("t", "sbom"));
        store.put(ok("t", "tech-id"));
        assertTrue(store.remove("t", "sbom"));
        assertFalse(store.remove("t", "sbom"));
        assertEquals(1, store.removeAll("t"));
        assertEquals("memory", store.describe());
    }

    @Test
    @DisplayName("putUnlessOk keeps an OK artifact")
    void putUnlessOk() {
        assertTrue(store.putUnlessOk(Artifact.error("t", "sbom", "boom", Instant.EPOCH)));
        store.put(ok("t", "sbom"));
        assertFalse(store.putUnlessOk(Artifact.error("t", "sbom", "boom again", Instant.EPOCH)));
        assertTrue(store.get("t", "sbom").orElseThrow().isOk());
    }

    @Test
    @DisplayName("an OK write racing error writes is never overwritten")
    void okSurvivesConcurrentErrorWrites() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(5);
        try {
            for (int round = 0; round < 200; round++) {
                String id = "sbom-" + round;
                var start = new CountDownLatch(1);
                var futures = new ArrayList<Future<?>>();
                for (int w = 0; w < 4; w++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        store.putUnlessOk(Artifact.error("t", id, "boom", Instant.EPOCH));
                        return null;
                    }));
                }
                futures.add(pool.submit(() -> {
                    start.await();
                    store.put(ok("t", id));
                    return null;
                }));
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
                assertTrue(store.get("t", id).orElseThrow().isOk(), "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
