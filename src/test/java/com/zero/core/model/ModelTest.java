package com.zero.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant T0 = Instant.parse("2026-02-01T08:00:00Z");

    // -- Artifact -------------------------------------------------------------

    @Nested
    class ArtifactTests {

        @Test
        @DisplayName("payload is defensively copied")
        void payloadCopied() {
            byte[] raw = "{}".getBytes(StandardCharsets.UTF_8);
            var artifact = Artifact.ok("acme/api", "sbom", raw, T0);
            raw[0] = 'x';
            artifact.payload()[1] = 'y';

            assertEquals("{}", artifact.payloadAsString());
        }

        @Test
        @DisplayName("age is never negative")
        void age() {
            var artifact = Artifact.ok("acme/api", "sbom", new byte[0], T0);
            assertEquals(Duration.ofMinutes(5), artifact.age(T0.plusSeconds(300)));
            assertEquals(Duration.ZERO, artifact.age(T0.minusSeconds(60)));
        }

        @Test
        @DisplayName("error artifacts carry a message and no payload")
        void errorArtifact() {
            var artifact = Artifact.error("acme/api", "sbom", "boom", T0);
            assertFalse(artifact.isOk());
            assertEquals(0, artifact.payload().length);
            assertEquals("boom", artifact.error());
        }

        @Test
        @DisplayName("equality compares payload contents")
        void equality() {
            var a = Artifact.ok("acme/api", "sbom", new byte[]{1, 2}, T0);
            var b = Artifact.ok("acme/api", "sbom", new byte[]{1, 2}, T0);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }
    }

    // -- ExecutionPlan --------------------------------------------------------

    @Nested
    class ExecutionPlanTests {

        private final ExecutionPlan plan = new ExecutionPlan(List.of("package-vulns", "tech-id"),
                List.of(List.of("sbom", "tech-id"), List.of("package-vulns")));

        @Test
        @DisplayName("analyzers are listed wave by wave")
        void analyzersInOrder() {
            assertEquals(List.of("sbom", "tech-id", "package-vulns"), plan.analyzers());
            assertEquals(2, plan.waveCount());
        }

        @Test
        @DisplayName("wave index and requested membership")
        void lookups() {
            assertEquals(OptionalInt.of(1), plan.waveIndexOf("package-vulns"));
            assertTrue(plan.waveIndexOf("devops").isEmpty());
            assertTrue(plan.isRequested("tech-id"));
            assertFalse(plan.isRequested("sbom"));
        }
    }

    // -- Statuses -------------------------------------------------------------

    @Nested
    class StatusTests {

        @Test
        @DisplayName("terminal job statuses")
        void jobStatus() {
            assertFalse(JobStatus.QUEUED.isTerminal());
            assertFalse(JobStatus.RUNNING.isTerminal());
            assertTrue(JobStatus.DONE.isTerminal());
            assertTrue(JobStatus.ERROR.isTerminal());
            assertTrue(JobStatus.CANCELLED.isTerminal());
        }

        @Test
        @DisplayName("failed and skipped analyzers block dependents")
        void analyzerStatus() {
            assertTrue(AnalyzerStatus.FAILED.blocksDependents());
            assertTrue(AnalyzerStatus.SKIPPED.blocksDependents());
            assertFalse(AnalyzerStatus.DONE.blocksDependents());
            assertFalse(AnalyzerStatus.RUNNING.isTerminal());
        }

        @Test
        @DisplayName("a cache hit is DONE with no duration")
        void cachedHit() {
            var state = AnalyzerState.pending().cachedHit(T0);
            assertEquals(AnalyzerStatus.DONE, state.status());
            assertTrue(state.cached());
            assertEquals(0, state.durationMs());
        }
    }

    @Test
    @DisplayName("scan options helpers keep the other fields")
    void scanOptions() {
        var options = new ScanOptions(false, false, Duration.ofMinutes(5)).withForce(true).withBestEffort(true);
        assertTrue(options.force());
        assertTrue(options.bestEffort());
        assertEquals(Duration.ofMinutes(5), options.ttlOverride());
    }
}
