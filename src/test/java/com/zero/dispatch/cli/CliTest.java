package com.zero.dispatch.cli;

import com.zero.core.cache.CacheLookup;
import com.zero.core.engine.ScanService;
import com.zero.core.events.EventBus;
import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.model.AnalyzerState;
import com.zero.core.model.Artifact;
import com.zero.core.model.ExecutionPlan;
import com.zero.core.model.FreshnessLevel;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import com.zero.core.model.ScanOptions;
import com.zero.core.profile.ProfileResolver;
import com.zero.core.profile.ScanProfile;
import com.zero.core.profile.UnknownProfileException;
import com.zero.core.registry.AnalyzerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the zero CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");
    private static final String JOB_ID = "SCAN-2026-0001";

    private record CliResult(int exitCode, String output) {}

    private ScanService scanService;
    private AnalyzerRegistry registry;
    private ProfileResolver profileResolver;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        scanService = mock(ScanService.class);
        when(scanService.defaultOptions()).thenReturn(ScanOptions.defaults());

        registry = new AnalyzerRegistry();
        registry.register(AnalyzerDescriptor.of("sbom", Duration.ofHours(24)), ctx -> new byte[0]);
        registry.register(AnalyzerDescriptor.of("package-vulns", Duration.ofHours(1), "sbom"), ctx -> new byte[0]);

        profileResolver = mock(ProfileResolver.class);
        when(profileResolver.profiles()).thenReturn(List.of(
                new ScanProfile("quick", "", List.of("sbom")),
                new ScanProfile("packages", "", List.of("sbom", "package-vulns"))));
        when(profileResolver.defaultProfile()).thenReturn("packages");

        eventBus = new EventBus();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ScanCommand.class) {
                    return (K) new ScanCommand(scanService, eventBus);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(scanService);
                }
                if (cls == FreshnessCommand.class) {
                    return (K) new FreshnessCommand(scanService);
                }
                if (cls == AnalyzersCommand.class) {
                    return (K) new AnalyzersCommand(registry, profileResolver);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ZeroCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static ExecutionPlan packagesPlan() {
        return new ExecutionPlan(List.of("package-vulns"), List.of(List.of("sbom"), List.of("package-vulns")));
    }

    private static JobSnapshot snapshot(JobStatus status, AnalyzerState sbom, AnalyzerState vulns, String error) {
        var analyzers = new LinkedHashMap<String, AnalyzerState>();
        analyzers.put("sbom", sbom);
        analyzers.put("package-vulns", vulns);
        return new JobSnapshot(JOB_ID, "acme/api", "packages", List.of("package-vulns"), packagesPlan(),
                ScanOptions.defaults(), status, analyzers, NOW,
                status == JobStatus.QUEUED ? null : NOW,
                status.isTerminal() ? NOW.plusSeconds(5) : null, error);
    }

    private static JobSnapshot queued() {
        return snapshot(JobStatus.QUEUED, AnalyzerState.pending(), AnalyzerState.pending(), null);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("serve", "scan", "plan", "analyzers", "freshness", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("zero 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: zero"));
        }

        @Test
        @DisplayName("scan without a target is a usage error")
        void scanRequiresTarget() {
            CliResult result = execute("scan");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  Scan command tests
    // =====================================================================

    @Nested
    @DisplayName("scan")
    class ScanTests {

        @Test
        @DisplayName("successful scan exits 0 and prints the summary")
        void successfulScan() throws Exception {
            var done = snapshot(JobStatus.DONE,
                    AnalyzerState.pending().cachedHit(NOW),
                    AnalyzerState.pending().running(NOW).done(NOW.plusMillis(1500)), null);
            when(scanService.submitJob(eq("acme/api"), eq("packages"), any(ScanOptions.class))).thenReturn(queued());
            when(scanService.awaitJob(eq(JOB_ID), any(Duration.class))).thenReturn(done);

            CliResult result = execute("scan", "acme/api", "--profile", "packages");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Job " + JOB_ID));
            assertTrue(result.output().contains("[WAVE 1]"));
            assertTrue(result.output().contains("(cached)"));
            assertTrue(result.output().contains("1s"));
        }

        @Test
        @DisplayName("failed scan exits 1 and prints the error")
        void failedScan() throws Exception {
            var failed = snapshot(JobStatus.ERROR,
                    AnalyzerState.pending().running(NOW).done(NOW),
                    AnalyzerState.pending().running(NOW).failed("feed unreachable", NOW),
                    "analyzer(s) failed: package-vulns");
            when(scanService.submitJob(anyString(), anyString(), any(ScanOptions.class))).thenReturn(queued());
            when(scanService.awaitJob(eq(JOB_ID), any(Duration.class))).thenReturn(failed);

            CliResult result = execute("scan", "acme/api", "-p", "packages");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("feed unreachable"));
        }

        @Test
        @DisplayName("explicit analyzers and options reach the service")
        void analyzerList() throws Exception {
            var cancelled = snapshot(JobStatus.CANCELLED,
                    AnalyzerState.pending().skipped("job cancelled", NOW),
                    AnalyzerState.pending().skipped("job cancelled", NOW), null);
            when(scanService.submitJob(eq("acme/api"), eq(List.of("sbom", "package-vulns")), any(ScanOptions.class)))
                    .thenReturn(queued());
            when(scanService.awaitJob(eq(JOB_ID), any(Duration.class))).thenReturn(cancelled);

            CliResult result = execute("scan", "acme/api", "-a", "sbom,package-vulns",
                    "--force", "--best-effort", "--ttl", "PT30M");

            assertEquals(2, result.exitCode());
            var options = ArgumentCaptor.forClass(ScanOptions.class);
            verify(scanService).submitJob(eq("acme/api"), eq(List.of("sbom", "package-vulns")), options.capture());
            assertTrue(options.getValue().force());
            assertTrue(options.getValue().bestEffort());
            assertEquals(Duration.ofMinutes(30), options.getValue().ttlOverride());
        }

        @Test
        @DisplayName("--skip and --commit reach the service")
        void skipAndCommit() throws Exception {
            var done = snapshot(JobStatus.DONE,
                    AnalyzerState.pending().skipped("excluded by request", NOW),
                    AnalyzerState.pending().skipped("excluded by request", NOW), null);
            when(scanService.submitJob(eq("acme/api"), eq("packages"), any(ScanOptions.class))).thenReturn(queued());
            when(scanService.awaitJob(eq(JOB_ID), any(Duration.class))).thenReturn(done);

            CliResult result = execute("scan", "acme/api", "-p", "packages",
                    "--skip", "sbom,code-secrets", "--commit", "abc123");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("excluded by request"));
            var options = ArgumentCaptor.forClass(ScanOptions.class);
            verify(scanService).submitJob(eq("acme/api"), eq("packages"), options.capture());
            assertEquals(List.of("sbom", "code-secrets"), options.getValue().skip());
            assertEquals("abc123", options.getValue().commit());
        }

        @Test
        @DisplayName("rejected scan exits 1")
        void rejectedScan() {
            when(scanService.submitJob(anyString(), anyString(), any(ScanOptions.class)))
                    .thenThrow(new UnknownProfileException("paranoid"));

            CliResult result = execute("scan", "acme/api", "-p", "paranoid");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Scan rejected"));
            assertTrue(result.output().contains("paranoid"));
        }

        @Test
        @DisplayName("exit codes follow the job status")
        void exitCodes() {
            assertEquals(0, ScanCommand.exitCode(JobStatus.DONE));
            assertEquals(1, ScanCommand.exitCode(JobStatus.ERROR));
            assertEquals(2, ScanCommand.exitCode(JobStatus.CANCELLED));
            assertEquals(2, ScanCommand.exitCode(JobStatus.RUNNING));
        }
    }

    // =====================================================================
    //  Catalog command tests
    // =====================================================================

    @Nested
    @DisplayName("plan, analyzers and freshness")
    class CatalogTests {

        @Test
        @DisplayName("plan prints the waves")
        void plan() {
            when(scanService.plan("packages")).thenReturn(new ScanService.PlannedScan("packages", packagesPlan()));

            CliResult result = execute("plan", "packages");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 analyzer(s) in 2 wave(s)"));
            assertTrue(result.output().contains("[WAVE 2]"));
        }

        @Test
        @DisplayName("plan with an unknown profile exits 1")
        void planUnknownProfile() {
            when(scanService.plan("nope")).thenThrow(new UnknownProfileException("nope"));

            CliResult result = execute("plan", "nope");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("nope"));
        }

        @Test
        @DisplayName("analyzers lists the catalog and marks the default profile")
        void analyzers() {
            CliResult result = execute("analyzers");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("needs sbom"));
            assertTrue(result.output().contains("*packages"));
        }

        @Test
        @DisplayName("freshness shows levels per artifact")
        void freshness() {
            var artifact = Artifact.ok("acme/api", "sbom", new byte[0], NOW);
            when(scanService.freshness("acme/api")).thenReturn(List.of(
                    new CacheLookup("acme/api", "sbom", artifact, FreshnessLevel.VERY_STALE,
                            Duration.ofDays(3), Duration.ofHours(24))));

            CliResult result = execute("freshness", "acme/api");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Very Stale"));
            assertTrue(result.output().contains("3d 0h"));
        }

        @Test
        @DisplayName("freshness with nothing stored says so")
        void freshnessEmpty() {
            when(scanService.freshness("acme/api")).thenReturn(List.of());

            CliResult result = execute("freshness", "acme/api");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No artifacts stored"));
        }
    }

    // =====================================================================
    //  Formatting tests
    // =====================================================================

    @Test
    @DisplayName("durations are formatted compactly")
    void formatDuration() {
        assertEquals("250ms", ConsoleOutput.formatDuration(Duration.ofMillis(250)));
        assertEquals("42s", ConsoleOutput.formatDuration(Duration.ofSeconds(42)));
        assertEquals("3m 5s", ConsoleOutput.formatDuration(Duration.ofSeconds(185)));
        assertEquals("24h 0m", ConsoleOutput.formatDuration(Duration.ofHours(24)));
        assertEquals("3d 0h", ConsoleOutput.formatDuration(Duration.ofHours(72)));
    }

    @Test
    @DisplayName("events show their analyzer")
    void watchEvent() {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        try {
            ConsoleOutput.watchEvent("analyzer.failed", "package-vulns", "feed unreachable");
        } finally {
            System.setOut(originalOut);
        }
        assertTrue(capture.toString().contains("[FAILED]"));
        assertTrue(capture.toString().contains("package-vulns feed unreachable"));
    }
}
