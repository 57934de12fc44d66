package com.zero.dispatch.cli;

import com.zero.core.engine.ScanService;
import com.zero.core.events.EventBus;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import com.zero.core.model.ScanOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: zero scan &lt;target&gt;
 * <p>
 * Submits a scan, prints progress events as they happen and a per-analyzer summary at
 * the end. Exit code 0 when the job is DONE, 1 on ERROR, 2 when cancelled or still
 * running after {@code --wait}.
 */
@Command(name = "scan", mixinStandardHelpOptions = true, description = "Scan a repository")
@Component
public class ScanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Target repository, e.g. owner/repo")
    private String target;

    @Option(names = {"--profile", "-p"}, description = "Scan profile (default: configured default profile)")
    private String profile;

    @Option(names = {"--analyzers", "-a"}, split = ",", description = "Explicit analyzer ids, comma separated")
    private List<String> analyzers;

    @Option(names = "--force", description = "Ignore cached artifacts and re-run everything")
    private boolean force;

    @Option(names = "--best-effort", description = "Reuse stale artifacts instead of re-running")
    private Boolean bestEffort;

    @Option(names = "--skip", split = ",", description = "Analyzer ids to leave out, comma separated; dependents are left out too")
    private List<String> skip;

    @Option(names = "--commit", description = "Current commit of the target; artifacts from other commits are re-run")
    private String commit;

    @Option(names = "--ttl", description = "Freshness TTL override, ISO-8601 (e.g. PT1H)")
    private Duration ttl;

    @Option(names = "--wait", description = "How long to wait for the job (default: ${DEFAULT-VALUE})",
            defaultValue = "PT2H")
    private Duration wait;

    private final ScanService scanService;
    private final EventBus eventBus;

    public ScanCommand(ScanService scanService, EventBus eventBus) {
        this.scanService = scanService;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();

        var defaults = scanService.defaultOptions();
        var options = new ScanOptions(force, bestEffort != null ? bestEffort : defaults.bestEffort(), ttl,
                skip, commit);

        // the CLI process runs only this job, so every event is ours
        EventBus.Subscription subscription = eventBus.subscribeAll(event ->
                ConsoleOutput.watchEvent(event.eventType(), event.analyzerId(), describe(event.payload())));
        try {
            JobSnapshot submitted;
            try {
                submitted = analyzers != null && !analyzers.isEmpty()
                        ? scanService.submitJob(target, analyzers, options)
                        : scanService.submitJob(target, profile, options);
            } catch (RuntimeException e) {
                ConsoleOutput.error("Scan rejected: " + e.getMessage());
                return 1;
            }
            ConsoleOutput.info("Job " + submitted.id() + " (" + submitted.profile() + ") for " + submitted.target());
            ConsoleOutput.plan(submitted.plan().waves());

            JobSnapshot result = scanService.awaitJob(submitted.id(), wait);
            ConsoleOutput.jobSummary(result);
            return exitCode(result.status());
        } finally {
            subscription.unsubscribe();
        }
    }

    static int exitCode(JobStatus status) {
        return switch (status) {
            case DONE -> 0;
            case ERROR -> 1;
            default -> 2;
        };
    }

    private static String describe(Map<String, Object> payload) {
        if (payload.containsKey("error")) return String.valueOf(payload.get("error"));
        if (payload.containsKey("reason")) return String.valueOf(payload.get("reason"));
        if (payload.containsKey("wave")) return "wave " + payload.get("wave");
        if (payload.containsKey("durationMs")) return payload.get("durationMs") + "ms";
        return "";
    }
}
