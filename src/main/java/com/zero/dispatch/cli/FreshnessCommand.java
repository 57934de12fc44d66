package com.zero.dispatch.cli;

import com.zero.core.engine.ScanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: zero freshness &lt;target&gt;
 * <p>
 * Shows how fresh every stored artifact of a target is.
 */
@Command(name = "freshness", mixinStandardHelpOptions = true, description = "Show artifact freshness for a target")
@Component
public class FreshnessCommand implements Runnable {

    @Parameters(index = "0", description = "Target repository, e.g. owner/repo")
    private String target;

    private final ScanService scanService;

    public FreshnessCommand(ScanService scanService) {
        this.scanService = scanService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var lookups = scanService.freshness(target);
        if (lookups.isEmpty()) {
            ConsoleOutput.info("No artifacts stored for " + target);
            return;
        }
        ConsoleOutput.info(target + ": " + lookups.size() + " artifact(s)");
        for (var lookup : lookups) {
            ConsoleOutput.freshness(lookup.analyzerId(), lookup.freshness(), lookup.age(), lookup.ttl(),
                    lookup.artifact().isOk());
        }
    }
}
