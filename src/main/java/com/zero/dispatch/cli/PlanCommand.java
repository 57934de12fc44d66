package com.zero.dispatch.cli;

import com.zero.core.engine.ScanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: zero plan [profile]
 * <p>
 * Prints the execution waves for a profile or analyzer list without running anything.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan for a profile")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Profile name or comma separated analyzer ids")
    private String profile;

    private final ScanService scanService;

    public PlanCommand(ScanService scanService) {
        this.scanService = scanService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var planned = scanService.plan(profile);
            ConsoleOutput.info("Profile " + planned.profile() + ": " + planned.plan().analyzers().size()
                    + " analyzer(s) in " + planned.plan().waveCount() + " wave(s)");
            ConsoleOutput.plan(planned.plan().waves());
            return 0;
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
