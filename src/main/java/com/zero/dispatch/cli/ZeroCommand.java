package com.zero.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, scan, plan, analyzers, freshness.
 */
@Command(
        name = "zero",
        mixinStandardHelpOptions = true,
        version = "zero 0.1.0",
        description = "Repository analyzer orchestration: dependency-ordered scans with cached artifacts",
        subcommands = {
                ServeCommand.class,
                ScanCommand.class,
                PlanCommand.class,
                AnalyzersCommand.class,
                FreshnessCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ZeroCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
