package com.zero.dispatch.cli;

import com.zero.core.profile.ProfileResolver;
import com.zero.core.registry.AnalyzerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: zero analyzers
 * <p>
 * Lists registered analyzers with their dependencies and TTLs, then the profiles.
 */
@Command(name = "analyzers", mixinStandardHelpOptions = true, description = "List analyzers and profiles")
@Component
public class AnalyzersCommand implements Runnable {

    private final AnalyzerRegistry registry;
    private final ProfileResolver profileResolver;

    public AnalyzersCommand(AnalyzerRegistry registry, ProfileResolver profileResolver) {
        this.registry = registry;
        this.profileResolver = profileResolver;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.println("ANALYZERS:");
        for (var d : registry.descriptors()) {
            System.out.printf("  %-22s ttl %-8s %s%n", d.id(), ConsoleOutput.formatDuration(d.defaultTtl()),
                    d.dependencies().isEmpty() ? "" : "needs " + String.join(", ", d.dependencies()));
        }
        System.out.println();
        System.out.println("PROFILES:");
        for (var p : profileResolver.profiles()) {
            String marker = p.name().equals(profileResolver.defaultProfile()) ? "*" : " ";
            System.out.printf(" %s%-12s %s%n", marker, p.name(), String.join(", ", p.analyzers()));
        }
    }
}
