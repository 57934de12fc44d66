package com.zero.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Analyzer that shells out to an external tool via {@link ProcessBuilder} and uses
 * its stdout as the artifact payload.
 * <p>
 * Command placeholders:
 * <ul>
 *   <li>{@code {target}}: the scan target</li>
 *   <li>{@code {dep:<id>}}: path of a temp file holding dependency {@code <id>}'s payload</li>
 * </ul>
 * The tool also sees {@code ZERO_TARGET} and {@code ZERO_ANALYZER} in its environment.
 * A non-zero exit status fails the run with the tail of stderr.
 */
public class CommandAnalyzer implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(CommandAnalyzer.class);

    static final Pattern DEPENDENCY_PLACEHOLDER = Pattern.compile("\\{dep:([^}]+)}");
    private static final int STDERR_TAIL_CHARS = 500;

    private final List<String> command;
    private final Path workingDirectory;

    public CommandAnalyzer(List<String> command) {
        this(command, null);
    }

    public CommandAnalyzer(List<String> command, Path workingDirectory) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command analyzer needs a non-empty command");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public byte[] run(AnalyzerContext context) throws Exception {
        Path scratch = Files.createTempDirectory("zero-" + context.analyzerId().replaceAll("[^A-Za-z0-9_-]", "_"));
        try {
            List<String> resolved = resolveCommand(context, scratch);
            Path stdout = scratch.resolve("stdout");
            Path stderr = scratch.resolve("stderr");

            var builder = new ProcessBuilder(resolved)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            builder.environment().put("ZERO_TARGET", context.target());
            builder.environment().put("ZERO_ANALYZER", context.analyzerId());

            log.debug("Running {} for {}: {}", context.analyzerId(), context.target(), resolved);
            Process process = builder.start();
            try {
                long waitMs = Math.max(1, context.remaining().toMillis());
                if (!process.waitFor(waitMs, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new TimeoutException("Command for " + context.analyzerId()
                            + " did not finish within its deadline");
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw e;
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IOException("Command for " + context.analyzerId() + " exited with status "
                        + exitCode + ": " + tail(stderr));
            }
            return Files.readAllBytes(stdout);
        } finally {
            deleteQuietly(scratch);
        }
    }

    /**
     * Substitutes placeholders, materialising dependency payloads under {@code scratch}.
     */
    List<String> resolveCommand(AnalyzerContext context, Path scratch) throws IOException {
        var resolved = new ArrayList<String>(command.size());
        for (String arg : command) {
            String value = arg.replace("{target}", context.target());
            Matcher matcher = DEPENDENCY_PLACEHOLDER.matcher(value);
            var sb = new StringBuilder();
            while (matcher.find()) {
                String dependencyId = matcher.group(1);
                Path file = scratch.resolve("dep-" + dependencyId.replaceAll("[^A-Za-z0-9_-]", "_") + ".json");
                if (!Files.exists(file)) {
                    Files.write(file, context.dependencyPayload(dependencyId));
                }
                matcher.appendReplacement(sb, Matcher.quoteReplacement(file.toString()));
            }
            matcher.appendTail(sb);
            resolved.add(sb.toString());
        }
        return resolved;
    }

    private static String tail(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            return text.length() <= STDERR_TAIL_CHARS ? text : text.substring(text.length() - STDERR_TAIL_CHARS);
        } catch (IOException e) {
            return "(stderr unavailable: " + e.getMessage() + ")";
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
