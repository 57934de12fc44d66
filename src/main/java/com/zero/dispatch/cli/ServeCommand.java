package com.zero.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: zero serve
 * <p>
 * Starts the long-running HTTP server exposing the REST API and SSE event streaming.
 * The web server is enabled by {@link com.zero.ZeroApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli. The startup banner is
 * printed once the embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 zero serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the zero HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("zero server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Health:     http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
