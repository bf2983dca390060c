package com.healloop.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: healloop serve
 * <p>
 * Starts Healloop as a long-running HTTP server exposing the review REST API.
 * The web server is enabled by {@link com.healloop.HealloopApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli and the banner
 * is printed once the embedded server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Healloop HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached from --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Healloop server running on port " + port);
        System.out.println();
        System.out.println("  Proposals:  http://localhost:" + port + "/api/v1/proposals");
        System.out.println("  Telemetry:  http://localhost:" + port + "/api/v1/telemetry");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
