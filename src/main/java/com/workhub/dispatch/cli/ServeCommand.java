package com.workhub.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: workhub serve
 * <p>
 * Starts the HTTP server exposing the REST API and SSE notification streams.
 * The web server is enabled by {@link com.workhub.WorkhubApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli, and the banner is printed
 * once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the WorkHub agent HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reachable via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("WorkHub agent running on port " + port);
        System.out.println();
        System.out.println("  Messages:       POST http://localhost:" + port + "/api/v1/messages");
        System.out.println("  Manager alerts: GET  http://localhost:" + port + "/api/v1/notifications/managers/stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
