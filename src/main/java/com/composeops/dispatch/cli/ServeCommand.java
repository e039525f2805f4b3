package com.composeops.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: composeops serve
 * <p>
 * Starts the HTTP server exposing the REST API and SSE connections. The web server is
 * enabled by {@link com.composeops.ComposeOpsApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode. The banner is printed once the
 * embedded server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the ComposeOps HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; registered for --help
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("ComposeOps server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events/stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
