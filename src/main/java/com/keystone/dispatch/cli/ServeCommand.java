package com.keystone.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: keystone serve
 * <p>
 * Starts Keystone as a long-running HTTP server exposing the REST API and SSE
 * event streaming. The web server is enabled by
 * {@link com.keystone.KeystoneApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once the
 * server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Keystone HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        String base = "http://localhost:" + port + "/api/v1";
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Keystone governor listening on port " + port);
        System.out.println();
        System.out.println("  Tasks:      " + base + "/tasks   (events: /tasks/{id}/events)");
        System.out.println("  Proposals:  " + base + "/proposals");
        System.out.println("  Canon:      " + base + "/policy");
        System.out.println("  Audit:      " + base + "/audit");
        System.out.println("  Health:     " + base + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
