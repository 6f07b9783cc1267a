package com.socmind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: socmind serve
 * <p>
 * Starts the REST API and SSE streams. The web server is enabled by
 * {@link com.socmind.SocmindApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode, so {@link #run()} only serves {@code --help}
 * and direct invocation. The banner is printed once the web server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the SocMind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("SocMind server running on port " + port);
        System.out.println();
        System.out.println("  Tasks:        http://localhost:" + port + "/api/v1/tasks");
        System.out.println("  Escalations:  http://localhost:" + port + "/api/v1/escalations");
        System.out.println("  Health:       http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
