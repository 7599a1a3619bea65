package com.reqflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: reqflow serve
 * <p>
 * Starts Reqflow as a long-running HTTP server exposing the REST API and SSE event streams.
 * The web server is enabled by {@link com.reqflow.ReqflowApplication#main} detecting "serve"
 * in args; {@link CliRunner} then skips picocli, and the banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 reqflow serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Reqflow HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Reqflow server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/workflows");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
