package com.tenantgate.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tenantgate serve
 * <p>
 * Starts the HTTP server exposing the chat API and the WebSocket tunnel. The web
 * server is enabled by {@link com.tenantgate.TenantgateApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli and the banner is printed
 * once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Tenantgate HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tenantgate server running on port " + port);
        System.out.println();
        System.out.println("  Chat:       POST http://localhost:" + port + "/chat");
        System.out.println("  Stream:     POST http://localhost:" + port + "/chat/stream");
        System.out.println("  WebSocket:  ws://localhost:" + port + "/ws/chat");
        System.out.println("  Health:     http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
