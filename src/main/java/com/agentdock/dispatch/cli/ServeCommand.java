package com.agentdock.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentdock serve
 * <p>
 * Starts the HTTP server. This is also what a bare {@code agentdock} does.
 * In serve mode {@link CliRunner} skips picocli, so the banner is printed once
 * Tomcat reports its port.
 * <p>
 * Configure the bind address via {@code AGENT_HOST} and {@code AGENT_PORT}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the agentdock HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8092}")
    private int port;

    @Value("${server.address:127.0.0.1}")
    private String address;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(address, port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(address, event.getWebServer().getPort());
    }

    private static void printBanner(String address, int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("agentdock server listening on " + address + ":" + port);
        System.out.println();
        System.out.println("  Tasks:   http://" + address + ":" + port + "/tasks");
        System.out.println("  Health:  http://" + address + ":" + port + "/healthz");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
