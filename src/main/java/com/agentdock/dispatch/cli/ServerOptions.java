package com.agentdock.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Shared {@code --url} option for subcommands that talk to a running server.
 */
public class ServerOptions {

    @Option(names = {"--url", "-u"}, description = "Server base URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${AGENTDOCK_URL:-http://localhost:8092}")
    String url;

    public String baseUrl() {
        String base = url != null ? url.trim() : "http://localhost:8092";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
