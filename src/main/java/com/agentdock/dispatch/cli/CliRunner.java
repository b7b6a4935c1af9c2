package com.agentdock.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentdockCommand agentdockCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentdockCommand agentdockCommand, IFactory factory) {
        this.agentdockCommand = agentdockCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli would
        // return immediately and let main() finish before Tomcat is ready.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(agentdockCommand, factory).execute(args);
    }

    static boolean isServeMode(String... args) {
        if (args.length == 0) {
            return true;
        }
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
