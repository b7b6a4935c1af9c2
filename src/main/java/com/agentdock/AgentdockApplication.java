package com.agentdock;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class AgentdockApplication {

    public static void main(String[] args) {
        // No arguments means serve: the container entrypoint runs the JAR bare.
        if (args.length == 0) {
            args = new String[]{"serve"};
        }

        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AgentdockApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // Client subcommands talk to a running server over HTTP
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "logging.level.root=WARN"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
