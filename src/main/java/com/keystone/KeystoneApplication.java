package com.keystone;

import com.keystone.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KeystoneApplication {

    public static void main(String[] args) {
        // Containers start the jar without arguments; KEYSTONE_MODE=serve selects the server.
        if (args.length == 0 && "serve".equalsIgnoreCase(System.getenv("KEYSTONE_MODE"))) {
            args = new String[]{"serve"};
        }

        boolean serveMode = CliRunner.isServe(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(KeystoneApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
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
