package com.keystone.dispatch.cli;

import com.keystone.core.engine.FatalRunException;
import com.keystone.core.engine.RunNotFoundException;
import com.keystone.core.llm.LlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Bridges picocli with the Spring Boot lifecycle and maps run failures to exit codes.
 * <p>
 * Exit codes: 0 success, 1 failure, 2 unknown run, 3 run aborted, 4 model unusable.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_RUN_NOT_FOUND = 2;
    static final int EXIT_RUN_ABORTED = 3;
    static final int EXIT_LLM_UNUSABLE = 4;

    private final KeystoneCommand keystoneCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(KeystoneCommand keystoneCommand, IFactory factory) {
        this.keystoneCommand = keystoneCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve keeps the JVM alive through the embedded web server; picocli would return at once
        if (isServe(args)) {
            return;
        }
        exitCode = commandLine(keystoneCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(KeystoneCommand root, IFactory factory) {
        return new CommandLine(root, factory).setExecutionExceptionHandler(CliRunner::handle);
    }

    /**
     * True when the subcommand is {@code serve}. Only the first positional argument counts,
     * so a goal that happens to contain the word does not start a server.
     */
    public static boolean isServe(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    private static int handle(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof FatalRunException fatal) {
            ConsoleOutput.error("Run " + fatal.getRunId() + " aborted: " + fatal.getMessage());
            return EXIT_RUN_ABORTED;
        }
        if (ex instanceof RunNotFoundException) {
            ConsoleOutput.error(ex.getMessage());
            return EXIT_RUN_NOT_FOUND;
        }
        if (ex instanceof LlmException llm) {
            ConsoleOutput.error("Model reply unusable for " + llm.getTargetType() + ": " + llm.getMessage());
            return EXIT_LLM_UNUSABLE;
        }
        log.error("keystone {} failed", commandLine.getCommandName(), ex);
        ConsoleOutput.error(commandLine.getCommandName() + " failed: " + ex.getMessage());
        return 1;
    }
}
