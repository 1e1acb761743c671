package com.keystone.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Built-in {@code run_command} tool. Commands run through {@code sh -c} in the workspace
 * root; the process is destroyed when its timeout passes or the calling thread is
 * interrupted by a cancel or deadline.
 */
@Component
public class ShellToolProvider implements LocalToolProvider {

    private static final Logger log = LoggerFactory.getLogger(ShellToolProvider.class);

    private static final int MAX_OUTPUT_CHARS = 20_000;

    private final Path workdir;
    private final Duration defaultTimeout;

    public ShellToolProvider(ToolBrokerProperties properties) {
        this.workdir = Path.of(properties.getWorkspaceRoot()).toAbsolutePath().normalize();
        this.defaultTimeout = properties.getShellTimeout();
    }

    @Override
    public String name() {
        return "shell";
    }

    @Override
    public List<ToolDescriptor> describe(String serverId) {
        return List.of(new ToolDescriptor(serverId, "run_command", "Run a shell command in the workspace",
                FilesystemToolProvider.schema(Map.of(
                        "command", FilesystemToolProvider.string("Command line passed to sh -c"),
                        "timeout_seconds", Map.of("type", "integer", "description", "Kill the command after this many seconds")),
                        List.of("command")),
                List.of("shell", "os")));
    }

    @Override
    public ToolReply call(String toolName, Map<String, Object> args) {
        if (!"run_command".equals(toolName)) {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "Unknown shell tool: " + toolName);
        }
        Object command = args.get("command");
        if (command == null || command.toString().isBlank()) {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "Missing 'command' argument");
        }
        Duration timeout = timeout(args.get("timeout_seconds"));
        Path output = null;
        Process process = null;
        try {
            Files.createDirectories(workdir);
            output = Files.createTempFile("keystone-shell-", ".out");
            process = new ProcessBuilder("sh", "-c", command.toString())
                    .directory(workdir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolException(ToolErrorKind.TIMEOUT, "Command timed out after " + timeout.toSeconds() + "s");
            }
            // invalid UTF-8 sequences decode to U+FFFD
            String text = truncate(new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
            int exit = process.exitValue();
            return exit == 0 ? ToolReply.ok(text) : ToolReply.error("exit " + exit + ": " + text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolException(ToolErrorKind.CANCELLED, "Command interrupted", e);
        } catch (IOException e) {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, "Command failed to start: " + e.getMessage(), e);
        } finally {
            if (process != null && process.isAlive()) {
                log.info("Destroying shell process for '{}'", command);
                process.destroyForcibly();
            }
            deleteOutput(output);
        }
    }

    private Duration timeout(Object raw) {
        if (raw == null) {
            return defaultTimeout;
        }
        try {
            long seconds = Long.parseLong(raw.toString());
            return seconds > 0 ? Duration.ofSeconds(seconds) : defaultTimeout;
        } catch (NumberFormatException e) {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "timeout_seconds must be an integer", e);
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_OUTPUT_CHARS ? text : text.substring(0, MAX_OUTPUT_CHARS) + "\n[truncated]";
    }

    private static void deleteOutput(Path output) {
        if (output == null) {
            return;
        }
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", output, e.getMessage());
        }
    }
}
