package com.keystone.broker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ShellToolProviderTest {

    @TempDir
    Path workspace;

    private ShellToolProvider provider;

    @BeforeEach
    void setUp() {
        var properties = new ToolBrokerProperties();
        properties.setWorkspaceRoot(workspace.toString());
        provider = new ShellToolProvider(properties);
    }

    @Test
    @DisplayName("runs the command in the workspace and returns its output")
    void runsCommand() {
        ToolReply reply = provider.call("run_command", Map.of("command", "echo hello && pwd"));

        assertFalse(reply.error());
        assertTrue(reply.text().startsWith("hello"));
        assertTrue(reply.text().contains(workspace.getFileName().toString()));
    }

    @Test
    @DisplayName("output that is not valid UTF-8 is decoded with replacement characters")
    void nonUtf8Output() {
        ToolReply reply = provider.call("run_command", Map.of("command", "printf 'caf\\351\\n'"));

        assertFalse(reply.error());
        assertEquals("caf\uFFFD\n", reply.text());
    }

    @Test
    @DisplayName("non-zero exit is a tool-level error")
    void nonZeroExit() {
        ToolReply reply = provider.call("run_command", Map.of("command", "exit 3"));
        assertTrue(reply.error());
        assertTrue(reply.text().startsWith("exit 3"));
    }

    @Test
    @DisplayName("commands past their timeout are killed")
    void timeout() {
        var ex = assertThrows(ToolException.class,
                () -> provider.call("run_command", Map.of("command", "sleep 10", "timeout_seconds", 1)));
        assertEquals(ToolErrorKind.TIMEOUT, ex.getKind());
    }

    @Test
    @DisplayName("missing command is INVALID_ARGS")
    void missingCommand() {
        var ex = assertThrows(ToolException.class, () -> provider.call("run_command", Map.of()));
        assertEquals(ToolErrorKind.INVALID_ARGS, ex.getKind());
    }
}
