package com.keystone.core.security;

import com.keystone.broker.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DangerGateTest {

    private DangerGateProperties properties;
    private DangerGate gate;

    @BeforeEach
    void setUp() {
        properties = new DangerGateProperties();
        gate = new DangerGate(properties);
    }

    private static ToolCall shell(String command) {
        return new ToolCall("shell", "run_command", Map.of("command", command), Instant.now().plusSeconds(15));
    }

    @Test
    @DisplayName("default deny-list holds destructive commands")
    void defaultDenyList() {
        assertEquals("rm -rf /", gate.check(shell("rm -rf /var/lib")).orElseThrow());
        assertTrue(gate.requiresApproval(shell("mkfs.ext4 /dev/sdb1")));
        assertFalse(gate.requiresApproval(shell("ls -la /tmp")));
    }

    @Test
    @DisplayName("substring patterns ignore case")
    void caseInsensitive() {
        assertTrue(gate.requiresApproval(shell("DD IF=/dev/zero of=/dev/sda")));
    }

    @Test
    @DisplayName("glob and regex patterns are supported")
    void globAndRegex() {
        properties.setDenyPatterns(List.of("drop * table", "regex:git\\s+push\\s+--force"));

        assertTrue(gate.requiresApproval(shell("psql -c 'DROP users TABLE'")));
        assertTrue(gate.requiresApproval(shell("git push   --force origin main")));
        assertFalse(gate.requiresApproval(shell("git push origin main")));
    }

    @Test
    @DisplayName("allow patterns win over deny patterns")
    void allowWins() {
        properties.setAllowPatterns(List.of("rm -rf /tmp/keystone-scratch"));

        assertFalse(gate.requiresApproval(shell("rm -rf /tmp/keystone-scratch")));
        assertTrue(gate.requiresApproval(shell("rm -rf /home")));
    }

    @Test
    @DisplayName("tool name takes part in matching")
    void toolNameMatches() {
        properties.setDenyPatterns(List.of("delete_file"));
        var call = new ToolCall("filesystem", "delete_file", Map.of("path", "/tmp/a"), Instant.now().plusSeconds(5));
        assertTrue(gate.requiresApproval(call));
    }
}
