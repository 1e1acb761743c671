package com.keystone.core.health;

import com.keystone.broker.ConnectionMode;
import com.keystone.broker.ToolBroker;
import com.keystone.broker.ToolServerConfig;
import com.keystone.broker.ToolTransport;
import com.keystone.core.graph.AttemptGraph;
import com.keystone.core.llm.LlmProperties;
import com.keystone.core.memory.MemoryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns graph, tools, memory, llm components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("graph", "tools", "memory", "llm"), results.stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("All components null -> graph, tools, memory DOWN and llm DEGRADED")
    void allComponentsNull() {
        var results = new HealthCheckService(null, null, null, null).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "graph").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "tools").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "memory").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "llm").status());
    }

    @Test
    @DisplayName("Graph and memory available -> UP")
    void graphAndMemoryUp() {
        var memory = mock(MemoryStore.class);
        when(memory.size()).thenReturn(7);
        var results = new HealthCheckService(mock(AttemptGraph.class), null, memory, null).checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "graph").status());
        HealthStatus memoryStatus = component(results, "memory");
        assertEquals(HealthStatus.Status.UP, memoryStatus.status());
        assertEquals("7 strategy record(s)", memoryStatus.detail());
    }

    @Test
    @DisplayName("Some tool servers unreachable -> tools DEGRADED, disabled servers are not pinged")
    void toolsDegraded() {
        var broker = mock(ToolBroker.class);
        when(broker.servers()).thenReturn(List.of(
                ToolServerConfig.local("filesystem", "filesystem"),
                ToolServerConfig.local("shell", "shell"),
                new ToolServerConfig("remote", ToolTransport.SSE, "http://localhost:1", false,
                        ConnectionMode.POOLED, List.of(), Map.of())));
        when(broker.ping("filesystem")).thenReturn(true);
        when(broker.ping("shell")).thenThrow(new IllegalStateException("spawn failed"));

        HealthStatus tools = component(new HealthCheckService(null, broker, null, null).checkAll(), "tools");

        assertEquals(HealthStatus.Status.DEGRADED, tools.status());
        assertEquals("1 of 2 tool servers unreachable", tools.detail());
        assertEquals(Map.of("filesystem", "UP", "shell", "DOWN", "remote", "disabled"), tools.metadata());
        verify(broker, never()).ping("remote");
    }

    @Test
    @DisplayName("All tool servers reachable -> tools UP")
    void toolsUp() {
        var broker = mock(ToolBroker.class);
        when(broker.servers()).thenReturn(List.of(ToolServerConfig.local("filesystem", "filesystem")));
        when(broker.ping("filesystem")).thenReturn(true);

        assertEquals(HealthStatus.Status.UP,
                component(new HealthCheckService(null, broker, null, null).checkAll(), "tools").status());
    }

    @Test
    @DisplayName("No enabled tool servers -> tools DOWN")
    void noEnabledServers() {
        var broker = mock(ToolBroker.class);
        when(broker.servers()).thenReturn(List.of());

        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(null, broker, null, null).checkAll(), "tools").status());
    }

    @Test
    @DisplayName("API key configured -> llm UP with the model in metadata")
    void llmConfigured() {
        var llm = new LlmProperties();
        llm.setApiKey("sk-test");
        llm.setModel("gpt-4o-mini");

        HealthStatus status = component(new HealthCheckService(null, null, null, llm).checkAll(), "llm");

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("gpt-4o-mini", status.metadata().get("model"));
    }

    @Test
    @DisplayName("Placeholder API key -> llm DEGRADED")
    void llmPlaceholderKey() {
        var llm = new LlmProperties();
        llm.setApiKey("not-set");

        assertEquals(HealthStatus.Status.DEGRADED,
                component(new HealthCheckService(null, null, null, llm).checkAll(), "llm").status());
    }

    @Test
    @DisplayName("overall is the worst status, and no checks at all is DOWN")
    void overallIsWorst() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(HealthStatus.up("graph", "ok"))));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(
                HealthStatus.up("graph", "ok"), HealthStatus.degraded("llm", "no key"))));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(
                HealthStatus.down("tools", "none"), HealthStatus.degraded("llm", "no key"))));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of()));
    }

    @Test
    @DisplayName("metadata keeps server order and is read-only")
    void metadataOrder() {
        var servers = new LinkedHashMap<String, String>();
        servers.put("shell", "UP");
        servers.put("filesystem", "DOWN");
        servers.put("github", "disabled");

        HealthStatus status = HealthStatus.degraded("tools", "1 of 2 tool servers unreachable").withMetadata(servers);

        assertEquals(List.of("shell", "filesystem", "github"), List.copyOf(status.metadata().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> status.metadata().put("x", "y"));
    }
}
