package com.keystone.core.health;

import com.keystone.broker.ToolBroker;
import com.keystone.broker.ToolServerConfig;
import com.keystone.core.graph.AttemptGraph;
import com.keystone.core.llm.LlmProperties;
import com.keystone.core.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AttemptGraph attemptGraph;
    private final ToolBroker toolBroker;
    private final MemoryStore memoryStore;
    private final LlmProperties llmProperties;

    public HealthCheckService(
            @Autowired(required = false) AttemptGraph attemptGraph,
            @Autowired(required = false) ToolBroker toolBroker,
            @Autowired(required = false) MemoryStore memoryStore,
            @Autowired(required = false) LlmProperties llmProperties) {
        this.attemptGraph = attemptGraph;
        this.toolBroker = toolBroker;
        this.memoryStore = memoryStore;
        this.llmProperties = llmProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkToolServers());
        results.add(checkMemory());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkGraph() {
        if (attemptGraph != null) {
            return HealthStatus.up("graph", "Attempt graph compiled and available");
        }
        return HealthStatus.down("graph", "Attempt graph not available");
    }

    private HealthStatus checkToolServers() {
        if (toolBroker == null) {
            return HealthStatus.down("tools", "No ToolBroker configured");
        }
        Map<String, String> servers = new LinkedHashMap<>();
        int enabled = 0;
        int down = 0;
        for (ToolServerConfig server : toolBroker.servers()) {
            if (!server.enabled()) {
                servers.put(server.serverId(), "disabled");
                continue;
            }
            enabled++;
            boolean up;
            try {
                up = toolBroker.ping(server.serverId());
            } catch (RuntimeException e) {
                log.warn("Tool server {} health check failed: {}", server.serverId(), e.getMessage());
                up = false;
            }
            servers.put(server.serverId(), up ? "UP" : "DOWN");
            if (!up) {
                down++;
            }
        }
        if (enabled == 0) {
            return HealthStatus.down("tools", "No enabled tool servers").withMetadata(servers);
        }
        if (down == enabled) {
            return HealthStatus.down("tools", "All tool servers unreachable").withMetadata(servers);
        }
        if (down > 0) {
            return HealthStatus.degraded("tools", down + " of " + enabled + " tool servers unreachable")
                    .withMetadata(servers);
        }
        return HealthStatus.up("tools", enabled + " tool server(s) reachable").withMetadata(servers);
    }

    private HealthStatus checkMemory() {
        if (memoryStore == null) {
            return HealthStatus.down("memory", "No MemoryStore configured");
        }
        return HealthStatus.up("memory", memoryStore.size() + " strategy record(s)");
    }

    private HealthStatus checkLlm() {
        if (llmProperties == null || !llmProperties.hasApiKey()) {
            return HealthStatus.degraded("llm", "No API key configured; LLM planner and verifier will fail");
        }
        return HealthStatus.up("llm", "Provider " + llmProperties.getProvider() + " configured")
                .withMetadata(Map.of("model", String.valueOf(llmProperties.getModel())));
    }
}
