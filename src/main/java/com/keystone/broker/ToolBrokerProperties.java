package com.keystone.broker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the tool broker and its servers, bound from {@code keystone.tools.*}.
 *
 * <pre>
 * keystone:
 *   tools:
 *     default-deadline: 30s
 *     servers:
 *       - server-id: filesystem
 *         transport: LOCAL
 *         endpoint: filesystem
 *       - server-id: browser
 *         transport: STDIO
 *         endpoint: npx -y @playwright/mcp
 *         connection-mode: SPAWN_PER_CALL
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "keystone.tools")
public class ToolBrokerProperties {

    /** Deadline applied to calls that carry none tighter. */
    private Duration defaultDeadline = Duration.ofSeconds(30);

    /** MCP request timeout; the broker's own deadline usually fires first. */
    private Duration requestTimeout = Duration.ofSeconds(60);

    private Duration connectTimeout = Duration.ofSeconds(30);

    private Duration descriptorTtl = Duration.ofMinutes(5);

    private Duration poolIdleTtl = Duration.ofMinutes(10);

    private int maxConcurrentCalls = 16;

    private Duration restartBackoffBase = Duration.ofMillis(500);

    private int maxRestartAttempts = 5;

    /** Root directory the built-in filesystem and shell providers are confined to. */
    private String workspaceRoot = System.getProperty("user.home") + "/keystone-workspace";

    private Duration shellTimeout = Duration.ofSeconds(120);

    private List<Server> servers = new ArrayList<>();

    public Duration getDefaultDeadline() {
        return defaultDeadline;
    }

    public void setDefaultDeadline(Duration defaultDeadline) {
        this.defaultDeadline = defaultDeadline;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getDescriptorTtl() {
        return descriptorTtl;
    }

    public void setDescriptorTtl(Duration descriptorTtl) {
        this.descriptorTtl = descriptorTtl;
    }

    public Duration getPoolIdleTtl() {
        return poolIdleTtl;
    }

    public void setPoolIdleTtl(Duration poolIdleTtl) {
        this.poolIdleTtl = poolIdleTtl;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public Duration getRestartBackoffBase() {
        return restartBackoffBase;
    }

    public void setRestartBackoffBase(Duration restartBackoffBase) {
        this.restartBackoffBase = restartBackoffBase;
    }

    public int getMaxRestartAttempts() {
        return maxRestartAttempts;
    }

    public void setMaxRestartAttempts(int maxRestartAttempts) {
        this.maxRestartAttempts = maxRestartAttempts;
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public Duration getShellTimeout() {
        return shellTimeout;
    }

    public void setShellTimeout(Duration shellTimeout) {
        this.shellTimeout = shellTimeout;
    }

    public List<Server> getServers() {
        return servers;
    }

    public void setServers(List<Server> servers) {
        this.servers = servers;
    }

    /**
     * Validated server list.
     *
     * @throws IllegalStateException on duplicate server ids
     */
    public List<ToolServerConfig> toServerConfigs() {
        List<ToolServerConfig> configs = new ArrayList<>();
        for (Server server : servers) {
            ToolServerConfig config = server.toConfig();
            if (configs.stream().anyMatch(c -> c.serverId().equals(config.serverId()))) {
                throw new IllegalStateException("Duplicate tool server id: " + config.serverId());
            }
            configs.add(config);
        }
        return configs;
    }

    public static class Server {

        private String serverId;
        private ToolTransport transport = ToolTransport.LOCAL;
        private String endpoint = "";
        private boolean enabled = true;
        private ConnectionMode connectionMode = ConnectionMode.POOLED;
        private List<String> capabilityTags = new ArrayList<>();
        private Map<String, String> env = new HashMap<>();

        public String getServerId() {
            return serverId;
        }

        public void setServerId(String serverId) {
            this.serverId = serverId;
        }

        public ToolTransport getTransport() {
            return transport;
        }

        public void setTransport(ToolTransport transport) {
            this.transport = transport;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public ConnectionMode getConnectionMode() {
            return connectionMode;
        }

        public void setConnectionMode(ConnectionMode connectionMode) {
            this.connectionMode = connectionMode;
        }

        public List<String> getCapabilityTags() {
            return capabilityTags;
        }

        public void setCapabilityTags(List<String> capabilityTags) {
            this.capabilityTags = capabilityTags;
        }

        public Map<String, String> getEnv() {
            return env;
        }

        public void setEnv(Map<String, String> env) {
            this.env = env;
        }

        public ToolServerConfig toConfig() {
            return new ToolServerConfig(serverId, transport, endpoint, enabled, connectionMode, capabilityTags, env);
        }
    }
}
