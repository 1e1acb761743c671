package com.keystone.broker;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opens Model Context Protocol clients over stdio subprocesses or SSE endpoints.
 * <p>
 * For STDIO the endpoint is a command line split on whitespace; for SSE it is the server's
 * base URL.
 */
@Component
public class McpConnectionFactory implements ToolConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(McpConnectionFactory.class);

    private final ToolBrokerProperties properties;

    public McpConnectionFactory(ToolBrokerProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean supports(ToolTransport transport) {
        return transport == ToolTransport.STDIO || transport == ToolTransport.SSE;
    }

    @Override
    public ToolConnection open(ToolServerConfig config) {
        if (config.endpoint().isBlank()) {
            throw new ToolException(ToolErrorKind.NOT_CONFIGURED, "Server '" + config.serverId() + "' has no endpoint");
        }
        McpClientTransport transport = switch (config.transport()) {
            case STDIO -> stdioTransport(config);
            case SSE -> HttpClientSseClientTransport.builder(config.endpoint()).build();
            case LOCAL -> throw new IllegalArgumentException("LOCAL transport is not MCP");
        };
        McpSyncClient client = McpClient.sync(transport)
                .requestTimeout(properties.getRequestTimeout())
                .initializationTimeout(properties.getConnectTimeout())
                .build();
        try {
            client.initialize();
        } catch (RuntimeException e) {
            closeQuietly(config.serverId(), client);
            throw new ToolException(ToolErrorKind.REMOTE_ERROR,
                    "Failed to initialize MCP server '" + config.serverId() + "': " + e.getMessage(), e);
        }
        log.info("MCP server '{}' connected over {} ({})", config.serverId(), config.transport(), config.endpoint());
        return new McpToolConnection(config, client);
    }

    private StdioClientTransport stdioTransport(ToolServerConfig config) {
        String[] parts = config.endpoint().trim().split("\\s+");
        var params = ServerParameters.builder(parts[0])
                .args(Arrays.asList(parts).subList(1, parts.length))
                .env(config.env())
                .build();
        return new StdioClientTransport(params);
    }

    private static void closeQuietly(String serverId, McpSyncClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.debug("Error closing MCP client for '{}': {}", serverId, e.getMessage());
        }
    }

    static final class McpToolConnection implements ToolConnection {

        private final ToolServerConfig config;
        private final McpSyncClient client;

        McpToolConnection(ToolServerConfig config, McpSyncClient client) {
            this.config = config;
            this.client = client;
        }

        @Override
        public List<ToolDescriptor> listTools() {
            var result = client.listTools();
            if (result.tools() == null) {
                return List.of();
            }
            return result.tools().stream()
                    .map(t -> new ToolDescriptor(config.serverId(), t.name(), t.description(),
                            schemaToMap(t.inputSchema()), config.capabilityTags()))
                    .toList();
        }

        @Override
        public ToolReply call(String toolName, Map<String, Object> args) {
            McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, args));
            List<String> texts = new ArrayList<>();
            if (result.content() != null) {
                for (McpSchema.Content content : result.content()) {
                    if (content instanceof McpSchema.TextContent text) {
                        texts.add(text.text());
                    } else {
                        texts.add("[" + content.getClass().getSimpleName() + "]");
                    }
                }
            }
            String joined = String.join("\n", texts);
            return Boolean.TRUE.equals(result.isError()) ? ToolReply.error(joined) : ToolReply.ok(joined);
        }

        @Override
        public void ping() {
            client.ping();
        }

        @Override
        public void close() {
            closeQuietly(config.serverId(), client);
        }

        private static Map<String, Object> schemaToMap(McpSchema.JsonSchema schema) {
            Map<String, Object> map = new LinkedHashMap<>();
            if (schema == null) {
                return map;
            }
            map.put("type", schema.type() == null ? "object" : schema.type());
            map.put("properties", schema.properties() == null ? Map.of() : schema.properties());
            map.put("required", schema.required() == null ? List.of() : schema.required());
            return map;
        }
    }
}
