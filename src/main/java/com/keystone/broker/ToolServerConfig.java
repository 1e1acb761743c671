package com.keystone.broker;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated description of one tool server.
 *
 * @param serverId       unique server name, also used as a call's server hint
 * @param transport      how to reach it
 * @param endpoint       provider name (LOCAL), command line (STDIO) or base URL (SSE)
 * @param enabled        disabled servers are never contacted
 * @param connectionMode pooled or spawn-per-call
 * @param capabilityTags free-form tags copied onto every discovered descriptor
 * @param env            extra environment for STDIO subprocesses
 */
public record ToolServerConfig(
        String serverId,
        ToolTransport transport,
        String endpoint,
        boolean enabled,
        ConnectionMode connectionMode,
        List<String> capabilityTags,
        Map<String, String> env
) {

    public ToolServerConfig {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(transport, "transport");
        if (serverId.isBlank()) {
            throw new IllegalArgumentException("serverId must not be blank");
        }
        endpoint = endpoint == null ? "" : endpoint;
        connectionMode = connectionMode == null ? ConnectionMode.POOLED : connectionMode;
        capabilityTags = capabilityTags == null ? List.of() : List.copyOf(capabilityTags);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static ToolServerConfig local(String serverId, String provider) {
        return new ToolServerConfig(serverId, ToolTransport.LOCAL, provider, true,
                ConnectionMode.POOLED, List.of(), Map.of());
    }
}
