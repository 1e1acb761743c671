package com.keystone.broker;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Opens connections to in-process {@link LocalToolProvider} beans.
 */
@Component
public class LocalConnectionFactory implements ToolConnectionFactory {

    private final Map<String, LocalToolProvider> providers;

    public LocalConnectionFactory(List<LocalToolProvider> providers) {
        this.providers = providers.stream().collect(Collectors.toMap(LocalToolProvider::name, Function.identity()));
    }

    @Override
    public boolean supports(ToolTransport transport) {
        return transport == ToolTransport.LOCAL;
    }

    @Override
    public ToolConnection open(ToolServerConfig config) {
        LocalToolProvider provider = providers.get(config.endpoint());
        if (provider == null) {
            throw new ToolException(ToolErrorKind.NOT_CONFIGURED,
                    "No local tool provider named '" + config.endpoint() + "' for server '" + config.serverId() + "'");
        }
        return new ToolConnection() {
            @Override
            public List<ToolDescriptor> listTools() {
                return provider.describe(config.serverId());
            }

            @Override
            public ToolReply call(String toolName, Map<String, Object> args) {
                return provider.call(toolName, args);
            }

            @Override
            public void ping() {
                // in-process, always reachable
            }

            @Override
            public void close() {
                // nothing held
            }
        };
    }
}
