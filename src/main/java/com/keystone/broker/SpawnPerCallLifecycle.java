package com.keystone.broker;

import java.util.function.Function;

/**
 * Opens a fresh connection for every call and closes it afterwards.
 */
public class SpawnPerCallLifecycle implements ConnectionLifecycle {

    private final Function<ToolServerConfig, ToolConnection> opener;

    public SpawnPerCallLifecycle(Function<ToolServerConfig, ToolConnection> opener) {
        this.opener = opener;
    }

    @Override
    public <T> T withConnection(ToolServerConfig config, Function<ToolConnection, T> work) {
        try (ToolConnection connection = opener.apply(config)) {
            return work.apply(connection);
        }
    }

    @Override
    public void invalidate(String serverId) {
        // nothing held between calls
    }

    @Override
    public void close() {
        // nothing held between calls
    }
}
