package com.keystone.broker;

import java.util.function.Function;

/**
 * Decides when connections to a tool server are opened and closed, so that call and
 * retry logic in the broker is the same for every backend.
 */
public interface ConnectionLifecycle extends AutoCloseable {

    <T> T withConnection(ToolServerConfig config, Function<ToolConnection, T> work);

    /** Drops any held connection to the server. */
    void invalidate(String serverId);

    /** Closes connections unused for longer than the idle TTL. */
    default void evictIdle() {
    }

    @Override
    void close();
}
