package com.keystone.broker;

import java.util.List;
import java.util.Map;

/**
 * An open channel to one tool server. Implementations may block; the broker enforces
 * deadlines around every call.
 */
public interface ToolConnection extends AutoCloseable {

    List<ToolDescriptor> listTools();

    ToolReply call(String toolName, Map<String, Object> args);

    /** Cheap liveness probe; throws when the server is unreachable. */
    void ping();

    @Override
    void close();
}
