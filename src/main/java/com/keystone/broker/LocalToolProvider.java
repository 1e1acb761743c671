package com.keystone.broker;

import java.util.List;
import java.util.Map;

/**
 * A tool server implemented in-process. Providers are Spring beans; a LOCAL server config
 * names the provider in its endpoint.
 */
public interface LocalToolProvider {

    /** Provider name matched against a LOCAL server's endpoint. */
    String name();

    List<ToolDescriptor> describe(String serverId);

    /**
     * Runs one tool. Implementations must react to thread interruption, which is how the
     * broker cancels a call.
     *
     * @throws ToolException for invalid arguments or tool failures
     */
    ToolReply call(String toolName, Map<String, Object> args);
}
