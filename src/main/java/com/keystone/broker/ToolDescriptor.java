package com.keystone.broker;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A tool as discovered on a server.
 *
 * @param inputSchema JSON schema of the arguments, as a plain map
 */
public record ToolDescriptor(
        String serverId,
        String toolName,
        String description,
        Map<String, Object> inputSchema,
        List<String> capabilityTags
) implements Serializable {

    public ToolDescriptor {
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of() : inputSchema;
        capabilityTags = capabilityTags == null ? List.of() : List.copyOf(capabilityTags);
    }
}
