package com.keystone.broker;

/**
 * How the broker reaches a tool server.
 */
public enum ToolTransport {
    /** In-process {@link LocalToolProvider} looked up by endpoint name. */
    LOCAL,
    /** MCP server launched as a subprocess speaking JSON-RPC over stdio. */
    STDIO,
    /** MCP server reached over HTTP with Server-Sent Events. */
    SSE
}
