package com.keystone.broker;

/**
 * Opens connections for the transports it supports.
 */
public interface ToolConnectionFactory {

    boolean supports(ToolTransport transport);

    ToolConnection open(ToolServerConfig config);
}
