package com.keystone.broker;

import com.keystone.core.concurrent.CancellationToken;

/**
 * Who a tool call is made for, and the token that cancels it.
 */
public record CallScope(String runId, String nodeId, CancellationToken token) {

    public static final String DETACHED_RUN = "-";

    /** For calls made outside any run (CLI probes, health checks). */
    public static CallScope detached() {
        return new CallScope(DETACHED_RUN, null, CancellationToken.none());
    }
}
