package com.keystone.core.model;

import java.io.Serializable;

public record RunMetrics(
        int nodes,
        int succeeded,
        int failed,
        int cancelled,
        int toolCalls,
        int toolTimeouts,
        int rejects,
        int decompositions,
        long elapsedMs
) implements Serializable {}
