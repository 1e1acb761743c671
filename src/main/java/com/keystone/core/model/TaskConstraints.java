package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Limits a node inherits from its run.
 *
 * @param deadline          absolute wall-clock limit for the node's tool calls (nullable: none)
 * @param allowDangerousOps when true the danger gate is bypassed
 */
public record TaskConstraints(Instant deadline, boolean allowDangerousOps) implements Serializable {

    public static TaskConstraints none() {
        return new TaskConstraints(null, false);
    }
}
