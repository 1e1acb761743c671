package com.keystone.core.security;

import java.time.Instant;
import java.util.Map;

/**
 * A held tool call waiting for a human decision.
 */
public record ApprovalRequest(
        String id,
        String runId,
        String nodeId,
        String serverHint,
        String toolName,
        Map<String, Object> args,
        String matchedPattern,
        Instant requestedAt
) {}
