package com.keystone.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/nodes/{nodeId}/feedback.
 *
 * @param verdict     APPROVE, REJECT or NEED_MORE_INFO
 * @param remediation hint for the next attempt; nullable
 */
public record FeedbackRequest(
    String verdict,
    String rationale,
    String remediation
) {}
