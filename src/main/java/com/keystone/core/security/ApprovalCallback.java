package com.keystone.core.security;

import com.keystone.core.concurrent.CancellationToken;

import java.time.Duration;

/**
 * External human-approval hook invoked by the Executor for calls the danger gate holds.
 * Blocks until a decision, the timeout, or cancellation; the latter two count as denial.
 */
@FunctionalInterface
public interface ApprovalCallback {

    ApprovalDecision requestApproval(ApprovalRequest request, Duration timeout, CancellationToken token);
}
