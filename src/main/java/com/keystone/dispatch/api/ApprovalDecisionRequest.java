package com.keystone.dispatch.api;

/**
 * Optional JSON body for approving or denying a held tool call.
 */
public record ApprovalDecisionRequest(String reason) {}
