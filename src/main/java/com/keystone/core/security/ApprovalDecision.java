package com.keystone.core.security;

public record ApprovalDecision(boolean approved, String reason) {

    public static ApprovalDecision approve(String reason) {
        return new ApprovalDecision(true, reason);
    }

    public static ApprovalDecision deny(String reason) {
        return new ApprovalDecision(false, reason);
    }
}
