package com.keystone.core.agent;

/**
 * A reasoning backend failed to produce an answer. The run loop treats it as a REJECT
 * with rationale {@code agent_unavailable}.
 */
public class AgentException extends RuntimeException {

    private final String role;

    public AgentException(String role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public AgentException(String role, String message) {
        super(message);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
