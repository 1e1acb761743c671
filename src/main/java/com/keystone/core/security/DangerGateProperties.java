package com.keystone.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Danger-gate configuration, bound from {@code keystone.security.*}.
 * <p>
 * Patterns are matched against the rendered call text (tool name followed by its argument
 * values). A pattern prefixed with {@code regex:} is a regular expression; a pattern
 * containing {@code *} is a glob; anything else is a case-insensitive substring.
 */
@Component
@ConfigurationProperties(prefix = "keystone.security")
public class DangerGateProperties {

    private List<String> denyPatterns = new ArrayList<>(List.of(
            "rm -rf /",
            "mkfs",
            "dd if=",
            ":(){:|:&};:",
            "chmod 777 /",
            "chown root:root /",
            "> /dev/sda",
            "mv / /dev/null"));

    private List<String> allowPatterns = new ArrayList<>();

    private Duration approvalTimeout = Duration.ofMinutes(5);

    public List<String> getDenyPatterns() {
        return denyPatterns;
    }

    public void setDenyPatterns(List<String> denyPatterns) {
        this.denyPatterns = denyPatterns;
    }

    public List<String> getAllowPatterns() {
        return allowPatterns;
    }

    public void setAllowPatterns(List<String> allowPatterns) {
        this.allowPatterns = allowPatterns;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public void setApprovalTimeout(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }
}
