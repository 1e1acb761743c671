package com.keystone.core.security;

import com.keystone.broker.ToolCall;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a tool call needs human approval before it is issued.
 * A call is held when it matches a deny pattern and no allow pattern.
 */
@Service
public class DangerGate {

    private final DangerGateProperties properties;

    public DangerGate(DangerGateProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the deny pattern that holds the call, or empty when it may proceed
     */
    public Optional<String> check(ToolCall call) {
        String text = call.render();
        if (firstMatch(properties.getAllowPatterns(), text).isPresent()) {
            return Optional.empty();
        }
        return firstMatch(properties.getDenyPatterns(), text);
    }

    public boolean requiresApproval(ToolCall call) {
        return check(call).isPresent();
    }

    private static Optional<String> firstMatch(List<String> patterns, String text) {
        if (patterns == null) {
            return Optional.empty();
        }
        return patterns.stream().filter(p -> p != null && !p.isBlank() && matches(p, text)).findFirst();
    }

    static boolean matches(String pattern, String text) {
        if (pattern.startsWith("regex:")) {
            return Pattern.compile(pattern.substring(6)).matcher(text).find();
        }
        if (pattern.contains("*")) {
            String regex = Pattern.quote(pattern).replace("*", "\\E.*\\Q");
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(text).find();
        }
        return text.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }
}
