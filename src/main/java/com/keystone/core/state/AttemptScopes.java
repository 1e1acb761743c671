package com.keystone.core.state;

import com.keystone.core.concurrent.CancellationToken;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live objects of in-flight attempts, keyed by attempt id.
 */
@Component
public class AttemptScopes {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public void open(String attemptId, CancellationToken token) {
        tokens.put(attemptId, token);
    }

    public CancellationToken token(String attemptId) {
        CancellationToken token = tokens.get(attemptId);
        if (token == null) {
            throw new IllegalStateException("No open attempt " + attemptId);
        }
        return token;
    }

    public void close(String attemptId) {
        tokens.remove(attemptId);
    }
}
