package com.keystone.core.agent;

import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.llm.LlmProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds a Planner or Verifier call by {@code keystone.llm.call-timeout} and the attempt's
 * cancellation token. The call runs on its own thread, which is interrupted on timeout or
 * cancel; the caller gets an {@link AgentException} either way.
 */
@Component
public class AgentCallGuard {

    private static final Logger log = LoggerFactory.getLogger(AgentCallGuard.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final Duration timeout;
    private final ExecutorService pool;

    @Autowired
    public AgentCallGuard(LlmProperties properties) {
        this(properties.getCallTimeout());
    }

    public AgentCallGuard(Duration timeout) {
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Runs {@code work} for {@code role} and waits for it.
     *
     * @throws AgentException when the call times out, is cancelled or throws a checked exception;
     *                        unchecked exceptions from {@code work} are rethrown unchanged
     */
    public <T> T call(String role, CancellationToken token, Supplier<T> work) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = pool.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return work.get();
            } finally {
                MDC.clear();
            }
        });
        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        try {
            return future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call exceeded {} ms, interrupted", role, timeout.toMillis());
            throw new AgentException(role, role + " did not answer within " + timeout.toMillis() + " ms", e);
        } catch (CancellationException e) {
            throw new AgentException(role, role + " call cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentException(role, role + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AgentException(role, role + " failed: " + cause.getMessage(), cause);
        } finally {
            registration.remove();
        }
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }
}
