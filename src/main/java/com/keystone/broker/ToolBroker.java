package com.keystone.broker;

import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.metrics.KeystoneMetrics;
import io.modelcontextprotocol.spec.McpError;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single translation point from a {@link ToolCall} to a backend call.
 * <p>
 * Server resolution and argument validation run on the caller's thread against the
 * descriptor cache; discovery loads run on their own threads, one per server at a time.
 * The backend call then runs on a broker thread and is awaited for at most the time left
 * before its deadline, so a hung server only ever holds up the calls that reached it. Failures of
 * any kind come back as a {@link ToolInvocationResult} with a normalized
 * {@link ToolErrorKind}; nothing thrown by a backend leaves this class. Each invocation
 * appends one audit entry ({@code invoke}, or {@code tool_timeout} when the deadline hit).
 */
@Service
public class ToolBroker {

    private static final Logger log = LoggerFactory.getLogger(ToolBroker.class);

    /** JSON-RPC "invalid params". */
    private static final int INVALID_PARAMS = -32602;

    private final ToolBrokerProperties properties;
    private final List<ToolConnectionFactory> factories;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    private final DescriptorCache descriptorCache;
    private final PooledConnectionLifecycle pooled;
    private final SpawnPerCallLifecycle spawnPerCall;
    private final ThreadPoolExecutor callExecutor;
    private final ExecutorService discoveryExecutor;

    private volatile Map<String, ToolServerConfig> servers = Map.of();

    @Autowired
    public ToolBroker(ToolBrokerProperties properties, List<ToolConnectionFactory> factories,
                      AuditLog auditLog, KeystoneMetrics metrics, EventBus eventBus) {
        this(properties, factories, auditLog, metrics, eventBus, Clock.systemUTC());
    }

    public ToolBroker(ToolBrokerProperties properties, List<ToolConnectionFactory> factories,
                      AuditLog auditLog, KeystoneMetrics metrics, EventBus eventBus, Clock clock) {
        this.properties = properties;
        this.factories = List.copyOf(factories);
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
        this.descriptorCache = new DescriptorCache(properties.getDescriptorTtl(), clock);
        this.pooled = new PooledConnectionLifecycle(this::open, properties, metrics, clock);
        this.spawnPerCall = new SpawnPerCallLifecycle(this::open);
        this.callExecutor = newCallExecutor(Math.max(1, properties.getMaxConcurrentCalls()));
        this.discoveryExecutor = newDiscoveryExecutor();
        configure(properties.toServerConfigs());
    }

    // ── Configuration ────────────────────────────────────────────────

    /**
     * Replaces the server list. Cached descriptors are dropped and pooled connections to
     * servers that changed or disappeared are closed.
     */
    public synchronized void configure(List<ToolServerConfig> configs) {
        Map<String, ToolServerConfig> next = new LinkedHashMap<>();
        for (ToolServerConfig config : configs) {
            if (next.putIfAbsent(config.serverId(), config) != null) {
                throw new IllegalArgumentException("Duplicate tool server id: " + config.serverId());
            }
        }
        for (ToolServerConfig previous : servers.values()) {
            if (!previous.equals(next.get(previous.serverId()))) {
                pooled.invalidate(previous.serverId());
            }
        }
        servers = Map.copyOf(next);
        descriptorCache.invalidateAll();
        log.info("Tool broker configured with {} server(s): {}", next.size(), next.keySet());
    }

    public List<ToolServerConfig> servers() {
        return List.copyOf(servers.values());
    }

    public Optional<ToolServerConfig> server(String serverId) {
        return Optional.ofNullable(servers.get(serverId));
    }

    // ── Discovery ────────────────────────────────────────────────────

    /**
     * Descriptors of one server, served from the TTL cache.
     *
     * @throws ToolException NOT_CONFIGURED for unknown or disabled servers, otherwise the
     *                       classified discovery failure
     */
    public List<ToolDescriptor> discover(String serverId) {
        ToolServerConfig config = enabledServer(serverId);
        return await(lookup(config), discoveryTimeout(), CancellationToken.none(),
                "discovery of '" + serverId + "'");
    }

    /** Descriptors from every enabled server; servers that fail discovery are skipped. */
    public List<ToolDescriptor> catalog() {
        List<ToolDescriptor> all = new ArrayList<>();
        for (ToolServerConfig config : servers.values()) {
            if (!config.enabled()) {
                continue;
            }
            try {
                all.addAll(discover(config.serverId()));
            } catch (ToolException e) {
                log.warn("Discovery failed for tool server '{}' ({}): {}",
                        config.serverId(), e.getKind().wireName(), e.getMessage());
            }
        }
        return all;
    }

    /** One line per server listing its tool names, for prompts and the CLI. */
    public String catalogSummary() {
        Map<String, List<String>> byServer = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : catalog()) {
            byServer.computeIfAbsent(descriptor.serverId(), k -> new ArrayList<>())
                    .add(descriptor.toolName() + describeArgs(descriptor));
        }
        if (byServer.isEmpty()) {
            return "(no tools available)";
        }
        StringBuilder sb = new StringBuilder();
        byServer.forEach((server, tools) -> sb.append(server).append(": ").append(String.join(", ", tools)).append('\n'));
        return sb.toString().trim();
    }

    /** Liveness probe for one server, bounded by the connect timeout. */
    public boolean ping(String serverId) {
        try {
            ToolServerConfig config = enabledServer(serverId);
            bounded(() -> lifecycle(config).withConnection(config, c -> {
                c.ping();
                return Boolean.TRUE;
            }), properties.getConnectTimeout(), CancellationToken.none());
            return true;
        } catch (ToolException e) {
            log.debug("Ping of tool server '{}' failed: {}", serverId, e.getMessage());
            return false;
        }
    }

    // ── Invocation ───────────────────────────────────────────────────

    /**
     * Invokes one tool within its deadline.
     *
     * @return the normalized result; never throws for backend failures
     */
    public ToolInvocationResult invoke(ToolCall call, CallScope scope) {
        Instant start = clock.instant();
        String serverId = call.serverHint().isBlank() ? null : call.serverHint();
        ToolReply reply = null;
        ToolErrorKind errorKind = null;
        String errorMessage = null;

        Duration remaining = Duration.between(start, call.deadline());
        if (scope.token().isCancelled()) {
            errorKind = ToolErrorKind.CANCELLED;
            errorMessage = "cancelled before dispatch";
        } else if (remaining.isNegative() || remaining.isZero()) {
            errorKind = ToolErrorKind.TIMEOUT;
            errorMessage = "deadline passed before dispatch";
        } else {
            try {
                ToolServerConfig config = resolve(call, scope.token());
                serverId = config.serverId();
                validate(config, call, scope.token());
                reply = bounded(() -> lifecycle(config).withConnection(config, c -> c.call(call.toolName(), call.args())),
                        remainingBefore(call.deadline()), scope.token());
                if (reply.error()) {
                    errorKind = ToolErrorKind.REMOTE_ERROR;
                    errorMessage = reply.text();
                }
            } catch (ToolException e) {
                errorKind = e.getKind();
                errorMessage = e.getMessage();
            }
        }

        Duration duration = Duration.between(start, clock.instant());
        ToolInvocationResult result = errorKind == null
                ? ToolInvocationResult.success(serverId, call.toolName(), reply.text(), duration)
                : ToolInvocationResult.failure(serverId, call.toolName(), errorKind, errorMessage, duration);
        record(call, scope, result);
        return result;
    }

    @Scheduled(fixedDelayString = "${keystone.tools.idle-sweep-ms:60000}")
    public void sweepIdleConnections() {
        pooled.evictIdle();
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
        discoveryExecutor.shutdownNow();
        pooled.close();
        spawnPerCall.close();
        log.info("Tool broker shut down");
    }

    // ── Internals ────────────────────────────────────────────────────

    /**
     * Picks the server for a call without a hint: the first enabled server, in configuration
     * order, whose descriptors are known and offer the tool. Lookups for all servers start
     * together; a server whose discovery is still pending is passed over once a later one
     * has answered with the tool.
     */
    private ToolServerConfig resolve(ToolCall call, CancellationToken token) {
        if (!call.serverHint().isBlank()) {
            return enabledServer(call.serverHint());
        }
        Map<ToolServerConfig, CompletableFuture<List<ToolDescriptor>>> lookups = new LinkedHashMap<>();
        for (ToolServerConfig config : servers.values()) {
            if (config.enabled()) {
                lookups.put(config, lookup(config));
            }
        }
        while (true) {
            List<CompletableFuture<List<ToolDescriptor>>> pending = new ArrayList<>();
            var it = lookups.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                CompletableFuture<List<ToolDescriptor>> lookup = entry.getValue();
                if (!lookup.isDone()) {
                    pending.add(lookup);
                } else if (lookup.isCompletedExceptionally()) {
                    log.debug("Skipping server '{}' while resolving {}: discovery failed",
                            entry.getKey().serverId(), call.toolName());
                    it.remove();
                } else if (lookup.join().stream().anyMatch(d -> d.toolName().equals(call.toolName()))) {
                    return entry.getKey();
                } else {
                    it.remove();
                }
            }
            if (pending.isEmpty()) {
                throw new ToolException(ToolErrorKind.NOT_CONFIGURED,
                        "No enabled server offers tool '" + call.toolName() + "'");
            }
            CompletableFuture<Object> anySettled = CompletableFuture.anyOf(pending.toArray(CompletableFuture[]::new))
                    .handle((value, error) -> null);
            await(anySettled, remainingBefore(call.deadline()), token, "resolving tool '" + call.toolName() + "'");
        }
    }

    private void validate(ToolServerConfig config, ToolCall call, CancellationToken token) {
        List<ToolDescriptor> descriptors = await(lookup(config), remainingBefore(call.deadline()), token,
                "discovery of '" + config.serverId() + "'");
        ToolDescriptor descriptor = descriptors.stream()
                .filter(d -> d.toolName().equals(call.toolName()))
                .findFirst()
                .orElseThrow(() -> new ToolException(ToolErrorKind.NOT_CONFIGURED,
                        "Server '" + config.serverId() + "' does not offer tool '" + call.toolName() + "'"));
        ArgumentValidator.validate(descriptor, call.args());
    }

    /** Cached descriptors, or the server's single in-flight discovery. */
    private CompletableFuture<List<ToolDescriptor>> lookup(ToolServerConfig config) {
        return descriptorCache.lookup(config.serverId(), id -> load(config));
    }

    /**
     * Lists the server's tools on a discovery thread. The load fails with TIMEOUT and its
     * thread is interrupted once the connect plus request timeout has passed.
     */
    private CompletableFuture<List<ToolDescriptor>> load(ToolServerConfig config) {
        CompletableFuture<List<ToolDescriptor>> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = discoveryExecutor.submit(() -> {
                try {
                    result.complete(lifecycle(config).withConnection(config, ToolConnection::listTools));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new ToolException(ToolErrorKind.REMOTE_ERROR, "tool broker is shut down", e));
        }
        Duration timeout = discoveryTimeout();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (result.completeExceptionally(new ToolException(ToolErrorKind.TIMEOUT,
                    "discovery of '" + config.serverId() + "' exceeded " + timeout.toMillis() + " ms"))) {
                task.cancel(true);
            }
        });
        return result;
    }

    /**
     * Waits for a shared future without disturbing its other waiters: a timeout or a
     * cancelled token abandons only this caller's wait.
     */
    private <T> T await(CompletableFuture<T> shared, Duration timeout, CancellationToken token, String what) {
        CompletableFuture<T> mine = shared.copy();
        CancellationToken.Registration registration = token.onCancel(() -> mine.cancel(true));
        try {
            return mine.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ToolException(ToolErrorKind.TIMEOUT, what + " exceeded " + timeout.toMillis() + " ms", e);
        } catch (CancellationException e) {
            throw new ToolException(ToolErrorKind.CANCELLED, "cancelled during " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolException(ToolErrorKind.CANCELLED, "caller interrupted", e);
        } catch (ExecutionException e) {
            throw classify(e.getCause());
        } finally {
            registration.remove();
        }
    }

    private Duration remainingBefore(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new ToolException(ToolErrorKind.TIMEOUT, "deadline passed before dispatch");
        }
        return remaining;
    }

    private Duration discoveryTimeout() {
        return properties.getConnectTimeout().plus(properties.getRequestTimeout());
    }

    private ToolServerConfig enabledServer(String serverId) {
        ToolServerConfig config = servers.get(serverId);
        if (config == null) {
            throw new ToolException(ToolErrorKind.NOT_CONFIGURED, "Unknown tool server '" + serverId + "'");
        }
        if (!config.enabled()) {
            throw new ToolException(ToolErrorKind.NOT_CONFIGURED, "Tool server '" + serverId + "' is disabled");
        }
        return config;
    }

    private ConnectionLifecycle lifecycle(ToolServerConfig config) {
        return config.connectionMode() == ConnectionMode.SPAWN_PER_CALL ? spawnPerCall : pooled;
    }

    private ToolConnection open(ToolServerConfig config) {
        return factories.stream()
                .filter(f -> f.supports(config.transport()))
                .findFirst()
                .orElseThrow(() -> new ToolException(ToolErrorKind.NOT_CONFIGURED,
                        "No connection factory for transport " + config.transport()))
                .open(config);
    }

    /**
     * Runs {@code work} on a broker thread and waits at most {@code timeout}. The work is
     * interrupted when the timeout passes or the token is cancelled.
     */
    private <T> T bounded(Callable<T> work, Duration timeout, CancellationToken token) {
        Future<T> future;
        try {
            future = callExecutor.submit(work);
        } catch (RejectedExecutionException e) {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR,
                    "Too many concurrent tool calls (limit " + callExecutor.getMaximumPoolSize() + ")", e);
        }
        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        try {
            return future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolException(ToolErrorKind.TIMEOUT, "deadline of " + timeout.toMillis() + " ms exceeded", e);
        } catch (CancellationException e) {
            throw new ToolException(ToolErrorKind.CANCELLED, "cancelled while in flight", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolException(ToolErrorKind.CANCELLED, "caller interrupted", e);
        } catch (ExecutionException e) {
            throw classify(e.getCause());
        } finally {
            registration.remove();
        }
    }

    static ToolException classify(Throwable cause) {
        if (cause instanceof ToolException toolException) {
            return toolException;
        }
        if (cause instanceof McpError mcpError && mcpError.getJsonRpcError() != null
                && mcpError.getJsonRpcError().code() == INVALID_PARAMS) {
            return new ToolException(ToolErrorKind.INVALID_ARGS, mcpError.getMessage(), cause);
        }
        if (cause instanceof InterruptedException || cause instanceof CancellationException) {
            return new ToolException(ToolErrorKind.CANCELLED, "call interrupted", cause);
        }
        if (cause instanceof TimeoutException) {
            return new ToolException(ToolErrorKind.TIMEOUT, cause.getMessage(), cause);
        }
        String message = cause == null ? "unknown failure" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new ToolException(ToolErrorKind.REMOTE_ERROR, message, cause);
    }

    private void record(ToolCall call, CallScope scope, ToolInvocationResult result) {
        String outcome = result.success() ? "success" : result.errorKind().wireName();
        String action = result.timedOut() ? "tool_timeout" : "invoke";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("server", result.serverId() == null ? "" : result.serverId());
        payload.put("tool", call.toolName());
        payload.put("args", call.args());
        auditLog.append(scope.runId(), scope.nodeId(), AuditActors.TOOL_BROKER, action, payload, outcome, result.summary());
        metrics.recordToolCall(result.serverId(), outcome, result.duration());

        if (result.timedOut()) {
            metrics.incrementToolTimeouts(result.serverId());
            eventBus.publish(KeystoneEvent.of("tool.timeout", scope.runId(), scope.nodeId(),
                    Map.of("tool", call.toolName(), "server", payload.get("server"))));
            log.warn("Tool call {} on '{}' timed out after {} ms", call.toolName(), result.serverId(),
                    result.duration().toMillis());
        } else if (!result.success()) {
            log.warn("Tool call {} on '{}' failed ({}): {}", call.toolName(), result.serverId(), outcome,
                    result.errorMessage());
        } else {
            log.info("Tool call {} on '{}' succeeded in {} ms", call.toolName(), result.serverId(),
                    result.duration().toMillis());
        }
    }

    private static String describeArgs(ToolDescriptor descriptor) {
        if (descriptor.inputSchema().get("properties") instanceof Map<?, ?> props && !props.isEmpty()) {
            return "(" + String.join(", ", props.keySet().stream().map(String::valueOf).toList()) + ")";
        }
        return "()";
    }

    private static ThreadPoolExecutor newCallExecutor(int maxThreads) {
        AtomicInteger counter = new AtomicInteger();
        var executor = new ThreadPoolExecutor(0, maxThreads, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "tool-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return executor;
    }

    private static ExecutorService newDiscoveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-discovery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
