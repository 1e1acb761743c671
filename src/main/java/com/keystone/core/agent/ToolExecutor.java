package com.keystone.core.agent;

import com.keystone.broker.CallScope;
import com.keystone.broker.ToolBroker;
import com.keystone.broker.ToolBrokerProperties;
import com.keystone.broker.ToolCall;
import com.keystone.broker.ToolErrorKind;
import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.ToolCallIntent;
import com.keystone.core.security.ApprovalCallback;
import com.keystone.core.security.ApprovalDecision;
import com.keystone.core.security.ApprovalRequest;
import com.keystone.core.security.DangerGate;
import com.keystone.core.security.DangerGateProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that issues a strategy's intents through the {@link ToolBroker}.
 * <p>
 * Intents run in declared order. A run of consecutive intents marked independent is
 * dispatched concurrently on a bounded pool and joined before the next intent. Dependent
 * intents stop at the first failure. Calls the {@link DangerGate} holds wait for the
 * {@link ApprovalCallback}; a denial aborts the rest of the attempt.
 */
@Component
public class ToolExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolBroker toolBroker;
    private final DangerGate dangerGate;
    private final ApprovalCallback approvalCallback;
    private final DangerGateProperties gateProperties;
    private final ToolBrokerProperties brokerProperties;
    private final AuditLog auditLog;
    private final ExecutorService pool;

    public ToolExecutor(ToolBroker toolBroker, DangerGate dangerGate, ApprovalCallback approvalCallback,
                        DangerGateProperties gateProperties, ToolBrokerProperties brokerProperties,
                        AuditLog auditLog, AgentProperties agentProperties) {
        this.toolBroker = toolBroker;
        this.dangerGate = dangerGate;
        this.approvalCallback = approvalCallback;
        this.gateProperties = gateProperties;
        this.brokerProperties = brokerProperties;
        this.auditLog = auditLog;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, agentProperties.getExecutePoolSize()), r -> {
            Thread t = new Thread(r, "execute-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return "tool";
    }

    @Override
    public ResultBundle execute(ExecutionRequest request) {
        long start = System.currentTimeMillis();
        List<ToolInvocationResult> results = new ArrayList<>();
        List<List<ToolCallIntent>> batches = batches(request.intents());

        for (int b = 0; b < batches.size(); b++) {
            List<ToolCallIntent> batch = batches.get(b);
            if (request.token().isCancelled()) {
                return bundle(request, results, false, true, "cancelled", start);
            }
            List<Outcome> outcomes = batch.size() == 1
                    ? List.of(run(request, batch.get(0)))
                    : runConcurrently(request, batch);
            for (Outcome outcome : outcomes) {
                if (outcome.result() != null) {
                    results.add(outcome.result());
                }
            }
            Optional<Outcome> denied = outcomes.stream().filter(o -> o.denialReason() != null).findFirst();
            if (denied.isPresent()) {
                return bundle(request, results, true, false, denied.get().denialReason(), start);
            }
            if (request.token().isCancelled()
                    || outcomes.stream().anyMatch(o -> o.result() != null && o.result().errorKind() == ToolErrorKind.CANCELLED)) {
                return bundle(request, results, false, true, "cancelled", start);
            }
            if (outcomes.stream().anyMatch(o -> o.result() != null && !o.result().success())) {
                log.info("Stopping node {} after failed call; {} intent(s) not dispatched", request.nodeId(),
                        remaining(batches, b));
                break;
            }
        }
        return bundle(request, results, false, false, null, start);
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    /**
     * Groups intents into dispatch batches: a maximal run of consecutive independent intents
     * forms one batch, every other intent is a batch of its own.
     */
    static List<List<ToolCallIntent>> batches(List<ToolCallIntent> intents) {
        List<List<ToolCallIntent>> batches = new ArrayList<>();
        List<ToolCallIntent> current = new ArrayList<>();
        for (ToolCallIntent intent : intents) {
            if (intent.independent()) {
                current.add(intent);
                continue;
            }
            if (!current.isEmpty()) {
                batches.add(current);
                current = new ArrayList<>();
            }
            batches.add(List.of(intent));
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    private List<Outcome> runConcurrently(ExecutionRequest request, List<ToolCallIntent> batch) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<Outcome>> futures = new ArrayList<>();
        for (ToolCallIntent intent : batch) {
            futures.add(pool.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return run(request, intent);
                } finally {
                    MDC.clear();
                }
            }));
        }
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(join(futures.get(i), batch.get(i)));
        }
        return outcomes;
    }

    private Outcome join(Future<Outcome> future, ToolCallIntent intent) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new Outcome(ToolInvocationResult.failure(intent.serverHint(), intent.toolName(),
                    ToolErrorKind.CANCELLED, "executor interrupted", Duration.ZERO), null);
        } catch (ExecutionException e) {
            log.error("Concurrent tool call {} failed unexpectedly: {}", intent.toolName(), e.getCause().getMessage(),
                    e.getCause());
            return new Outcome(ToolInvocationResult.failure(intent.serverHint(), intent.toolName(),
                    ToolErrorKind.REMOTE_ERROR, String.valueOf(e.getCause().getMessage()), Duration.ZERO), null);
        }
    }

    private Outcome run(ExecutionRequest request, ToolCallIntent intent) {
        ToolCall call = call(intent, request.constraints());
        if (!request.constraints().allowDangerousOps()) {
            Optional<String> held = dangerGate.check(call);
            if (held.isPresent()) {
                ApprovalDecision decision = approve(request, call, held.get());
                if (!decision.approved()) {
                    return new Outcome(null, "danger gate denied " + call.toolName() + ": " + decision.reason());
                }
                // time spent waiting for a human is not charged to the call
                call = call(intent, request.constraints());
            }
        }
        if (request.token().isCancelled()) {
            return new Outcome(ToolInvocationResult.failure(call.serverHint(), call.toolName(),
                    ToolErrorKind.CANCELLED, "cancelled before dispatch", Duration.ZERO), null);
        }
        return new Outcome(toolBroker.invoke(call, new CallScope(request.runId(), request.nodeId(), request.token())), null);
    }

    private ApprovalDecision approve(ExecutionRequest request, ToolCall call, String pattern) {
        var approval = new ApprovalRequest(UUID.randomUUID().toString(), request.runId(), request.nodeId(),
                call.serverHint(), call.toolName(), call.args(), pattern, Instant.now());
        ApprovalDecision decision = approvalCallback.requestApproval(approval, gateProperties.getApprovalTimeout(),
                request.token());
        auditLog.append(request.runId(), request.nodeId(), AuditActors.DANGER_GATE, "approval",
                Map.of("tool", call.toolName(), "pattern", pattern, "approvalId", approval.id()),
                decision.approved() ? "approved" : "denied", decision.reason());
        return decision;
    }

    private ToolCall call(ToolCallIntent intent, TaskConstraints constraints) {
        return new ToolCall(intent.serverHint(), intent.toolName(), intent.args(), deadline(constraints));
    }

    /** The default call deadline from now, capped by the node's own deadline. */
    private Instant deadline(TaskConstraints constraints) {
        Instant byDefault = Instant.now().plus(brokerProperties.getDefaultDeadline());
        if (constraints.deadline() != null && constraints.deadline().isBefore(byDefault)) {
            return constraints.deadline();
        }
        return byDefault;
    }

    private static int remaining(List<List<ToolCallIntent>> batches, int index) {
        return batches.subList(index + 1, batches.size()).stream().mapToInt(List::size).sum();
    }

    private static ResultBundle bundle(ExecutionRequest request, List<ToolInvocationResult> results,
                                       boolean aborted, boolean cancelled, String reason, long start) {
        return new ResultBundle(request.strategy(), results, aborted, cancelled, reason,
                System.currentTimeMillis() - start);
    }

    /** Either a broker result or a danger-gate denial. */
    private record Outcome(ToolInvocationResult result, String denialReason) {}
}
