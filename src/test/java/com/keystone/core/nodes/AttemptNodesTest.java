package com.keystone.core.nodes;

import com.keystone.broker.ToolErrorKind;
import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.agent.AgentCallGuard;
import com.keystone.core.agent.AgentException;
import com.keystone.core.agent.AgentRoster;
import com.keystone.core.agent.ExecutionRequest;
import com.keystone.core.agent.Executor;
import com.keystone.core.agent.PlanRequest;
import com.keystone.core.agent.Planner;
import com.keystone.core.agent.Verifier;
import com.keystone.core.audit.AuditEntry;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.PlanProposal;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.ToolCallIntent;
import com.keystone.core.model.Verdict;
import com.keystone.core.model.VerificationResult;
import com.keystone.core.state.AttemptOutcome;
import com.keystone.core.state.AttemptScopes;
import com.keystone.core.state.AttemptState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PlanNode}, {@link ExecuteNode} and {@link VerifyNode}.
 * <p>
 * Each node is driven with a hand-built {@link AttemptState}; the agents are mocks.
 */
class AttemptNodesTest {

    private static final String ATTEMPT = "run-1/1/0";

    private Planner planner;
    private Executor executor;
    private Verifier verifier;
    private AuditLog auditLog;
    private SimpleMeterRegistry registry;
    private AttemptScopes scopes;
    private CancellationToken token;
    private AgentRoster roster;
    private KeystoneMetrics metrics;

    @BeforeEach
    void setUp() {
        planner = mock(Planner.class);
        executor = mock(Executor.class);
        verifier = mock(Verifier.class);
        roster = new AgentRoster(planner, executor, verifier);
        auditLog = new AuditLog();
        registry = new SimpleMeterRegistry();
        metrics = new KeystoneMetrics(registry);
        scopes = new AttemptScopes();
        token = CancellationToken.create();
        scopes.open(ATTEMPT, token);
    }

    // ── Helper methods ──────────────────────────────────────────────

    private static AttemptState state(Map<String, Object> extra) {
        Map<String, Object> data = new HashMap<>();
        data.put(AttemptState.ATTEMPT_ID, ATTEMPT);
        data.put(AttemptState.RUN_ID, "run-1");
        data.put(AttemptState.NODE_ID, "1");
        data.put(AttemptState.GOAL, "create /tmp/x");
        data.put(AttemptState.TEMPERATURE, 0.3);
        data.put(AttemptState.REJECTIONS, List.of("wrong path"));
        data.putAll(extra);
        return new AttemptState(data);
    }

    private static ResultBundle bundle(ToolInvocationResult... results) {
        return new ResultBundle("mkdir", List.of(results), false, false, null, 1);
    }

    private AuditEntry lastEntry() {
        List<AuditEntry> entries = auditLog.entries("run-1", "1");
        return entries.get(entries.size() - 1);
    }

    @Nested
    @DisplayName("PlanNode")
    class Plan {

        private PlanNode node;

        @BeforeEach
        void setUp() {
            node = new PlanNode(roster, auditLog, metrics, scopes);
        }

        @Test
        @DisplayName("stores the proposed strategy, intents and session token")
        void storesProposal() {
            var intent = new ToolCallIntent("filesystem", "create_directory", Map.of("path", "/tmp/x"), false);
            when(planner.plan(any())).thenReturn(new PlanProposal("mkdir", List.of(intent), "session-1"));

            Map<String, Object> updates = node.apply(state(Map.of()));

            assertEquals("mkdir", updates.get(AttemptState.STRATEGY));
            assertEquals(List.of(intent), updates.get(AttemptState.INTENTS));
            assertEquals("session-1", updates.get(AttemptState.SESSION_TOKEN));
            assertEquals("plan", lastEntry().action());
            assertEquals("planner", lastEntry().actor());
            assertNotNull(registry.find("keystone.phase.duration").tag("phase", "plan").tag("outcome", "ok").timer());
        }

        @Test
        @DisplayName("passes goal, temperature and rejection history to the planner")
        void passesRequest() {
            when(planner.plan(any())).thenReturn(new PlanProposal("mkdir", List.of(), null));

            Map<String, Object> updates = node.apply(state(Map.of()));

            ArgumentCaptor<PlanRequest> request = ArgumentCaptor.forClass(PlanRequest.class);
            verify(planner).plan(request.capture());
            assertEquals("create /tmp/x", request.getValue().goal());
            assertEquals(0.3, request.getValue().temperature(), 1e-9);
            assertEquals(List.of("wrong path"), request.getValue().rejections());
            assertFalse(updates.containsKey(AttemptState.SESSION_TOKEN));
        }

        @Test
        @DisplayName("a node that already has a strategy is not re-planned")
        void skipsWhenPlanned() {
            assertTrue(node.apply(state(Map.of(AttemptState.STRATEGY, "given"))).isEmpty());
            verifyNoInteractions(planner);
        }

        @Test
        @DisplayName("a planner failure becomes an agent_unavailable rejection")
        void plannerFailure() {
            when(planner.plan(any())).thenThrow(new AgentException("planner", "model offline"));

            Map<String, Object> updates = node.apply(state(Map.of()));

            assertEquals(AttemptOutcome.REJECTED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("agent_unavailable: planner failed: model offline", updates.get(AttemptState.RATIONALE));
            assertEquals("error", lastEntry().outcome());
        }

        @Test
        @DisplayName("cancelling the attempt interrupts a planner that never answers")
        void cancelInterruptsPlanner() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(planner.plan(any())).thenAnswer(inv -> {
                started.countDown();
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return new PlanProposal("never", List.of(), null);
            });

            CompletableFuture<Map<String, Object>> pending = CompletableFuture.supplyAsync(() -> node.apply(state(Map.of())));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            token.cancel();

            assertEquals(AttemptOutcome.CANCELLED.name(), pending.get(5, TimeUnit.SECONDS).get(AttemptState.OUTCOME));
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("a planner that overruns the call timeout becomes an agent_unavailable rejection")
        void plannerTimeout() {
            var guarded = new PlanNode(new AgentRoster(planner, executor, verifier,
                    new AgentCallGuard(Duration.ofMillis(200))), auditLog, metrics, scopes);
            when(planner.plan(any())).thenAnswer(inv -> {
                Thread.sleep(30_000);
                return new PlanProposal("never", List.of(), null);
            });

            long start = System.currentTimeMillis();
            Map<String, Object> updates = guarded.apply(state(Map.of()));

            assertTrue(System.currentTimeMillis() - start < 5000);
            assertEquals(AttemptOutcome.REJECTED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("agent_unavailable: planner failed: planner did not answer within 200 ms",
                    updates.get(AttemptState.RATIONALE));
        }

        @Test
        @DisplayName("a cancelled attempt is not planned")
        void cancelled() {
            token.cancel();

            assertEquals(AttemptOutcome.CANCELLED.name(), node.apply(state(Map.of())).get(AttemptState.OUTCOME));
            verifyNoInteractions(planner);
        }
    }

    @Nested
    @DisplayName("ExecuteNode")
    class Execute {

        private ExecuteNode node;

        @BeforeEach
        void setUp() {
            node = new ExecuteNode(roster, auditLog, metrics, scopes);
        }

        @Test
        @DisplayName("stores the result bundle and hands the attempt token to the executor")
        void storesBundle() {
            var ok = bundle(ToolInvocationResult.success("fs", "create_directory", "done", Duration.ZERO));
            when(executor.execute(any())).thenReturn(ok);

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.STRATEGY, "mkdir")));

            assertSame(ok, updates.get(AttemptState.RESULT_BUNDLE));
            assertFalse(updates.containsKey(AttemptState.OUTCOME));
            ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
            verify(executor).execute(request.capture());
            assertSame(token, request.getValue().token());
            assertEquals("ok", lastEntry().outcome());
        }

        @Test
        @DisplayName("an aborted bundle ends the attempt as ABORTED with the denial reason")
        void aborted() {
            when(executor.execute(any())).thenReturn(
                    new ResultBundle("rm", List.of(), true, false, "danger gate denied run_command: denied", 1));

            Map<String, Object> updates = node.apply(state(Map.of()));

            assertEquals(AttemptOutcome.ABORTED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("danger gate denied run_command: denied", updates.get(AttemptState.RATIONALE));
            assertEquals("aborted", lastEntry().outcome());
        }

        @Test
        @DisplayName("a cancelled bundle ends the attempt as CANCELLED")
        void cancelledBundle() {
            when(executor.execute(any())).thenReturn(new ResultBundle("s", List.of(), false, true, "cancelled", 1));

            assertEquals(AttemptOutcome.CANCELLED.name(), node.apply(state(Map.of())).get(AttemptState.OUTCOME));
        }

        @Test
        @DisplayName("an executor crash becomes an agent_unavailable rejection")
        void executorFailure() {
            when(executor.execute(any())).thenThrow(new IllegalStateException("pool closed"));

            Map<String, Object> updates = node.apply(state(Map.of()));

            assertEquals(AttemptOutcome.REJECTED.name(), updates.get(AttemptState.OUTCOME));
            assertTrue(((String) updates.get(AttemptState.RATIONALE)).startsWith("agent_unavailable"));
        }
    }

    @Nested
    @DisplayName("VerifyNode")
    class Verify {

        private VerifyNode node;

        @BeforeEach
        void setUp() {
            node = new VerifyNode(roster, auditLog, metrics, scopes);
        }

        @Test
        @DisplayName("an approval ends the attempt as APPROVED")
        void approved() {
            var ok = bundle(ToolInvocationResult.success("fs", "create_directory", "done", Duration.ZERO));
            when(verifier.verify(ok, "create /tmp/x")).thenReturn(VerificationResult.approve("exists"));

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, ok)));

            assertEquals(AttemptOutcome.APPROVED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals(Verdict.APPROVE.name(), updates.get(AttemptState.VERDICT));
            assertEquals("verify", lastEntry().action());
            assertEquals("approve", lastEntry().outcome());
        }

        @Test
        @DisplayName("a rejection keeps the remediation")
        void rejected() {
            var ok = bundle(ToolInvocationResult.success("fs", "create_directory", "done", Duration.ZERO));
            when(verifier.verify(any(), anyString())).thenReturn(VerificationResult.reject("wrong dir", "use /tmp/x"));

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, ok)));

            assertEquals(AttemptOutcome.REJECTED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("use /tmp/x", updates.get(AttemptState.REMEDIATION));
            assertEquals("wrong dir (remediation: use /tmp/x)", lastEntry().detail());
        }

        @Test
        @DisplayName("a timed-out call is rejected without consulting the verifier")
        void timeout() {
            var timedOut = bundle(ToolInvocationResult.failure("fs", "create_directory", ToolErrorKind.TIMEOUT,
                    "deadline exceeded", Duration.ofSeconds(15)));

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, timedOut)));

            assertEquals(AttemptOutcome.REJECTED.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("timeout: create_directory on fs exceeded its deadline", updates.get(AttemptState.RATIONALE));
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("NEED_MORE_INFO maps to its own outcome")
        void needMoreInfo() {
            var ok = bundle(ToolInvocationResult.success("fs", "list", "a b", Duration.ZERO));
            when(verifier.verify(any(), anyString())).thenReturn(VerificationResult.needMoreInfo("which disk?"));

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, ok)));

            assertEquals(AttemptOutcome.NEED_MORE_INFO.name(), updates.get(AttemptState.OUTCOME));
            assertEquals("which disk?", updates.get(AttemptState.RATIONALE));
        }

        @Test
        @DisplayName("a verifier failure becomes an agent_unavailable rejection")
        void verifierFailure() {
            var ok = bundle(ToolInvocationResult.success("fs", "list", "a b", Duration.ZERO));
            when(verifier.verify(any(), anyString())).thenThrow(new AgentException("verifier", "offline"));

            Map<String, Object> updates = node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, ok)));

            assertEquals("agent_unavailable: verifier failed: offline", updates.get(AttemptState.RATIONALE));
        }

        @Test
        @DisplayName("cancelling the attempt interrupts a verifier that never answers")
        void cancelInterruptsVerifier() throws Exception {
            var ok = bundle(ToolInvocationResult.success("fs", "list", "a b", Duration.ZERO));
            CountDownLatch started = new CountDownLatch(1);
            when(verifier.verify(any(), anyString())).thenAnswer(inv -> {
                started.countDown();
                Thread.sleep(30_000);
                return VerificationResult.approve("never");
            });

            CompletableFuture<Map<String, Object>> pending = CompletableFuture.supplyAsync(
                    () -> node.apply(state(Map.of(AttemptState.RESULT_BUNDLE, ok))));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            token.cancel();

            assertEquals(AttemptOutcome.CANCELLED.name(), pending.get(5, TimeUnit.SECONDS).get(AttemptState.OUTCOME));
        }

        @Test
        @DisplayName("verification without a result bundle is a programming error")
        void missingBundle() {
            assertThrows(IllegalStateException.class, () -> node.apply(state(Map.of())));
        }
    }
}
