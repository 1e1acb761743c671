package com.keystone.core.agent;

import com.keystone.broker.ToolBroker;
import com.keystone.core.llm.LlmEmptyResponseException;
import com.keystone.core.llm.LlmService;
import com.keystone.core.memory.StrategyOutcome;
import com.keystone.core.memory.StrategyRecord;
import com.keystone.core.model.PlanProposal;
import com.keystone.core.model.SubgoalProposal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmPlannerTest {

    private LlmService llmService;
    private ToolBroker toolBroker;
    private LlmPlanner planner;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        toolBroker = mock(ToolBroker.class);
        when(toolBroker.catalogSummary()).thenReturn("filesystem: create_directory(path)");
        planner = new LlmPlanner(llmService, toolBroker);
    }

    private static PlanRequest request(List<String> rejections, double temperature, String session) {
        return new PlanRequest("run-1", "1", "create /tmp/x", List.of("set up workspace"),
                List.of(StrategyRecord.of("create /tmp/y", StrategyOutcome.SUCCESS, "used create_directory")),
                rejections, temperature, session);
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("maps draft steps to tool call intents")
        void mapsSteps() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("make the directory", List.of(
                            new PlanDraft.Step("filesystem", "create_directory", Map.of("path", "/tmp/x"), false),
                            new PlanDraft.Step("", "list_directory", Map.of("path", "/tmp"), true))));

            PlanProposal proposal = planner.plan(request(List.of(), 0.1, null));

            assertEquals("make the directory", proposal.strategy());
            assertEquals(2, proposal.intents().size());
            assertEquals("filesystem", proposal.intents().get(0).serverHint());
            assertEquals("create_directory", proposal.intents().get(0).toolName());
            assertEquals("/tmp/x", proposal.intents().get(0).args().get("path"));
            assertFalse(proposal.intents().get(0).independent());
            assertTrue(proposal.intents().get(1).independent());
            assertNotNull(proposal.sessionToken());
        }

        @Test
        @DisplayName("uses the request temperature")
        void usesTemperature() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("s", List.of()));

            planner.plan(request(List.of(), 0.5, null));

            verify(llmService).structuredCall(anyString(), anyString(), eq(PlanDraft.class), eq(0.5));
        }

        @Test
        @DisplayName("prompt carries catalog, memory, context and rejection history")
        void promptContents() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("s", List.of()));

            planner.plan(request(List.of("permission denied on /tmp/x"), 0.3, null));

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(anyString(), user.capture(), eq(PlanDraft.class), anyDouble());
            String prompt = user.getValue();
            assertTrue(prompt.contains("Goal: create /tmp/x"));
            assertTrue(prompt.contains("filesystem: create_directory(path)"));
            assertTrue(prompt.contains("[SUCCESS] create /tmp/y: used create_directory"));
            assertTrue(prompt.contains("1. set up workspace"));
            assertTrue(prompt.contains("1. permission denied on /tmp/x"));
        }

        @Test
        @DisplayName("reuses the session token handed back by the run loop")
        void reusesSessionToken() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("s", List.of()));

            assertEquals("session-7", planner.plan(request(List.of(), 0.1, "session-7")).sessionToken());
        }

        @Test
        @DisplayName("steps without a tool name are dropped")
        void dropsBlankSteps() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("s", Arrays.asList(
                            new PlanDraft.Step("filesystem", " ", Map.of(), false),
                            new PlanDraft.Step("filesystem", null, Map.of(), false),
                            new PlanDraft.Step("filesystem", "read_file", Map.of("path", "a"), false))));

            PlanProposal proposal = planner.plan(request(List.of(), 0.1, null));

            assertEquals(1, proposal.intents().size());
            assertEquals("read_file", proposal.intents().get(0).toolName());
        }

        @Test
        @DisplayName("a missing step list yields a plan with no calls")
        void nullSteps() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft("nothing to do", null));

            assertTrue(planner.plan(request(List.of(), 0.1, null)).intents().isEmpty());
        }

        @Test
        @DisplayName("a blank strategy is an agent failure")
        void blankStrategy() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenReturn(new PlanDraft(" ", List.of()));

            var ex = assertThrows(AgentException.class, () -> planner.plan(request(List.of(), 0.1, null)));
            assertEquals("planner", ex.getRole());
        }

        @Test
        @DisplayName("LLM failures are wrapped in AgentException")
        void wrapsLlmFailure() {
            when(llmService.structuredCall(anyString(), anyString(), eq(PlanDraft.class), anyDouble()))
                    .thenThrow(new LlmEmptyResponseException(PlanDraft.class));

            var ex = assertThrows(AgentException.class, () -> planner.plan(request(List.of(), 0.1, null)));
            assertEquals("planner", ex.getRole());
            assertInstanceOf(LlmEmptyResponseException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("decompose")
    class Decompose {

        private final DecomposeRequest request = new DecomposeRequest("run-1", "1", "set up project",
                List.of(), List.of(), List.of("too broad", "too broad", "too broad"));

        @Test
        @DisplayName("returns trimmed subgoals in order")
        void returnsSubgoals() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SubgoalDraft.class), anyDouble()))
                    .thenReturn(new SubgoalDraft(List.of(
                            new SubgoalDraft.Item("  create dir ", false),
                            new SubgoalDraft.Item("write readme", true))));

            List<SubgoalProposal> subgoals = planner.decompose(request);

            assertEquals(2, subgoals.size());
            assertEquals("create dir", subgoals.get(0).goal());
            assertFalse(subgoals.get(0).independent());
            assertTrue(subgoals.get(1).independent());
        }

        @Test
        @DisplayName("runs at a fixed low temperature")
        void coldTemperature() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SubgoalDraft.class), anyDouble()))
                    .thenReturn(new SubgoalDraft(List.of()));

            planner.decompose(request);

            verify(llmService).structuredCall(anyString(), anyString(), eq(SubgoalDraft.class), eq(0.1));
        }

        @Test
        @DisplayName("blank subgoals are dropped and a null draft means irreducible")
        void irreducible() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SubgoalDraft.class), anyDouble()))
                    .thenReturn(new SubgoalDraft(List.of(new SubgoalDraft.Item(" ", false))))
                    .thenReturn(null);

            assertTrue(planner.decompose(request).isEmpty());
            assertTrue(planner.decompose(request).isEmpty());
        }

        @Test
        @DisplayName("LLM failures are wrapped in AgentException")
        void wrapsLlmFailure() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SubgoalDraft.class), anyDouble()))
                    .thenThrow(new IllegalStateException("boom"));

            assertThrows(AgentException.class, () -> planner.decompose(request));
        }
    }

    @Test
    @DisplayName("planner is registered under the name llm")
    void name() {
        assertEquals("llm", planner.name());
    }
}
