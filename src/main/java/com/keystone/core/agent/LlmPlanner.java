package com.keystone.core.agent;

import com.keystone.broker.ToolBroker;
import com.keystone.core.llm.LlmService;
import com.keystone.core.memory.StrategyRecord;
import com.keystone.core.model.PlanProposal;
import com.keystone.core.model.SubgoalProposal;
import com.keystone.core.model.ToolCallIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Planner backed by the configured chat model. Plans are grounded in the broker's live
 * tool catalog, past strategies for similar goals and the node's own rejection history.
 */
@Component
public class LlmPlanner implements Planner {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanner.class);

    /** Decomposition is a structural task and always runs cold. */
    private static final double DECOMPOSE_TEMPERATURE = 0.1;

    private static final String PLAN_SYSTEM_PROMPT = """
            You are the planner of a personal automation assistant.
            Given a goal, produce a short strategy and the exact tool calls that carry it out.

            Rules:
            1. Only use tools listed in the tool catalog. Use the server name shown before the colon.
            2. Give every call concrete arguments; never leave placeholders.
            3. Mark a step "independent": true only when it does not need the previous step's result.
            4. If earlier attempts were rejected, address every rejection reason explicitly
               and choose a different approach rather than repeating a failed one.
            5. Keep plans minimal: the fewest calls that fully achieve the goal.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String DECOMPOSE_SYSTEM_PROMPT = """
            You are the planner of a personal automation assistant.
            A goal could not be achieved directly. Split it into 2 to 5 smaller subgoals that,
            completed in order, achieve the original goal. Each subgoal must be simpler than the
            goal and achievable on its own with the available tools.
            Mark a subgoal "independent": true when it does not rely on earlier subgoals.
            If the goal cannot be split meaningfully, return an empty list.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final ToolBroker toolBroker;

    public LlmPlanner(LlmService llmService, ToolBroker toolBroker) {
        this.llmService = llmService;
        this.toolBroker = toolBroker;
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public PlanProposal plan(PlanRequest request) {
        String userPrompt = """
                Goal: %s

                Parent goals (outermost first):
                %s

                Tool catalog:
                %s

                Past strategies for similar goals:
                %s

                Rejected attempts at this goal:
                %s
                """.formatted(request.goal(), bullets(request.contextStack()), toolBroker.catalogSummary(),
                memory(request.memoryHits()), bullets(request.rejections()));

        PlanDraft draft;
        try {
            draft = llmService.structuredCall(PLAN_SYSTEM_PROMPT, userPrompt, PlanDraft.class, request.temperature());
        } catch (RuntimeException e) {
            throw new AgentException("planner", "Planning failed: " + e.getMessage(), e);
        }
        if (draft == null || draft.strategy() == null || draft.strategy().isBlank()) {
            throw new AgentException("planner", "Planner returned no strategy");
        }
        List<ToolCallIntent> intents = draft.steps() == null ? List.of() : draft.steps().stream()
                .filter(s -> s.tool() != null && !s.tool().isBlank())
                .map(s -> new ToolCallIntent(s.server(), s.tool(), s.args(), s.independent()))
                .toList();
        log.info("Planned node {} with {} tool call(s): {}", request.nodeId(), intents.size(), draft.strategy());
        String session = request.sessionToken() != null ? request.sessionToken() : UUID.randomUUID().toString();
        return new PlanProposal(draft.strategy(), intents, session);
    }

    @Override
    public List<SubgoalProposal> decompose(DecomposeRequest request) {
        String userPrompt = """
                Goal: %s

                Parent goals (outermost first):
                %s

                Why direct attempts failed:
                %s

                Lessons from similar failures:
                %s
                """.formatted(request.goal(), bullets(request.contextStack()), bullets(request.rejections()),
                memory(request.failureHits()));

        SubgoalDraft draft;
        try {
            draft = llmService.structuredCall(DECOMPOSE_SYSTEM_PROMPT, userPrompt, SubgoalDraft.class, DECOMPOSE_TEMPERATURE);
        } catch (RuntimeException e) {
            throw new AgentException("planner", "Decomposition failed: " + e.getMessage(), e);
        }
        if (draft == null || draft.subgoals() == null) {
            return List.of();
        }
        return draft.subgoals().stream()
                .filter(i -> i.goal() != null && !i.goal().isBlank())
                .map(i -> new SubgoalProposal(i.goal().trim(), i.independent()))
                .toList();
    }

    private static String bullets(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return "(none)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            sb.append(i + 1).append(". ").append(lines.get(i)).append('\n');
        }
        return sb.toString().trim();
    }

    private static String memory(List<StrategyRecord> records) {
        if (records == null || records.isEmpty()) {
            return "(none)";
        }
        StringBuilder sb = new StringBuilder();
        for (StrategyRecord record : records) {
            sb.append("- [").append(record.outcome()).append("] ").append(record.goal())
                    .append(": ").append(record.narrative()).append('\n');
        }
        return sb.toString().trim();
    }
}
