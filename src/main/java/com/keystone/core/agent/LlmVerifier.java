package com.keystone.core.agent;

import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.llm.LlmService;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.Verdict;
import com.keystone.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Verifier backed by the configured chat model. Failed tool calls are rejected without
 * asking the model.
 */
@Component
public class LlmVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(LlmVerifier.class);

    private static final int MAX_PAYLOAD_CHARS = 4000;

    private static final String SYSTEM_PROMPT = """
            You are the verifier of a personal automation assistant.
            Decide whether the tool results below achieve the goal.

            Answer with one verdict:
            - APPROVE when the results show the goal is achieved.
            - REJECT when they do not; give a specific rationale and, if you can, a remediation
              the planner should try next.
            - NEED_MORE_INFO only when the goal itself is ambiguous and a human must clarify it.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final AgentProperties properties;

    public LlmVerifier(LlmService llmService, AgentProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public VerificationResult verify(ResultBundle bundle, String goal) {
        if (bundle.hasFailures()) {
            ToolInvocationResult failure = bundle.firstFailure().orElseThrow();
            return VerificationResult.reject("tool_error[" + failure.errorKind().wireName() + "]: "
                    + failure.serverId() + "/" + failure.toolName() + " " + failure.errorMessage());
        }

        StringBuilder results = new StringBuilder();
        for (ToolInvocationResult result : bundle.results()) {
            results.append("- ").append(result.serverId()).append('/').append(result.toolName()).append(": ")
                    .append(truncate(result.payload())).append('\n');
        }
        String userPrompt = """
                Goal: %s

                Strategy: %s

                Tool results:
                %s
                """.formatted(goal, bundle.strategy(), results.length() == 0 ? "(no tool calls were made)" : results);

        VerdictDraft draft;
        try {
            draft = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, VerdictDraft.class,
                    properties.getVerifierTemperature());
        } catch (RuntimeException e) {
            throw new AgentException("verifier", "Verification failed: " + e.getMessage(), e);
        }
        if (draft == null) {
            throw new AgentException("verifier", "Verifier returned nothing");
        }
        Verdict verdict = parseVerdict(draft.verdict());
        String rationale = draft.rationale();
        if (verdict == Verdict.REJECT && (rationale == null || rationale.isBlank())) {
            rationale = "verifier rejected without a rationale";
        }
        log.info("Verdict for '{}': {} ({})", goal, verdict, rationale);
        return new VerificationResult(verdict, rationale, draft.remediation());
    }

    static Verdict parseVerdict(String raw) {
        if (raw == null) {
            return Verdict.REJECT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return Verdict.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown verdict '{}', treating as REJECT", raw);
            return Verdict.REJECT;
        }
    }

    private static String truncate(String payload) {
        if (payload == null) {
            return "";
        }
        return payload.length() <= MAX_PAYLOAD_CHARS ? payload : payload.substring(0, MAX_PAYLOAD_CHARS) + " [truncated]";
    }
}
