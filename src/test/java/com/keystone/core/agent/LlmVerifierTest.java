package com.keystone.core.agent;

import com.keystone.broker.ToolErrorKind;
import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.llm.LlmParseException;
import com.keystone.core.llm.LlmService;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.Verdict;
import com.keystone.core.model.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmVerifierTest {

    private LlmService llmService;
    private AgentProperties properties;
    private LlmVerifier verifier;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new AgentProperties();
        verifier = new LlmVerifier(llmService, properties);
    }

    private static ResultBundle okBundle() {
        return new ResultBundle("make dir", List.of(
                ToolInvocationResult.success("filesystem", "create_directory", "created /tmp/x", Duration.ofMillis(5))),
                false, false, null, 5);
    }

    @Test
    @DisplayName("a bundle with a failed call is rejected without asking the model")
    void failedCallRejected() {
        var bundle = new ResultBundle("make dir", List.of(
                ToolInvocationResult.failure("filesystem", "create_directory", ToolErrorKind.REMOTE_ERROR,
                        "EACCES", Duration.ofMillis(3))), false, false, null, 3);

        VerificationResult result = verifier.verify(bundle, "create /tmp/x");

        assertEquals(Verdict.REJECT, result.verdict());
        assertEquals("tool_error[remote_error]: filesystem/create_directory EACCES", result.rationale());
        verifyNoInteractions(llmService);
    }

    @Test
    @DisplayName("the model's approval is returned with its rationale")
    void approve() {
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenReturn(new VerdictDraft("APPROVE", "directory exists", null));

        VerificationResult result = verifier.verify(okBundle(), "create /tmp/x");

        assertEquals(Verdict.APPROVE, result.verdict());
        assertEquals("directory exists", result.rationale());
    }

    @Test
    @DisplayName("the prompt lists goal, strategy and tool payloads and uses the verifier temperature")
    void promptAndTemperature() {
        properties.setVerifierTemperature(0.2);
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenReturn(new VerdictDraft("APPROVE", "ok", null));

        verifier.verify(okBundle(), "create /tmp/x");

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(llmService).structuredCall(anyString(), user.capture(), eq(VerdictDraft.class), eq(0.2));
        assertTrue(user.getValue().contains("Goal: create /tmp/x"));
        assertTrue(user.getValue().contains("Strategy: make dir"));
        assertTrue(user.getValue().contains("- filesystem/create_directory: created /tmp/x"));
    }

    @Test
    @DisplayName("a rejection keeps the remediation hint")
    void rejectWithRemediation() {
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenReturn(new VerdictDraft("reject", "wrong path", "use /tmp/x"));

        VerificationResult result = verifier.verify(okBundle(), "create /tmp/x");

        assertEquals(Verdict.REJECT, result.verdict());
        assertEquals("wrong path (remediation: use /tmp/x)", result.fullRationale());
    }

    @Test
    @DisplayName("a rejection without a rationale gets a placeholder")
    void rejectWithoutRationale() {
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenReturn(new VerdictDraft("REJECT", "", null));

        VerificationResult result = verifier.verify(okBundle(), "create /tmp/x");

        assertEquals("verifier rejected without a rationale", result.rationale());
    }

    @Test
    @DisplayName("model failures surface as AgentException for the verifier role")
    void modelFailure() {
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenThrow(new LlmParseException(VerdictDraft.class, "not json", new RuntimeException("bad json")));

        var ex = assertThrows(AgentException.class, () -> verifier.verify(okBundle(), "create /tmp/x"));
        assertEquals("verifier", ex.getRole());
    }

    @Test
    @DisplayName("a null draft is an agent failure")
    void nullDraft() {
        when(llmService.structuredCall(anyString(), anyString(), eq(VerdictDraft.class), anyDouble()))
                .thenReturn(null);

        assertThrows(AgentException.class, () -> verifier.verify(okBundle(), "create /tmp/x"));
    }

    @Test
    @DisplayName("parseVerdict is lenient about case and separators")
    void parseVerdict() {
        assertEquals(Verdict.APPROVE, LlmVerifier.parseVerdict(" approve "));
        assertEquals(Verdict.NEED_MORE_INFO, LlmVerifier.parseVerdict("need more info"));
        assertEquals(Verdict.NEED_MORE_INFO, LlmVerifier.parseVerdict("Need-More-Info"));
        assertEquals(Verdict.REJECT, LlmVerifier.parseVerdict("maybe"));
        assertEquals(Verdict.REJECT, LlmVerifier.parseVerdict(null));
    }
}
