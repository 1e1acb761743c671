package com.keystone.dispatch.api;

import com.keystone.core.security.ApprovalRequest;
import com.keystone.core.security.PendingApprovalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApprovalController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ApprovalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PendingApprovalService approvals;

    @Test
    @DisplayName("GET /approvals lists held calls")
    void listPending() throws Exception {
        when(approvals.pending()).thenReturn(List.of(new ApprovalRequest("a-1", "run-1", "1.2", "shell",
                "run_command", Map.of("command", "rm -rf /"), "rm -rf /", Instant.parse("2026-10-19T10:00:00Z"))));

        mockMvc.perform(get("/api/v1/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("a-1"))
                .andExpect(jsonPath("$[0].toolName").value("run_command"))
                .andExpect(jsonPath("$[0].matchedPattern").value("rm -rf /"));
    }

    @Test
    @DisplayName("POST /approvals/{id}/approve resolves the request")
    void approve() throws Exception {
        when(approvals.resolve("a-1", true, "checked the path")).thenReturn(true);

        mockMvc.perform(post("/api/v1/approvals/{id}/approve", "a-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"checked the path\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approval_id").value("a-1"))
                .andExpect(jsonPath("$.approved").value(true));
    }

    @Test
    @DisplayName("POST /approvals/{id}/deny works without a body")
    void denyWithoutBody() throws Exception {
        when(approvals.resolve("a-1", false, null)).thenReturn(true);

        mockMvc.perform(post("/api/v1/approvals/{id}/deny", "a-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(false));
        verify(approvals).resolve("a-1", false, null);
    }

    @Test
    @DisplayName("deciding an unknown or already decided request returns 404")
    void unknown() throws Exception {
        when(approvals.resolve(anyString(), anyBoolean(), any())).thenReturn(false);

        mockMvc.perform(post("/api/v1/approvals/{id}/approve", "gone"))
                .andExpect(status().isNotFound());
    }
}
