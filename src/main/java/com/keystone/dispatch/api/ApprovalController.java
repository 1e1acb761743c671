package com.keystone.dispatch.api;

import com.keystone.core.security.ApprovalRequest;
import com.keystone.core.security.PendingApprovalService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for tool calls held by the danger gate.
 */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final PendingApprovalService approvals;

    public ApprovalController(PendingApprovalService approvals) {
        this.approvals = approvals;
    }

    /**
     * GET /api/v1/approvals: Calls waiting for a decision, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<ApprovalRequest>> pending() {
        return ResponseEntity.ok(approvals.pending());
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable String id,
                                                       @RequestBody(required = false) ApprovalDecisionRequest body) {
        return decide(id, true, body);
    }

    @PostMapping("/{id}/deny")
    public ResponseEntity<Map<String, Object>> deny(@PathVariable String id,
                                                    @RequestBody(required = false) ApprovalDecisionRequest body) {
        return decide(id, false, body);
    }

    private ResponseEntity<Map<String, Object>> decide(String id, boolean approved, ApprovalDecisionRequest body) {
        String reason = body == null ? null : body.reason();
        if (!approvals.resolve(id, approved, reason)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("approval_id", id, "approved", approved));
    }
}
