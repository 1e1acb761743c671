package com.keystone.dispatch.api;

import com.keystone.core.audit.AuditEntry;
import com.keystone.core.engine.RunEngine;
import com.keystone.core.engine.RunNotFoundException;
import com.keystone.core.graph.NodeNotFoundException;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.Verdict;
import com.keystone.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for run lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunEngine runEngine;
    private final SseStreamingService sseStreamingService;

    public RunController(RunEngine runEngine, SseStreamingService sseStreamingService) {
        this.runEngine = runEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Submit a goal. Runs asynchronously; re-submitting a known
     * run_id returns it without dispatching anything.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody RunRequest request) {
        if (request.goal() == null || request.goal().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Goal is required"));
        }
        if (request.deadlineSeconds() != null && request.deadlineSeconds() <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "deadline_seconds must be positive"));
        }
        Instant deadline = request.deadlineSeconds() == null ? null
                : Instant.now().plusSeconds(request.deadlineSeconds());
        var constraints = new TaskConstraints(deadline, Boolean.TRUE.equals(request.allowDangerousOps()));
        try {
            String runId = runEngine.submitGoal(request.goal(), request.runId(), constraints);
            log.info("Accepted run {}", runId);
            return ResponseEntity.accepted().body(Map.of("run_id", runId, "status", "RUNNING"));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/runs: All runs known to this process.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> list() {
        return ResponseEntity.ok(runEngine.listRuns().stream().map(RunResponse::from).toList());
    }

    /**
     * GET /api/v1/runs/{id}: Current snapshot. Pass {@code since} to get 304 when nothing changed.
     */
    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> get(@PathVariable String id,
                                           @RequestParam(name = "since", required = false) Long since) {
        try {
            var snapshot = runEngine.snapshot(id);
            if (since != null && snapshot.version() <= since) {
                return ResponseEntity.status(304).build();
            }
            return ResponseEntity.ok(RunResponse.from(snapshot));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * GET /api/v1/runs/{id}/events: SSE stream of run events. {@code types} limits the stream
     * to those event types; the terminal run event is always sent.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id,
                                             @RequestParam(name = "types", required = false) Set<String> types) {
        try {
            var snapshot = runEngine.snapshot(id);
            return ResponseEntity.ok(sseStreamingService.createEmitter(id, snapshot,
                    types == null ? Set.of() : types));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * POST /api/v1/runs/{id}/cancel: Cancel the whole run.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        try {
            boolean cancelled = runEngine.cancel(id);
            return ResponseEntity.ok(Map.of("run_id", id, "cancelled", cancelled));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * POST /api/v1/runs/{id}/nodes/{nodeId}/cancel: Cancel one node and its descendants.
     */
    @PostMapping("/{id}/nodes/{nodeId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelNode(@PathVariable String id, @PathVariable String nodeId) {
        try {
            boolean cancelled = runEngine.cancelNode(id, nodeId);
            return ResponseEntity.ok(Map.of("run_id", id, "node_id", nodeId, "cancelled", cancelled));
        } catch (RunNotFoundException | NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * POST /api/v1/runs/{id}/nodes/{nodeId}/feedback: Human verdict for a pending or
     * suspended node, applied exactly as a Verifier verdict.
     */
    @PostMapping("/{id}/nodes/{nodeId}/feedback")
    public ResponseEntity<Map<String, String>> feedback(@PathVariable String id, @PathVariable String nodeId,
                                                        @RequestBody FeedbackRequest request) {
        VerificationResult feedback;
        try {
            Verdict verdict = Verdict.valueOf(String.valueOf(request.verdict()).toUpperCase());
            feedback = new VerificationResult(verdict, request.rationale(), request.remediation());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid feedback: " + e.getMessage()));
        }
        try {
            runEngine.injectFeedback(id, nodeId, feedback);
            return ResponseEntity.accepted().body(Map.of("run_id", id, "node_id", nodeId,
                    "verdict", feedback.verdict().name()));
        } catch (RunNotFoundException | NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/runs/{id}/audit: Audit trail, optionally narrowed to one node's decisions.
     */
    @GetMapping("/{id}/audit")
    public ResponseEntity<List<AuditEntry>> audit(@PathVariable String id,
                                                  @RequestParam(name = "node", required = false) String nodeId) {
        try {
            return ResponseEntity.ok(nodeId == null
                    ? runEngine.auditTrail(id)
                    : runEngine.decisionChain(id, nodeId));
        } catch (RunNotFoundException | NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
