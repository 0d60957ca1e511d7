package com.keystone.dispatch.api;

import com.keystone.core.audit.AuditQuery;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * REST controller for task submission, status, escalation and cancellation.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);
    private static final int STATUS_AUDIT_ENTRIES = 5;

    private final GovernanceService governance;
    private final SseStreamingService sseStreamingService;

    public TaskController(GovernanceService governance, SseStreamingService sseStreamingService) {
        this.governance = governance;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: Submit a goal. Admitted tasks run asynchronously;
     * refusals are answered with the error kind and the rules that applied.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> submit(@RequestBody TaskRequest request) {
        List<ProvenanceRecord> provenance = request.provenance() == null ? List.of()
                : request.provenance().stream().map(ProvenanceInput::toRecord).toList();
        var options = new SubmitOptions(
                Boolean.TRUE.equals(request.allowSingleSource()),
                request.overrideReason(),
                request.projectedSteps(),
                request.projectedToolCalls(),
                request.submittedBy());
        TaskRecord task = governance.submit(request.goal(), provenance, options);
        log.info("Accepted task {} at {} risk", task.id(), task.riskTier());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(task));
    }

    /**
     * GET /api/v1/tasks: List tasks, optionally filtered by outcome.
     */
    @GetMapping
    public List<TaskResponse> list(@RequestParam(required = false) String outcome) {
        Optional<TaskOutcome> filter = Optional.ofNullable(outcome)
                .map(o -> TaskOutcome.valueOf(o.toUpperCase(Locale.ROOT)));
        return governance.tasks(filter).stream()
                .map(t -> TaskResponse.from(t, List.of()))
                .toList();
    }

    /**
     * GET /api/v1/tasks/{id}: Current snapshot plus the latest audit entries.
     */
    @GetMapping("/{id}")
    public TaskResponse get(@PathVariable String id) {
        return toResponse(governance.task(id));
    }

    /**
     * POST /api/v1/tasks/{id}/escalation: Human decision on an escalated task.
     */
    @PostMapping("/{id}/escalation")
    public TaskResponse resolve(@PathVariable String id, @RequestBody EscalationRequest request) {
        if (request.decision() == null) {
            throw new IllegalArgumentException("Decision is required (APPROVE or REJECT)");
        }
        EscalationDecision decision = EscalationDecision.valueOf(request.decision().toUpperCase(Locale.ROOT));
        return toResponse(governance.resolveEscalation(id, decision, request.approver(), request.note()));
    }

    /**
     * POST /api/v1/tasks/{id}/cancel: Cancel a running or escalated task.
     */
    @PostMapping("/{id}/cancel")
    public TaskResponse cancel(@PathVariable String id, @RequestBody(required = false) CancelRequest request) {
        String reason = request != null ? request.reason() : null;
        return toResponse(governance.cancel(id, reason));
    }

    /**
     * GET /api/v1/tasks/{id}/events: SSE stream of governance events for a task.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        governance.task(id);
        return sseStreamingService.createEmitter(id);
    }

    private TaskResponse toResponse(TaskRecord task) {
        var audit = governance.audit(AuditQuery.forSubject(task.id()));
        var latest = audit.subList(Math.max(0, audit.size() - STATUS_AUDIT_ENTRIES), audit.size());
        return TaskResponse.from(task, latest);
    }
}
