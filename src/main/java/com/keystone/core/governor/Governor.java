package com.keystone.core.governor;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.episodic.EpisodicHistory;
import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.error.AuthorityViolationException;
import com.keystone.core.error.BudgetExceededException;
import com.keystone.core.error.GovernanceException;
import com.keystone.core.error.InsufficientProvenanceException;
import com.keystone.core.error.MalformedProvenanceException;
import com.keystone.core.error.PolicyConflictException;
import com.keystone.core.error.StateConflictException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.GovernanceEvent;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.GovernanceMetrics;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.Escalation;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.EscalationTrigger;
import com.keystone.core.model.EpisodeRecord;
import com.keystone.core.model.HumanApproval;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.model.Stage;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.model.TaskStatusView;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The single authority over task admission, risk, routing and escalation.
 * <p>
 * Pipeline stages never decide what runs next: after each stage the graph asks
 * the Governor ({@link #route}), and every terminal or escalated state is entered
 * through {@link #escalate}, {@link #reject} or {@link #complete}, each of which
 * writes an audit entry and an episode. Only a human can move a task out of
 * ESCALATED, via {@link #resolveEscalation}.
 */
public class Governor {

    private static final Logger log = LoggerFactory.getLogger(Governor.class);

    private final PolicyView policy;
    private final ProvenanceLedger ledger;
    private final AuditLog audit;
    private final TaskStore tasks;
    private final EpisodicHistory episodes;
    private final RiskAssessor riskAssessor;
    private final TransitionTable transitions;
    private final CancellationRegistry cancellations;
    private final KeystoneProperties props;
    private final GovernanceMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    public Governor(PolicyView policy, ProvenanceLedger ledger, AuditLog audit, TaskStore tasks,
                    EpisodicHistory episodes, RiskAssessor riskAssessor, TransitionTable transitions,
                    CancellationRegistry cancellations, KeystoneProperties props, GovernanceMetrics metrics,
                    EventBus eventBus, Clock clock) {
        this.policy = policy;
        this.ledger = ledger;
        this.audit = audit;
        this.tasks = tasks;
        this.episodes = episodes;
        this.riskAssessor = riskAssessor;
        this.transitions = transitions;
        this.cancellations = cancellations;
        this.props = props;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Admits or refuses a new task. A refused submission creates no task; both
     * outcomes are audited under the generated task id.
     *
     * @return the admitted task in PENDING outcome
     * @throws MalformedProvenanceException     if any provenance record is malformed
     * @throws InsufficientProvenanceException  if too few distinct sources back the goal
     * @throws PolicyConflictException          if the goal hits a blocking rule
     */
    public TaskRecord submit(String goal, List<ProvenanceRecord> provenance, SubmitOptions options) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be blank");
        }
        SubmitOptions opts = options != null ? options : SubmitOptions.defaults();
        List<ProvenanceRecord> records = provenance != null ? provenance : List.of();
        String taskId = tasks.nextId();
        MdcContext.setTask(taskId);
        try {
            try {
                ledger.validateAll(records);
            } catch (MalformedProvenanceException e) {
                throw refuse(taskId, e);
            }

            long distinct = records.stream().map(ProvenanceRecord::sourceKey).distinct().count();
            int required = props.getGovernor().getMinDistinctSources();
            String override = null;
            if (distinct < required) {
                if (!opts.allowSingleSource() || distinct == 0) {
                    throw refuse(taskId, new InsufficientProvenanceException(
                            "Goal is backed by " + distinct + " distinct source(s); " + required + " required",
                            List.of(PolicyRefs.TWO_SOURCES)));
                }
                if (opts.overrideReason() == null || opts.overrideReason().isBlank()) {
                    throw refuse(taskId, new InsufficientProvenanceException(
                            "Single-source override needs a reason", List.of(PolicyRefs.TWO_SOURCES)));
                }
                override = opts.overrideReason().trim();
            }

            List<PolicyRule> blocking = policy.matching(goal, RuleEffect.BLOCK);
            if (!blocking.isEmpty()) {
                throw refuse(taskId, new PolicyConflictException(
                        "Goal conflicts with blocking rule(s): " + blocking.stream()
                                .map(r -> r.id() + " ('" + r.firstMatch(goal) + "')")
                                .collect(Collectors.joining(", ")),
                        blocking.stream().map(PolicyRule::id).toList()));
            }

            RiskAssessment risk = riskAssessor.assess(goal, opts.projectedSteps(), opts.projectedToolCalls());
            List<String> provenanceIds = ledger.appendAll(records).stream().map(ProvenanceRecord::id).toList();

            TaskRecord task = tasks.create(TaskRecord.builder()
                    .id(taskId)
                    .goal(goal.trim())
                    .riskTier(risk.tier())
                    .riskRationale(risk.rationale())
                    .riskPolicyRefs(risk.policyRefs())
                    .submittedBy(opts.submittedBy())
                    .budget(props.budgetFor(risk.tier()))
                    .submittedProvenanceIds(provenanceIds)
                    .singleSourceOverride(override)
                    .outcome(TaskOutcome.PENDING)
                    .rationale("Admitted at " + risk.tier() + " risk")
                    .build());

            List<String> refs = new ArrayList<>(List.of(PolicyRefs.PROVENANCE_REQUIRED, PolicyRefs.TWO_SOURCES));
            refs.addAll(risk.policyRefs());
            audit.append(taskId, AuditEntry.GOVERNOR, "ADMITTED",
                    "Admitted with " + provenanceIds.size() + " provenance record(s) from " + distinct
                            + " distinct source(s); risk " + risk.rationale(), refs);
            if (override != null) {
                audit.append(taskId, AuditEntry.GOVERNOR, "SINGLE_SOURCE_OVERRIDE",
                        "Admitted below the " + required + "-source minimum: " + override,
                        List.of(PolicyRefs.TWO_SOURCES));
            }
            metrics.recordSubmission("admitted");
            metrics.recordRiskTier(risk.tier().name());
            publish("task.admitted", task, null, Map.of("riskTier", risk.tier().name()));
            log.info("Admitted task {} at {} risk", taskId, risk.tier());
            return task;
        } finally {
            MdcContext.clear();
        }
    }

    /** Risk assessment without admission, for previews. */
    public RiskAssessment assessRisk(String goal, SubmitOptions options) {
        SubmitOptions opts = options != null ? options : SubmitOptions.defaults();
        return riskAssessor.assess(goal, opts.projectedSteps(), opts.projectedToolCalls());
    }

    /** Decides what follows the stage the task just finished. */
    public RouteDecision route(TaskRecord task) {
        return transitions.next(task);
    }

    /** Where a task that has not run yet, or was just resumed, starts. */
    public Stage entryStage(TaskRecord task) {
        return task.currentStage() == null ? transitions.entry() : task.currentStage();
    }

    /**
     * Decides how to continue after a stage failed. {@code task.failureCount()}
     * must already include this failure.
     */
    public RouteDecision onStageFailure(TaskRecord task, Stage stage, RuntimeException error) {
        if (error instanceof AuthorityViolationException violation) {
            metrics.recordAuthorityViolation(stage.name());
            return RouteDecision.escalate(new Escalation(EscalationTrigger.AUTHORITY_VIOLATION,
                    violation.getMessage(), stage, stage, List.of(PolicyRefs.STAGE_AUTHORITY), clock.instant()));
        }
        if (error instanceof BudgetExceededException budget) {
            return RouteDecision.reject("BUDGET_EXCEEDED", budget.getMessage(),
                    List.of(PolicyRefs.BUDGET_TERMINATES));
        }
        if (error instanceof MalformedProvenanceException malformed) {
            return RouteDecision.reject("MALFORMED_PROVENANCE", malformed.getMessage(),
                    List.of(PolicyRefs.PROVENANCE_REQUIRED));
        }
        if (error instanceof PolicyConflictException conflict) {
            return RouteDecision.escalate(new Escalation(EscalationTrigger.POLICY_CONFLICT,
                    conflict.getMessage(), stage, stage, withHumanAuthority(conflict.policyRefs()), clock.instant()));
        }
        if (task.failureCount() <= props.getGovernor().getStageFailureRetries()) {
            String reason = "Stage " + stage + " failed (" + describe(error) + "); retry "
                    + task.failureCount() + " of " + props.getGovernor().getStageFailureRetries();
            audit.append(task.id(), AuditEntry.GOVERNOR, "RETRY_STAGE", reason, List.of(PolicyRefs.STAGE_FAILURES));
            return RouteDecision.retry(stage, reason, List.of(PolicyRefs.STAGE_FAILURES));
        }
        return RouteDecision.escalate(new Escalation(EscalationTrigger.STAGE_FAILURE,
                "Stage " + stage + " failed " + task.failureCount() + " time(s): " + describe(error),
                stage, stage, List.of(PolicyRefs.STAGE_FAILURES), clock.instant()));
    }

    /**
     * Moves a task to ESCALATED and waits for a human. A cancellation requested
     * while the last stage ran takes precedence and rejects the task instead.
     */
    public TaskRecord escalate(TaskRecord task, Escalation escalation) {
        Optional<String> cancelled = cancellations.consume(task.id());
        if (cancelled.isPresent()) {
            return rejectCancelled(task, cancelled.get());
        }
        TaskRecord saved = tasks.save(task.toBuilder()
                .outcome(TaskOutcome.ESCALATED)
                .escalation(escalation)
                .rationale(escalation.reason())
                .build());
        audit.append(task.id(), AuditEntry.GOVERNOR, "ESCALATED",
                escalation.trigger() + ": " + escalation.reason() + " (resumes at " + escalation.resumeStage() + ")",
                escalation.policyRefs());
        recordEpisode(saved, escalation.trigger().name());
        metrics.incrementEscalations(escalation.trigger().name());
        publish("task.escalated", saved, escalation.raisedAt(), Map.of(
                "trigger", escalation.trigger().name(), "reason", escalation.reason()));
        log.warn("Task {} escalated at {}: {}", task.id(), escalation.raisedAt(), escalation.reason());
        return saved;
    }

    /** Terminates a task as REJECTED. */
    public TaskRecord reject(TaskRecord task, String kind, String reason, List<String> policyRefs) {
        cancellations.consume(task.id());
        TaskRecord saved = tasks.save(task.toBuilder()
                .outcome(TaskOutcome.REJECTED)
                .escalation(null)
                .rationale(reason)
                .build());
        audit.append(task.id(), AuditEntry.GOVERNOR, "REJECTED", reason,
                policyRefs.isEmpty() ? List.of(PolicyRefs.REFUSAL_IS_VALID) : policyRefs);
        recordEpisode(saved, kind);
        metrics.recordTaskOutcome(TaskOutcome.REJECTED.name());
        metrics.recordStepsUsed(saved.usage().steps());
        publish("task.rejected", saved, saved.currentStage(), Map.of("reason", reason));
        log.warn("Task {} rejected: {}", task.id(), reason);
        return saved;
    }

    /**
     * Terminates a task as DONE. LOW-tier tasks, which skip Review, get a
     * post-hoc audit entry. A pending cancellation rejects the task instead.
     */
    public TaskRecord complete(TaskRecord task, RouteDecision decision) {
        Optional<String> cancelled = cancellations.consume(task.id());
        if (cancelled.isPresent()) {
            return rejectCancelled(task, cancelled.get());
        }
        if (task.riskTier() == RiskTier.LOW) {
            String trail = audit.forSubject(task.id()).stream()
                    .filter(e -> !AuditEntry.GOVERNOR.equals(e.stage()))
                    .map(e -> e.stage() + ":" + e.decision())
                    .collect(Collectors.joining(", "));
            audit.append(task.id(), AuditEntry.GOVERNOR, "POST_HOC_AUDIT",
                    "LOW-tier task completed without Review; stage decisions: " + trail,
                    List.of(PolicyRefs.DECISIONS_LOGGED, PolicyRefs.NO_SKIPPED_CHECKS));
        }
        String rationale = "Completed " + task.riskTier() + "-tier pipeline"
                + (decision.reason() == null || decision.reason().isBlank() ? "" : ": " + decision.reason());
        TaskRecord saved = tasks.save(task.toBuilder()
                .outcome(TaskOutcome.DONE)
                .rationale(rationale)
                .build());
        audit.append(task.id(), AuditEntry.GOVERNOR, "DONE", rationale, decision.policyRefs());
        recordEpisode(saved, "COMPLETED");
        metrics.recordTaskOutcome(TaskOutcome.DONE.name());
        metrics.recordStepsUsed(saved.usage().steps());
        publish("task.completed", saved, saved.currentStage(), Map.of());
        log.info("Task {} completed", task.id());
        return saved;
    }

    /**
     * Records a human decision on an escalated task. On approval the task
     * returns to APPROVED at the escalation's resume stage and the caller should
     * resume the pipeline; on rejection it terminates.
     */
    public TaskRecord resolveEscalation(String taskId, EscalationDecision decision, String approver, String note) {
        if (approver == null || approver.isBlank()) {
            throw new ApprovalRequiredException("Resolving an escalation requires an approver identity",
                    List.of(PolicyRefs.HUMAN_RESOLVES));
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision must be APPROVE or REJECT");
        }
        MdcContext.setTask(taskId);
        try {
            TaskRecord task = tasks.get(taskId);
            if (task.outcome() != TaskOutcome.ESCALATED || task.escalation() == null) {
                throw new StateConflictException("Task " + taskId + " is " + task.outcome() + ", not ESCALATED");
            }
            Escalation escalation = task.escalation();
            var approval = new HumanApproval(approver.trim(), decision, note, clock.instant());
            String noteText = note == null || note.isBlank() ? "" : ": " + note.trim();
            if (decision == EscalationDecision.REJECT) {
                TaskRecord withApproval = tasks.save(task.toBuilder().humanApproval(approval).build());
                return reject(withApproval, "HUMAN_REJECTED",
                        "Rejected by " + approval.approver() + " at " + escalation.trigger() + noteText,
                        List.of(PolicyRefs.HUMAN_RESOLVES, PolicyRefs.REFUSAL_IS_VALID));
            }
            TaskRecord resumed = tasks.save(task.toBuilder()
                    .humanApproval(approval)
                    .outcome(TaskOutcome.APPROVED)
                    .currentStage(escalation.resumeStage())
                    .escalation(null)
                    .failureCount(0)
                    .rationale("Approved by " + approval.approver() + noteText)
                    .build());
            audit.append(taskId, AuditEntry.GOVERNOR, "ESCALATION_APPROVED",
                    "Approved by " + approval.approver() + " at " + escalation.trigger() + "; resuming at "
                            + escalation.resumeStage() + noteText,
                    List.of(PolicyRefs.HUMAN_RESOLVES, PolicyRefs.HUMAN_AUTHORITY));
            publish("task.resumed", resumed, escalation.resumeStage(), Map.of("approver", approval.approver()));
            log.info("Task {} approved by {}; resuming at {}", taskId, approval.approver(), escalation.resumeStage());
            return resumed;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation. A running task stops at the next stage boundary and
     * is then REJECTED; an escalated task is rejected immediately.
     */
    public TaskRecord cancel(String taskId, String reason) {
        TaskRecord task = tasks.get(taskId);
        if (task.outcome() == TaskOutcome.ESCALATED) {
            return reject(task, "CANCELLED", "Cancelled while escalated: " + nonBlank(reason),
                    List.of(PolicyRefs.REFUSAL_IS_VALID));
        }
        if (!task.outcome().isActive()) {
            throw new StateConflictException("Task " + taskId + " is " + task.outcome() + " and cannot be cancelled");
        }
        cancellations.request(taskId, reason);
        audit.append(taskId, AuditEntry.GOVERNOR, "CANCEL_REQUESTED", "Cancellation requested: " + nonBlank(reason),
                List.of(PolicyRefs.REFUSAL_IS_VALID));
        return task;
    }

    public TaskStatusView status(String taskId) {
        TaskRecord task = tasks.get(taskId);
        return new TaskStatusView(task.id(), task.goal(), task.currentStage(), task.riskTier(), task.outcome(),
                task.rationale(), task.escalation(), audit.latest(taskId, 5));
    }

    private TaskRecord rejectCancelled(TaskRecord task, String reason) {
        return reject(task, "CANCELLED", "Cancelled by request after " + task.currentStage() + ": " + reason,
                List.of(PolicyRefs.REFUSAL_IS_VALID));
    }

    private GovernanceException refuse(String taskId, GovernanceException e) {
        List<String> refs = e.policyRefs().isEmpty() ? List.of(PolicyRefs.REFUSAL_IS_VALID) : e.policyRefs();
        audit.append(taskId, AuditEntry.GOVERNOR, "REFUSED", e.kind() + ": " + e.getMessage(), refs);
        metrics.recordSubmission(e.kind().name().toLowerCase());
        log.warn("Refused submission {}: {}", taskId, e.getMessage());
        return e;
    }

    private void recordEpisode(TaskRecord task, String reasonKind) {
        episodes.record(new EpisodeRecord(task.id(), task.goal(), task.riskTier(), task.outcome(),
                task.currentStage(), reasonKind, task.retryCount(), clock.instant()));
    }

    private void publish(String type, TaskRecord task, Stage stage, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put("outcome", task.outcome().name());
        eventBus.publish(GovernanceEvent.of(type, task.id(), stage == null ? null : stage.name(), payload));
    }

    private static List<String> withHumanAuthority(List<String> refs) {
        List<String> merged = new ArrayList<>(refs);
        if (!merged.contains(PolicyRefs.HUMAN_AUTHORITY)) {
            merged.add(PolicyRefs.HUMAN_AUTHORITY);
        }
        return merged;
    }

    private static String describe(RuntimeException error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String nonBlank(String reason) {
        return reason == null || reason.isBlank() ? "no reason given" : reason;
    }
}
