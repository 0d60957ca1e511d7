package com.keystone.core.pipeline;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.error.AuthorityViolationException;
import com.keystone.core.error.BudgetExceededException;
import com.keystone.core.error.GovernanceException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.GovernanceEvent;
import com.keystone.core.governor.CancellationRegistry;
import com.keystone.core.governor.Governor;
import com.keystone.core.governor.RouteDecision;
import com.keystone.core.governor.TaskStore;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.GovernanceMetrics;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Runs one stage for one task under governance.
 * <p>
 * Before the stage: honours pending cancellation and checks the budget. After
 * it: rejects writes outside the stage's capabilities, appends any new
 * provenance, charges the budget, persists the snapshot and writes the audit
 * entry. A cancellation that arrived while the stage ran then rejects the
 * task; otherwise the Governor decides where to go next. Failures are handed
 * to {@link Governor#onStageFailure}.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final ProvenanceLedger ledger;
    private final PolicyView policy;
    private final AuditLog audit;
    private final TaskStore tasks;
    private final Governor governor;
    private final CancellationRegistry cancellations;
    private final GovernanceMetrics metrics;
    private final EventBus eventBus;

    public StageRunner(ProvenanceLedger ledger, PolicyView policy, AuditLog audit, TaskStore tasks,
                       Governor governor, CancellationRegistry cancellations, GovernanceMetrics metrics,
                       EventBus eventBus) {
        this.ledger = ledger;
        this.policy = policy;
        this.audit = audit;
        this.tasks = tasks;
        this.governor = governor;
        this.cancellations = cancellations;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public StepOutcome advance(PipelineStage stage, TaskRecord input) {
        Stage name = stage.stage();
        MdcContext.setStage(input.id(), name.name());
        try {
            Optional<String> cancelled = cancellations.consume(input.id());
            if (cancelled.isPresent()) {
                log.info("Task {} cancelled before {}", input.id(), name);
                return cancelledAt(input, "before " + name, cancelled.get());
            }
            try {
                BudgetGuard.checkBeforeStage(input);
            } catch (BudgetExceededException e) {
                return budgetBreach(input, name, e);
            }

            TaskRecord entering = input.toBuilder()
                    .currentStage(name)
                    .outcome(TaskOutcome.APPROVED)
                    .build();
            publish("stage.started", entering, name, Map.of());
            long start = System.nanoTime();

            StageResult result;
            List<ProvenanceRecord> appended;
            try {
                result = stage.execute(entering, ledger, policy);
                enforceCapabilities(stage, entering, result);
                appended = result.newProvenance().isEmpty() ? List.of() : ledger.appendAll(result.newProvenance());
            } catch (RuntimeException e) {
                return failure(entering, name, e, elapsedMs(start));
            }

            long ms = elapsedMs(start);
            TaskRecord produced = result.task();
            if (!appended.isEmpty()) {
                List<String> ids = new ArrayList<>(produced.provenanceIds());
                appended.forEach(r -> ids.add(r.id()));
                produced = produced.toBuilder().provenanceIds(ids).build();
            }
            TaskRecord saved = tasks.save(produced.toBuilder()
                    .usage(entering.usage().plus(1, result.toolCalls(), ms))
                    .failureCount(0)
                    .build());
            audit.append(saved.id(), name.name(), result.decision(), result.rationale(), result.policyRefs());
            metrics.recordStageExecution(name.name(), result.decision(), ms);
            if (name == Stage.RECONCILE && "RETRY".equals(result.decision())) {
                metrics.recordReviewRetry();
            }
            publish("stage.completed", saved, name, Map.of("decision", result.decision()));

            Optional<String> cancelledDuring = cancellations.consume(saved.id());
            if (cancelledDuring.isPresent()) {
                log.info("Task {} cancelled during {}", saved.id(), name);
                return cancelledAt(saved, "after " + name, cancelledDuring.get());
            }
            try {
                BudgetGuard.checkAfterStage(saved);
            } catch (BudgetExceededException e) {
                return budgetBreach(saved, name, e);
            }
            return new StepOutcome(saved, governor.route(saved));
        } finally {
            MdcContext.clearStage();
        }
    }

    private void enforceCapabilities(PipelineStage stage, TaskRecord before, StageResult result) {
        Set<TaskField> allowed = stage.writableFields().isEmpty()
                ? EnumSet.noneOf(TaskField.class)
                : EnumSet.copyOf(stage.writableFields());
        Set<String> violations = TaskField.changed(before, result.task()).stream()
                .filter(f -> !allowed.contains(f))
                .map(Enum::name)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!result.newProvenance().isEmpty() && !stage.appendsProvenance()) {
            violations.add("PROVENANCE_LEDGER");
        }
        if (!violations.isEmpty()) {
            throw new AuthorityViolationException(stage.stage(), violations, List.of(PolicyRefs.STAGE_AUTHORITY));
        }
    }

    private StepOutcome failure(TaskRecord entering, Stage name, RuntimeException e, long ms) {
        TaskRecord failed = tasks.save(entering.toBuilder()
                .failureCount(entering.failureCount() + 1)
                .usage(entering.usage().plus(1, 0, ms))
                .build());
        List<String> refs = e instanceof GovernanceException ge && !ge.policyRefs().isEmpty()
                ? ge.policyRefs()
                : List.of(PolicyRefs.STAGE_FAILURES);
        String decision = e instanceof AuthorityViolationException ? "AUTHORITY_VIOLATION" : "FAILED";
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        audit.append(failed.id(), name.name(), decision, message, refs);
        metrics.recordStageExecution(name.name(), decision, ms);
        publish("stage.failed", failed, name, Map.of("error", message));
        log.warn("Stage {} failed for task {}: {}", name, failed.id(), message, e);
        return new StepOutcome(failed, governor.onStageFailure(failed, name, e));
    }

    private static StepOutcome cancelledAt(TaskRecord task, String where, String reason) {
        return new StepOutcome(task, RouteDecision.reject("CANCELLED",
                "Cancelled by request " + where + ": " + reason, List.of(PolicyRefs.REFUSAL_IS_VALID)));
    }

    private StepOutcome budgetBreach(TaskRecord task, Stage name, BudgetExceededException e) {
        audit.append(task.id(), name.name(), "BUDGET_EXCEEDED", e.getMessage(), e.policyRefs());
        metrics.recordBudgetBreach(e.dimension());
        return new StepOutcome(task, governor.onStageFailure(task, name, e));
    }

    private void publish(String type, TaskRecord task, Stage stage, Map<String, Object> payload) {
        eventBus.publish(GovernanceEvent.of(type, task.id(), stage.name(), payload));
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
