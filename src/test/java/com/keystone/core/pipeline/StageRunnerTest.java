package com.keystone.core.pipeline;

import com.keystone.core.GovernanceFixture;
import com.keystone.core.governor.RouteAction;
import com.keystone.core.model.BudgetUsage;
import com.keystone.core.model.ComplianceDecision;
import com.keystone.core.model.ComplianceVerdict;
import com.keystone.core.model.EscalationTrigger;
import com.keystone.core.model.Stage;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.model.TaskSpecification;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static com.keystone.core.GovernanceFixture.source;
import static com.keystone.core.GovernanceFixture.twoSources;
import static org.junit.jupiter.api.Assertions.*;

class StageRunnerTest {

    private GovernanceFixture fx;
    private TaskRecord task;

    @BeforeEach
    void setUp() {
        fx = new GovernanceFixture();
        task = fx.governor.submit("Summarize the meeting notes", twoSources(), SubmitOptions.defaults());
    }

    private static PipelineStage planStage(Set<TaskField> writable, Function<TaskRecord, StageResult> body) {
        return new PipelineStage() {
            @Override
            public Stage stage() {
                return Stage.PLAN;
            }

            @Override
            public Set<TaskField> writableFields() {
                return writable;
            }

            @Override
            public StageResult execute(TaskRecord t, ProvenanceView provenance, PolicyView policy) {
                return body.apply(t);
            }
        };
    }

    private static TaskSpecification spec() {
        return new TaskSpecification(List.of("Summary"), List.of("Summary produced"), List.of(), 4, 0,
                true, false, false);
    }

    @Test
    @DisplayName("a well-behaved stage is persisted, charged, audited and routed")
    void happyPath() {
        StepOutcome outcome = fx.runner.advance(
                planStage(Set.of(TaskField.SPEC), t -> StageResult.of(t.toBuilder().spec(spec()).build(),
                        "PLANNED", "planned", List.of())),
                task);

        TaskRecord saved = outcome.task();
        assertEquals(TaskOutcome.APPROVED, saved.outcome());
        assertEquals(Stage.PLAN, saved.currentStage());
        assertEquals(1, saved.usage().steps());
        assertEquals(2, saved.revision());
        assertEquals(saved, fx.tasks.get(task.id()));
        assertEquals(Stage.GATHER, outcome.decision().nextStage());
        assertEquals(List.of("GOVERNOR:ADMITTED", "PLAN:PLANNED"), fx.auditTrail(task.id()));
    }

    @Test
    @DisplayName("writing a field the stage does not own is an authority violation")
    void authorityViolation() {
        StepOutcome outcome = fx.runner.advance(
                planStage(Set.of(TaskField.SPEC), t -> StageResult.of(t.toBuilder()
                        .spec(spec())
                        .compliance(new ComplianceVerdict(ComplianceDecision.APPROVE, List.of("self-approved"), List.of()))
                        .build(), "PLANNED", "planned", List.of())),
                task);

        assertEquals(RouteAction.ESCALATE, outcome.decision().action());
        assertEquals(EscalationTrigger.AUTHORITY_VIOLATION, outcome.decision().escalation().trigger());
        TaskRecord stored = fx.tasks.get(task.id());
        assertNull(stored.compliance());
        assertNull(stored.spec());
        assertEquals(1, stored.failureCount());
        assertEquals("PLAN:AUTHORITY_VIOLATION", fx.auditTrail(task.id()).get(1));
    }

    @Test
    @DisplayName("handing over provenance without permission is an authority violation")
    void provenanceWithoutPermission() {
        StepOutcome outcome = fx.runner.advance(
                planStage(Set.of(TaskField.SPEC), t -> new StageResult(t, "PLANNED", "planned", List.of(),
                        List.of(source("rogue", 0.5, null)), 0)),
                task);

        assertEquals(EscalationTrigger.AUTHORITY_VIOLATION, outcome.decision().escalation().trigger());
        assertEquals(2, fx.ledger.size());
    }

    @Test
    @DisplayName("a pending cancellation rejects before the stage runs")
    void cancellation() {
        fx.governor.cancel(task.id(), "changed my mind");

        StepOutcome outcome = fx.runner.advance(planStage(Set.of(), t -> {
            throw new AssertionError("stage must not run");
        }), task);

        assertEquals(RouteAction.REJECT, outcome.decision().action());
        assertEquals("CANCELLED", outcome.decision().kind());
        assertFalse(fx.cancellations.isRequested(task.id()));
    }

    @Test
    @DisplayName("an exhausted step budget rejects before the stage runs")
    void stepBudget() {
        TaskRecord spent = fx.tasks.save(task.toBuilder().usage(new BudgetUsage(8, 0, 0)).build());

        StepOutcome outcome = fx.runner.advance(planStage(Set.of(), t -> {
            throw new AssertionError("stage must not run");
        }), spent);

        assertEquals(RouteAction.REJECT, outcome.decision().action());
        assertEquals("BUDGET_EXCEEDED", outcome.decision().kind());
        assertEquals("PLAN:BUDGET_EXCEEDED", fx.auditTrail(task.id()).get(1));
        assertEquals(1.0, fx.registry.counter("keystone.budget.breaches", "dimension", "steps").count());
    }

    @Test
    @DisplayName("tool calls beyond the budget reject after the stage is recorded")
    void toolCallBudget() {
        StepOutcome outcome = fx.runner.advance(
                planStage(Set.of(TaskField.SPEC), t -> StageResult.of(t.toBuilder().spec(spec()).build(),
                        "PLANNED", "planned", List.of()).withToolCalls(4)),
                task);

        assertEquals("BUDGET_EXCEEDED", outcome.decision().kind());
        assertEquals(List.of("GOVERNOR:ADMITTED", "PLAN:PLANNED", "PLAN:BUDGET_EXCEEDED"), fx.auditTrail(task.id()));
        assertEquals(4, fx.tasks.get(task.id()).usage().toolCalls());
    }

    @Test
    @DisplayName("an exception inside a stage is audited and retried")
    void failureRetried() {
        StepOutcome outcome = fx.runner.advance(planStage(Set.of(TaskField.SPEC), t -> {
            throw new IllegalStateException("planner unavailable");
        }), task);

        assertEquals(RouteAction.NEXT_STAGE, outcome.decision().action());
        assertEquals(Stage.PLAN, outcome.decision().nextStage());
        assertEquals(List.of("GOVERNOR:ADMITTED", "PLAN:FAILED", "GOVERNOR:RETRY_STAGE"), fx.auditTrail(task.id()));
        assertEquals(1, outcome.task().failureCount());
    }
}
