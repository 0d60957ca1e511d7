package com.keystone.core.pipeline.stages;

import com.keystone.core.GovernanceFixture;
import com.keystone.core.model.ComplianceDecision;
import com.keystone.core.model.ComplianceVerdict;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.HumanApproval;
import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.model.TaskSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceStageTest {

    private final GovernanceFixture fx = new GovernanceFixture();
    private final ComplianceStage stage = new ComplianceStage();

    private static TaskRecord task(String goal, String content, boolean irreversible) {
        return TaskRecord.builder().id("KST-2026-0001").goal(goal).riskTier(RiskTier.HIGH)
                .spec(new TaskSpecification(List.of("Summary"), List.of(), List.of(), 6, 0, true, false, irreversible))
                .output(new ProducedOutput(content, List.of(), "test", 1))
                .build();
    }

    private ComplianceVerdict check(TaskRecord task) {
        return stage.execute(task, fx.ledger, fx.policy).task().compliance();
    }

    @Test
    @DisplayName("approves ordinary output")
    void approves() {
        ComplianceVerdict verdict = check(task("Summarize notes", "Summary of notes", false));
        assertEquals(ComplianceDecision.APPROVE, verdict.decision());
        assertEquals(List.of("INV-006"), verdict.policyRefs());
    }

    @Test
    @DisplayName("rejects output that discloses credentials")
    void rejectsProhibited() {
        ComplianceVerdict verdict = check(task("Summarize notes", "The admin password is hunter2", false));
        assertEquals(ComplianceDecision.REJECT, verdict.decision());
        assertEquals(List.of("INV-012"), verdict.policyRefs());
    }

    @Test
    @DisplayName("holds financial commitments for a human")
    void holdsFinancial() {
        ComplianceVerdict verdict = check(task("Wire the payment", "Payment instructions", true));
        assertEquals(ComplianceDecision.HOLD, verdict.decision());
        assertTrue(verdict.policyRefs().containsAll(List.of("INV-010", "VAL-002")));
    }

    @Test
    @DisplayName("a prior human approval turns a hold into approval")
    void approvedByHuman() {
        TaskRecord approved = task("Wire the payment", "Payment instructions", true).toBuilder()
                .humanApproval(new HumanApproval("dana", EscalationDecision.APPROVE, null, GovernanceFixture.START))
                .build();

        ComplianceVerdict verdict = check(approved);

        assertEquals(ComplianceDecision.APPROVE, verdict.decision());
        assertTrue(verdict.policyRefs().contains("INV-008"));
        assertTrue(verdict.reasons().contains("Approved by dana"));
    }
}
