package com.keystone.core.governor;

import com.keystone.core.model.ComplianceVerdict;
import com.keystone.core.model.Escalation;
import com.keystone.core.model.EscalationTrigger;
import com.keystone.core.model.Reconciliation;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.policy.PolicyRefs;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * The pipeline's state machine: given a task that has just finished a stage,
 * decides what happens next.
 * <pre>
 *   LOW:    PLAN -> GATHER -> PRODUCE -> COMPLIANCE -> done   (post-hoc audit)
 *   MEDIUM: PLAN -> GATHER -> PRODUCE -> REVIEW -> RECONCILE -> COMPLIANCE -> done
 *   HIGH:   PLAN -> GATHER -> [human gate] -> PRODUCE -> REVIEW -> RECONCILE -> COMPLIANCE -> done
 *
 *   RECONCILE: ACCEPT -> COMPLIANCE | RETRY -> PRODUCE | ESCALATE -> human
 *   COMPLIANCE: APPROVE -> done | HOLD -> human | REJECT -> rejected
 * </pre>
 */
public class TransitionTable {

    private final Clock clock;

    public TransitionTable(Clock clock) {
        this.clock = clock;
    }

    /** Stages a task of the given tier runs when nothing fails or retries. */
    public static List<Stage> nominalPath(RiskTier tier) {
        List<Stage> path = new ArrayList<>(List.of(Stage.PLAN, Stage.GATHER, Stage.PRODUCE));
        if (tier != RiskTier.LOW) {
            path.add(Stage.REVIEW);
            path.add(Stage.RECONCILE);
        }
        path.add(Stage.COMPLIANCE);
        return List.copyOf(path);
    }

    /** First stage of every task. */
    public Stage entry() {
        return Stage.PLAN;
    }

    public RouteDecision next(TaskRecord task) {
        Stage stage = task.currentStage();
        if (stage == null) {
            return RouteDecision.next(entry());
        }
        return switch (stage) {
            case PLAN -> RouteDecision.next(Stage.GATHER);
            case GATHER -> afterGather(task);
            case PRODUCE -> RouteDecision.next(task.riskTier() == RiskTier.LOW ? Stage.COMPLIANCE : Stage.REVIEW);
            case REVIEW -> RouteDecision.next(Stage.RECONCILE);
            case RECONCILE -> afterReconcile(task);
            case COMPLIANCE -> afterCompliance(task);
        };
    }

    private RouteDecision afterGather(TaskRecord task) {
        if (task.riskTier() == RiskTier.HIGH && !task.humanApproved()) {
            return RouteDecision.escalate(new Escalation(EscalationTrigger.HIGH_RISK_GATE,
                    "HIGH-risk task needs human approval before output is produced: " + task.riskRationale(),
                    Stage.GATHER, Stage.PRODUCE,
                    merge(task.riskPolicyRefs(), PolicyRefs.HUMAN_AUTHORITY), clock.instant()));
        }
        return RouteDecision.next(Stage.PRODUCE);
    }

    private RouteDecision afterReconcile(TaskRecord task) {
        Reconciliation rec = task.reconciliation();
        if (rec == null) {
            throw new IllegalStateException("Task " + task.id() + " left RECONCILE without a decision");
        }
        return switch (rec.decision()) {
            case ACCEPT -> RouteDecision.next(Stage.COMPLIANCE);
            case RETRY -> RouteDecision.retry(Stage.PRODUCE, rec.reason(), List.of(PolicyRefs.RETRY_LIMIT));
            case ESCALATE -> RouteDecision.escalate(new Escalation(EscalationTrigger.RETRY_LIMIT,
                    rec.reason(), Stage.RECONCILE, Stage.COMPLIANCE,
                    List.of(PolicyRefs.RETRY_LIMIT, PolicyRefs.CLAIMS_TRACEABLE), clock.instant()));
        };
    }

    private RouteDecision afterCompliance(TaskRecord task) {
        ComplianceVerdict verdict = task.compliance();
        if (verdict == null) {
            throw new IllegalStateException("Task " + task.id() + " left COMPLIANCE without a verdict");
        }
        String reasons = String.join("; ", verdict.reasons());
        return switch (verdict.decision()) {
            case APPROVE -> RouteDecision.complete(reasons, verdict.policyRefs());
            case HOLD -> RouteDecision.escalate(new Escalation(EscalationTrigger.COMPLIANCE_HOLD,
                    "Compliance hold: " + reasons, Stage.COMPLIANCE, Stage.COMPLIANCE,
                    merge(verdict.policyRefs(), PolicyRefs.HUMAN_AUTHORITY), clock.instant()));
            case REJECT -> RouteDecision.reject("COMPLIANCE_REJECT", "Compliance rejected output: " + reasons, verdict.policyRefs());
        };
    }

    private static List<String> merge(List<String> refs, String extra) {
        List<String> merged = new ArrayList<>(refs);
        if (!merged.contains(extra)) {
            merged.add(extra);
        }
        return merged;
    }
}
