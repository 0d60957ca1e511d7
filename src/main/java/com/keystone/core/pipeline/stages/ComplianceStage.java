package com.keystone.core.pipeline.stages;

import com.keystone.core.model.ComplianceDecision;
import com.keystone.core.model.ComplianceVerdict;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageResult;
import com.keystone.core.pipeline.TaskField;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Final gate before completion. Prohibited content rejects outright; outbound
 * or irreversible actions are held for a human unless one has already
 * approved this task.
 */
public class ComplianceStage implements PipelineStage {

    @Override
    public Stage stage() {
        return Stage.COMPLIANCE;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.COMPLIANCE);
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        String content = task.output() != null && task.output().content() != null ? task.output().content() : "";

        List<PolicyRule> prohibited = policy.matching(task.goal() + "\n" + content, RuleEffect.PROHIBIT);
        if (!prohibited.isEmpty()) {
            List<String> reasons = prohibited.stream()
                    .map(r -> r.id() + ": mentions '" + r.firstMatch(task.goal() + "\n" + content) + "'")
                    .toList();
            return verdict(task, ComplianceDecision.REJECT, reasons, ids(prohibited));
        }

        List<String> reasons = new ArrayList<>();
        List<String> refs = new ArrayList<>();
        for (PolicyRule rule : policy.matching(task.goal(), RuleEffect.HOLD)) {
            reasons.add(rule.id() + ": " + rule.text());
            refs.add(rule.id());
        }
        if (task.spec() != null && task.spec().irreversible()) {
            reasons.add("Irreversible action requires a human decision");
            refs.add(PolicyRefs.HUMAN_AUTHORITY);
        }
        if (!reasons.isEmpty()) {
            if (task.humanApproved()) {
                reasons.add("Approved by " + task.humanApproval().approver());
                refs.add(PolicyRefs.HUMAN_RESOLVES);
                return verdict(task, ComplianceDecision.APPROVE, reasons, refs);
            }
            return verdict(task, ComplianceDecision.HOLD, reasons, refs);
        }
        return verdict(task, ComplianceDecision.APPROVE, List.of("No compliance concerns found"),
                List.of(PolicyRefs.NO_SKIPPED_CHECKS));
    }

    private static StageResult verdict(TaskRecord task, ComplianceDecision decision, List<String> reasons,
                                       List<String> refs) {
        var verdict = new ComplianceVerdict(decision, reasons, refs);
        return StageResult.of(task.toBuilder().compliance(verdict).build(), decision.name(),
                String.join("; ", reasons), refs);
    }

    private static List<String> ids(List<PolicyRule> rules) {
        return rules.stream().map(PolicyRule::id).toList();
    }
}
