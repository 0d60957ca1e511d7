package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a task as it moves through the pipeline.
 * <p>
 * Each stage receives a snapshot and returns a new one; the Task Store keeps
 * every snapshot in order and the latest revision is the current state.
 * Which stage may write which field is declared in
 * {@link com.keystone.core.pipeline.TaskField}.
 *
 * @param id                     task id
 * @param goal                   submitted goal text
 * @param riskTier               tier assigned at admission
 * @param riskRationale          why that tier was assigned
 * @param riskPolicyRefs         rules behind the tier
 * @param submittedBy            submitter, if known
 * @param budget                 limits for this task's tier
 * @param usage                  resources consumed so far
 * @param submittedProvenanceIds ledger ids of the provenance supplied with the submission
 * @param singleSourceOverride   audited reason for admitting under the distinct-source minimum, or null
 * @param currentStage           last stage entered; null before Plan runs
 * @param outcome                lifecycle outcome
 * @param spec                   Plan output
 * @param provenanceIds          evidence set bound by Gather
 * @param output                 Produce output
 * @param review                 Review verdict
 * @param reconciliation         Reconcile decision
 * @param retryCount             review retries consumed
 * @param compliance             Compliance verdict
 * @param escalation             open escalation, if any
 * @param humanApproval          most recent human decision, if any
 * @param failureCount           consecutive internal failures of the current stage
 * @param rationale              rationale of the decision that produced the current outcome
 * @param revision               snapshot number, incremented on every save
 * @param createdAt              admission time
 * @param updatedAt              time of this snapshot
 */
public record TaskRecord(
        String id,
        String goal,
        RiskTier riskTier,
        String riskRationale,
        List<String> riskPolicyRefs,
        String submittedBy,
        Budget budget,
        BudgetUsage usage,
        List<String> submittedProvenanceIds,
        String singleSourceOverride,
        Stage currentStage,
        TaskOutcome outcome,
        TaskSpecification spec,
        List<String> provenanceIds,
        ProducedOutput output,
        ReviewVerdict review,
        Reconciliation reconciliation,
        int retryCount,
        ComplianceVerdict compliance,
        Escalation escalation,
        HumanApproval humanApproval,
        int failureCount,
        String rationale,
        long revision,
        Instant createdAt,
        Instant updatedAt
) implements Serializable {

    public TaskRecord {
        riskPolicyRefs = riskPolicyRefs == null ? List.of() : List.copyOf(riskPolicyRefs);
        submittedProvenanceIds = submittedProvenanceIds == null ? List.of() : List.copyOf(submittedProvenanceIds);
        provenanceIds = provenanceIds == null ? List.of() : List.copyOf(provenanceIds);
        usage = usage == null ? BudgetUsage.NONE : usage;
    }

    /** True once a human has approved this task at an escalation. */
    public boolean humanApproved() {
        return humanApproval != null && humanApproval.approved();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private String id;
        private String goal;
        private RiskTier riskTier;
        private String riskRationale;
        private List<String> riskPolicyRefs;
        private String submittedBy;
        private Budget budget;
        private BudgetUsage usage;
        private List<String> submittedProvenanceIds;
        private String singleSourceOverride;
        private Stage currentStage;
        private TaskOutcome outcome = TaskOutcome.PENDING;
        private TaskSpecification spec;
        private List<String> provenanceIds;
        private ProducedOutput output;
        private ReviewVerdict review;
        private Reconciliation reconciliation;
        private int retryCount;
        private ComplianceVerdict compliance;
        private Escalation escalation;
        private HumanApproval humanApproval;
        private int failureCount;
        private String rationale;
        private long revision;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        private Builder(TaskRecord t) {
            this.id = t.id;
            this.goal = t.goal;
            this.riskTier = t.riskTier;
            this.riskRationale = t.riskRationale;
            this.riskPolicyRefs = t.riskPolicyRefs;
            this.submittedBy = t.submittedBy;
            this.budget = t.budget;
            this.usage = t.usage;
            this.submittedProvenanceIds = t.submittedProvenanceIds;
            this.singleSourceOverride = t.singleSourceOverride;
            this.currentStage = t.currentStage;
            this.outcome = t.outcome;
            this.spec = t.spec;
            this.provenanceIds = t.provenanceIds;
            this.output = t.output;
            this.review = t.review;
            this.reconciliation = t.reconciliation;
            this.retryCount = t.retryCount;
            this.compliance = t.compliance;
            this.escalation = t.escalation;
            this.humanApproval = t.humanApproval;
            this.failureCount = t.failureCount;
            this.rationale = t.rationale;
            this.revision = t.revision;
            this.createdAt = t.createdAt;
            this.updatedAt = t.updatedAt;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder goal(String goal) { this.goal = goal; return this; }
        public Builder riskTier(RiskTier riskTier) { this.riskTier = riskTier; return this; }
        public Builder riskRationale(String riskRationale) { this.riskRationale = riskRationale; return this; }
        public Builder riskPolicyRefs(List<String> riskPolicyRefs) { this.riskPolicyRefs = riskPolicyRefs; return this; }
        public Builder submittedBy(String submittedBy) { this.submittedBy = submittedBy; return this; }
        public Builder budget(Budget budget) { this.budget = budget; return this; }
        public Builder usage(BudgetUsage usage) { this.usage = usage; return this; }
        public Builder submittedProvenanceIds(List<String> ids) { this.submittedProvenanceIds = ids; return this; }
        public Builder singleSourceOverride(String reason) { this.singleSourceOverride = reason; return this; }
        public Builder currentStage(Stage currentStage) { this.currentStage = currentStage; return this; }
        public Builder outcome(TaskOutcome outcome) { this.outcome = outcome; return this; }
        public Builder spec(TaskSpecification spec) { this.spec = spec; return this; }
        public Builder provenanceIds(List<String> provenanceIds) { this.provenanceIds = provenanceIds; return this; }
        public Builder output(ProducedOutput output) { this.output = output; return this; }
        public Builder review(ReviewVerdict review) { this.review = review; return this; }
        public Builder reconciliation(Reconciliation reconciliation) { this.reconciliation = reconciliation; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder compliance(ComplianceVerdict compliance) { this.compliance = compliance; return this; }
        public Builder escalation(Escalation escalation) { this.escalation = escalation; return this; }
        public Builder humanApproval(HumanApproval humanApproval) { this.humanApproval = humanApproval; return this; }
        public Builder failureCount(int failureCount) { this.failureCount = failureCount; return this; }
        public Builder rationale(String rationale) { this.rationale = rationale; return this; }
        public Builder revision(long revision) { this.revision = revision; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public TaskRecord build() {
            return new TaskRecord(id, goal, riskTier, riskRationale, riskPolicyRefs, submittedBy, budget, usage,
                    submittedProvenanceIds, singleSourceOverride, currentStage, outcome, spec, provenanceIds,
                    output, review, reconciliation, retryCount, compliance, escalation, humanApproval,
                    failureCount, rationale, revision, createdAt, updatedAt);
        }
    }
}
