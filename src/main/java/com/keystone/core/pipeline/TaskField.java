package com.keystone.core.pipeline;

import com.keystone.core.model.TaskRecord;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Fields of a {@link TaskRecord} as seen by the capability check. Stage-owned
 * fields are listed first; everything else belongs to the Governor and the stage
 * runner and no stage may change it.
 */
public enum TaskField {
    SPEC(TaskRecord::spec),
    PROVENANCE_IDS(TaskRecord::provenanceIds),
    OUTPUT(TaskRecord::output),
    REVIEW(TaskRecord::review),
    RECONCILIATION(TaskRecord::reconciliation),
    RETRY_COUNT(TaskRecord::retryCount),
    COMPLIANCE(TaskRecord::compliance),

    ID(TaskRecord::id),
    GOAL(TaskRecord::goal),
    RISK_TIER(TaskRecord::riskTier),
    RISK_RATIONALE(TaskRecord::riskRationale),
    RISK_POLICY_REFS(TaskRecord::riskPolicyRefs),
    SUBMITTED_BY(TaskRecord::submittedBy),
    BUDGET(TaskRecord::budget),
    USAGE(TaskRecord::usage),
    SUBMITTED_PROVENANCE_IDS(TaskRecord::submittedProvenanceIds),
    SINGLE_SOURCE_OVERRIDE(TaskRecord::singleSourceOverride),
    CURRENT_STAGE(TaskRecord::currentStage),
    OUTCOME(TaskRecord::outcome),
    ESCALATION(TaskRecord::escalation),
    HUMAN_APPROVAL(TaskRecord::humanApproval),
    FAILURE_COUNT(TaskRecord::failureCount),
    RATIONALE(TaskRecord::rationale),
    REVISION(TaskRecord::revision),
    CREATED_AT(TaskRecord::createdAt),
    UPDATED_AT(TaskRecord::updatedAt);

    private final Function<TaskRecord, Object> accessor;

    TaskField(Function<TaskRecord, Object> accessor) {
        this.accessor = accessor;
    }

    public Object read(TaskRecord task) {
        return accessor.apply(task);
    }

    /** Fields whose values differ between two snapshots of the same task. */
    public static Set<TaskField> changed(TaskRecord before, TaskRecord after) {
        Set<TaskField> changed = EnumSet.noneOf(TaskField.class);
        for (TaskField field : values()) {
            if (!Objects.equals(field.read(before), field.read(after))) {
                changed.add(field);
            }
        }
        return changed;
    }
}
