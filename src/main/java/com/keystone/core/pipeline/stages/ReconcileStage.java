package com.keystone.core.pipeline.stages;

import com.keystone.core.error.ErrorKind;
import com.keystone.core.model.ReconcileDecision;
import com.keystone.core.model.Reconciliation;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageResult;
import com.keystone.core.pipeline.TaskField;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;

import java.util.List;
import java.util.Set;

/**
 * Decides what to do with a review verdict: accept, send back to Produce, or
 * escalate once the retry limit is spent.
 */
public class ReconcileStage implements PipelineStage {

    private final int maxRetries;

    public ReconcileStage(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    @Override
    public Stage stage() {
        return Stage.RECONCILE;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.RECONCILIATION, TaskField.RETRY_COUNT);
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        if (task.review() == null) {
            throw new IllegalStateException("Nothing to reconcile: task " + task.id() + " has no review verdict");
        }
        if (task.review().passed()) {
            var accepted = new Reconciliation(ReconcileDecision.ACCEPT, "Review passed");
            return StageResult.of(task.toBuilder().reconciliation(accepted).build(), "ACCEPT",
                    accepted.reason(), List.of(PolicyRefs.CLAIMS_TRACEABLE));
        }
        List<String> refs = task.review().unsupportedClaims().isEmpty()
                ? List.of(PolicyRefs.RETRY_LIMIT)
                : List.of(PolicyRefs.RETRY_LIMIT, PolicyRefs.CLAIMS_TRACEABLE);
        if (task.retryCount() >= maxRetries) {
            var escalated = new Reconciliation(ReconcileDecision.ESCALATE,
                    "Review still failing after " + task.retryCount() + " retries (limit " + maxRetries + ")"
                            + unsupportedSuffix(task));
            return StageResult.of(task.toBuilder().reconciliation(escalated).build(), "ESCALATE",
                    escalated.reason(), refs);
        }
        int retry = task.retryCount() + 1;
        var retrying = new Reconciliation(ReconcileDecision.RETRY,
                "Retry " + retry + " of " + maxRetries + ": " + String.join("; ", task.review().requiredChanges()));
        return StageResult.of(task.toBuilder().reconciliation(retrying).retryCount(retry).build(), "RETRY",
                retrying.reason(), refs);
    }

    private static String unsupportedSuffix(TaskRecord task) {
        List<String> claims = task.review().unsupportedClaims();
        if (claims.isEmpty()) {
            return "";
        }
        return "; " + ErrorKind.UNSUPPORTED_CLAIM + ": " + claims.size() + " claim(s) without traceable provenance ("
                + String.join("; ", claims) + ")";
    }
}
