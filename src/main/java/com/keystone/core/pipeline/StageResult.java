package com.keystone.core.pipeline;

import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.TaskRecord;

import java.util.List;

/**
 * What a stage hands back to the runner.
 *
 * @param task          the task with the stage's fields written
 * @param decision      short decision code for the audit log
 * @param rationale     why the stage decided as it did
 * @param policyRefs    rules the decision cites
 * @param newProvenance records to append to the ledger (Gather only)
 * @param toolCalls     tool calls the stage made
 */
public record StageResult(
        TaskRecord task,
        String decision,
        String rationale,
        List<String> policyRefs,
        List<ProvenanceRecord> newProvenance,
        int toolCalls
) {

    public StageResult {
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
        newProvenance = newProvenance == null ? List.of() : List.copyOf(newProvenance);
    }

    public static StageResult of(TaskRecord task, String decision, String rationale, List<String> policyRefs) {
        return new StageResult(task, decision, rationale, policyRefs, List.of(), 0);
    }

    public StageResult withToolCalls(int calls) {
        return new StageResult(task, decision, rationale, policyRefs, newProvenance, calls);
    }
}
