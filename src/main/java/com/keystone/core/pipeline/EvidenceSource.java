package com.keystone.core.pipeline;

import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.TaskRecord;

import java.util.List;

/**
 * Supplies evidence beyond what was submitted with a task. Records returned
 * here are validated and appended to the ledger by the stage runner.
 */
public interface EvidenceSource {

    record Gathered(List<ProvenanceRecord> records, int toolCalls) {

        public static final Gathered NONE = new Gathered(List.of(), 0);
    }

    Gathered gather(TaskRecord task, List<ProvenanceRecord> submitted);

    /** Uses only the provenance supplied with the submission. */
    static EvidenceSource submittedOnly() {
        return (task, submitted) -> Gathered.NONE;
    }
}
