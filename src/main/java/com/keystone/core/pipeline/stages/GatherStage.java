package com.keystone.core.pipeline.stages;

import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.EvidenceSource;
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
 * Binds the task's evidence set: the provenance submitted with the goal plus
 * whatever the configured {@link EvidenceSource} collects. New records are
 * handed to the runner for the ledger; this stage never writes them itself.
 */
public class GatherStage implements PipelineStage {

    private final EvidenceSource evidenceSource;

    public GatherStage(EvidenceSource evidenceSource) {
        this.evidenceSource = evidenceSource;
    }

    @Override
    public Stage stage() {
        return Stage.GATHER;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.PROVENANCE_IDS);
    }

    @Override
    public boolean appendsProvenance() {
        return true;
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        List<ProvenanceRecord> submitted = provenance.findAll(task.submittedProvenanceIds());
        if (submitted.size() != task.submittedProvenanceIds().size()) {
            throw new IllegalStateException("Ledger is missing submitted provenance for task " + task.id());
        }
        EvidenceSource.Gathered gathered = evidenceSource.gather(task, submitted);

        long sources = submitted.stream().map(ProvenanceRecord::sourceKey).distinct().count();
        List<String> refs = new ArrayList<>(List.of(PolicyRefs.PROVENANCE_REQUIRED));
        if (task.singleSourceOverride() != null) {
            refs.add(PolicyRefs.TWO_SOURCES);
        }
        String rationale = "Bound " + submitted.size() + " submitted record(s) from " + sources + " source(s)"
                + (gathered.records().isEmpty() ? "" : "; collected " + gathered.records().size() + " new record(s)")
                + (task.singleSourceOverride() != null ? "; single-source override in effect" : "");

        TaskRecord bound = task.toBuilder()
                .provenanceIds(submitted.stream().map(ProvenanceRecord::id).toList())
                .build();
        return new StageResult(bound, "GATHERED", rationale, refs, gathered.records(), gathered.toolCalls());
    }
}
