package com.keystone.core.pipeline;

import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;

import java.util.Set;

/**
 * One pipeline stage.
 * <p>
 * A stage receives a task snapshot and read-only views of the ledger and canon,
 * and returns a new snapshot. It may only change the fields it declares in
 * {@link #writableFields()}; the {@link StageRunner} discards any other change
 * and reports an authority violation. Stages never choose the next stage.
 */
public interface PipelineStage {

    Stage stage();

    Set<TaskField> writableFields();

    /** Whether the stage may hand new provenance records to the ledger. */
    default boolean appendsProvenance() {
        return false;
    }

    StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy);
}
