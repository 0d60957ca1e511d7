package com.keystone.core.pipeline.stages;

import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.ContentProducer;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageResult;
import com.keystone.core.pipeline.TaskField;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;

import java.util.List;
import java.util.Set;

/**
 * Generates the deliverable from the bound evidence. On a retry the failed
 * review's required changes are passed to the producer as feedback.
 */
public class ProduceStage implements PipelineStage {

    private final ContentProducer producer;

    public ProduceStage(ContentProducer producer) {
        this.producer = producer;
    }

    @Override
    public Stage stage() {
        return Stage.PRODUCE;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.OUTPUT);
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        List<ProvenanceRecord> evidence = provenance.findAll(task.provenanceIds());
        List<String> feedback = task.review() != null && !task.review().passed()
                ? task.review().requiredChanges()
                : List.of();
        int attempt = task.output() == null ? 1 : task.output().attempt() + 1;

        ProducedOutput output = producer.produce(
                new ContentProducer.Request(task.goal(), task.spec(), evidence, feedback, attempt));

        long cited = output.claims().stream().flatMap(c -> c.provenanceIds().stream()).distinct().count();
        String rationale = "Attempt " + attempt + " by " + producer.name() + ": " + output.claims().size()
                + " claim(s) citing " + cited + " record(s)"
                + (feedback.isEmpty() ? "" : "; addressed " + feedback.size() + " review finding(s)");
        return StageResult.of(task.toBuilder().output(output).build(), "PRODUCED", rationale,
                        List.of(PolicyRefs.CLAIMS_TRACEABLE))
                .withToolCalls(producer.toolCallsPerInvocation());
    }
}
