package com.keystone.core.pipeline.stages;

import com.keystone.core.governor.WorkloadEstimator;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.model.TaskSpecification;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageResult;
import com.keystone.core.pipeline.TaskField;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceView;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the goal into a {@link TaskSpecification}: deliverables, checkable
 * success criteria, constraints from the budget, and whether the result is
 * outbound or irreversible.
 */
public class PlanStage implements PipelineStage {

    private final WorkloadEstimator estimator;
    private final Pattern outbound;

    public PlanStage(WorkloadEstimator estimator, List<String> outboundMarkers) {
        this.estimator = estimator;
        this.outbound = Pattern.compile("(?<![\\p{L}\\p{N}])(" + String.join("|",
                outboundMarkers.stream().map(Pattern::quote).toList()) + ")(?![\\p{L}\\p{N}])");
    }

    @Override
    public Stage stage() {
        return Stage.PLAN;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.SPEC);
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        List<String> deliverables = estimator.deliverables(task.goal());
        WorkloadEstimator.Projection projection = estimator.estimate(task.goal(), task.riskTier());

        List<String> criteria = new ArrayList<>();
        deliverables.forEach(d -> criteria.add("Deliverable produced: " + d));
        criteria.add("Every claim cites at least one provenance record");

        List<String> constraints = new ArrayList<>();
        if (task.budget() != null) {
            constraints.add("At most " + task.budget().maxSteps() + " steps");
            constraints.add("At most " + task.budget().maxToolCalls() + " tool calls");
        }
        constraints.add("No claims beyond the cited sources");
        if (task.singleSourceOverride() != null) {
            constraints.add("Single-source evidence accepted: " + task.singleSourceOverride());
        }

        boolean irreversible = policy.find(PolicyRefs.IRREVERSIBLE_ACTIONS)
                .map(rule -> rule.matches(task.goal()))
                .orElse(false);
        boolean isOutbound = outbound.matcher(task.goal().toLowerCase(Locale.ROOT)).find();

        var spec = new TaskSpecification(deliverables, criteria, constraints, projection.steps(),
                projection.toolCalls(), !criteria.isEmpty(), isOutbound, irreversible);

        List<String> refs = new ArrayList<>();
        if (irreversible) {
            refs.add(PolicyRefs.IRREVERSIBLE_ACTIONS);
        }
        String rationale = String.format("%d deliverable(s): %s; estimated %d steps / %d tool calls; outbound=%s, irreversible=%s",
                deliverables.size(), String.join(", ", deliverables), projection.steps(), projection.toolCalls(),
                isOutbound, irreversible);
        return StageResult.of(task.toBuilder().spec(spec).build(), "PLANNED", rationale, refs);
    }
}
