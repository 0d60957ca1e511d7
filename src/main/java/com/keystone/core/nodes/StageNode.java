package com.keystone.core.nodes;

import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageRunner;
import com.keystone.core.pipeline.StepOutcome;
import com.keystone.core.state.TaskState;

import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that runs one {@link PipelineStage} through the
 * {@link StageRunner} and writes the new snapshot and route into the state.
 */
public class StageNode {

    private final PipelineStage stage;
    private final StageRunner runner;

    public StageNode(PipelineStage stage, StageRunner runner) {
        this.stage = stage;
        this.runner = runner;
    }

    public String id() {
        return stage.stage().nodeId();
    }

    public Map<String, Object> apply(TaskState state) {
        StepOutcome outcome = runner.advance(stage, state.task());
        String step = stage.stage().name() + ":" + outcome.decision().action()
                + (outcome.decision().kind() != null ? "(" + outcome.decision().kind() + ")" : "");
        return Map.of(
                "task", outcome.task(),
                "route", outcome.decision(),
                "trail", List.of(step));
    }
}
