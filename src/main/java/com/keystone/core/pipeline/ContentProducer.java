package com.keystone.core.pipeline;

import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.TaskSpecification;

import java.util.List;

/**
 * Generates the deliverable for the Produce stage.
 */
public interface ContentProducer {

    /**
     * @param goal     the task goal
     * @param spec     the Plan stage's specification
     * @param evidence records bound by Gather; claims may only cite these
     * @param feedback required changes from the last failed review (empty on the first attempt)
     * @param attempt  1-based attempt number
     */
    record Request(String goal, TaskSpecification spec, List<ProvenanceRecord> evidence,
                   List<String> feedback, int attempt) {}

    ProducedOutput produce(Request request);

    String name();

    /** Tool calls charged to the task per invocation. */
    default int toolCallsPerInvocation() {
        return 0;
    }
}
