package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured plan written by the Plan stage.
 *
 * @param deliverables        what the task must produce
 * @param successCriteria     checkable conditions for completion
 * @param constraints         limits the output must respect
 * @param estimatedSteps      planner's step estimate
 * @param estimatedToolCalls  planner's tool-call estimate
 * @param falsifiable         whether the success criteria can be checked
 * @param outbound            whether the output leaves the system
 * @param irreversible        whether acting on the output cannot be undone
 */
public record TaskSpecification(
        List<String> deliverables,
        List<String> successCriteria,
        List<String> constraints,
        int estimatedSteps,
        int estimatedToolCalls,
        boolean falsifiable,
        boolean outbound,
        boolean irreversible
) implements Serializable {

    public TaskSpecification {
        deliverables = deliverables == null ? List.of() : List.copyOf(deliverables);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
