package com.keystone.core.pipeline;

import com.keystone.core.governor.RouteDecision;
import com.keystone.core.model.TaskRecord;

/**
 * The persisted task after a stage ran, plus the Governor's routing decision.
 */
public record StepOutcome(TaskRecord task, RouteDecision decision) {
}
