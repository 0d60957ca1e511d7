package com.keystone.core.model;

import java.io.Serializable;

/**
 * Optional settings accepted with a task submission.
 *
 * @param allowSingleSource  admit a task backed by fewer distinct sources than required
 * @param overrideReason     why the single-source override is needed; required when it is set
 * @param projectedSteps     caller's estimate of steps; null lets the planner heuristics decide
 * @param projectedToolCalls caller's estimate of tool calls; null lets the planner heuristics decide
 * @param submittedBy        who submitted the task
 */
public record SubmitOptions(
        boolean allowSingleSource,
        String overrideReason,
        Integer projectedSteps,
        Integer projectedToolCalls,
        String submittedBy
) implements Serializable {

    public static SubmitOptions defaults() {
        return new SubmitOptions(false, null, null, null, null);
    }

    public static SubmitOptions singleSource(String reason) {
        return new SubmitOptions(true, reason, null, null, null);
    }
}
