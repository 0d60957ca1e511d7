package com.keystone.core.pipeline;

import com.keystone.core.error.BudgetExceededException;
import com.keystone.core.model.Budget;
import com.keystone.core.model.BudgetUsage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.policy.PolicyRefs;

import java.util.List;

/**
 * Budget checks applied at every stage transition.
 */
public final class BudgetGuard {

    private BudgetGuard() {}

    /** Before a stage starts: another step must fit, and nothing may already be over. */
    public static void checkBeforeStage(TaskRecord task) {
        Budget budget = task.budget();
        BudgetUsage usage = task.usage();
        if (budget == null) {
            return;
        }
        if (usage.steps() >= budget.maxSteps()) {
            throw exceeded("steps", "Step budget exhausted: " + usage.steps() + " of " + budget.maxSteps() + " used");
        }
        checkAfterStage(task);
    }

    /** After a stage finished: tool calls and active time must be within limits. */
    public static void checkAfterStage(TaskRecord task) {
        Budget budget = task.budget();
        BudgetUsage usage = task.usage();
        if (budget == null) {
            return;
        }
        if (usage.toolCalls() > budget.maxToolCalls()) {
            throw exceeded("tool_calls", "Tool-call budget exceeded: " + usage.toolCalls() + " of "
                    + budget.maxToolCalls());
        }
        if (budget.maxDuration() != null && usage.activeMillis() > budget.maxDuration().toMillis()) {
            throw exceeded("duration", "Time budget exceeded: " + usage.activeMillis() + "ms of "
                    + budget.maxDuration().toMillis() + "ms");
        }
    }

    private static BudgetExceededException exceeded(String dimension, String message) {
        return new BudgetExceededException(dimension, message, List.of(PolicyRefs.BUDGET_TERMINATES));
    }
}
