package com.keystone.core.model;

import java.io.Serializable;

/**
 * Resources a task has consumed so far. Active time only counts stage execution,
 * not time spent waiting on a human.
 */
public record BudgetUsage(int steps, int toolCalls, long activeMillis) implements Serializable {

    public static final BudgetUsage NONE = new BudgetUsage(0, 0, 0L);

    public BudgetUsage plus(int addSteps, int addToolCalls, long addMillis) {
        return new BudgetUsage(steps + addSteps, toolCalls + addToolCalls, activeMillis + addMillis);
    }
}
