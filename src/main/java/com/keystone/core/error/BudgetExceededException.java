package com.keystone.core.error;

import java.util.List;

/**
 * A task used more steps, tool calls or active time than its tier allows.
 */
public class BudgetExceededException extends GovernanceException {

    private final String dimension;

    public BudgetExceededException(String dimension, String message, List<String> policyRefs) {
        super(ErrorKind.BUDGET_EXCEEDED, message, policyRefs);
        this.dimension = dimension;
    }

    /** {@code steps}, {@code tool_calls} or {@code duration}. */
    public String dimension() {
        return dimension;
    }
}
