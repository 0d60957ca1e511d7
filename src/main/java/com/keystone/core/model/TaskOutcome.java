package com.keystone.core.model;

/**
 * Lifecycle outcome of a task.
 * <p>
 * {@code APPROVED} means the Governor admitted the task (or a human resumed it)
 * and the pipeline is running it. {@code DONE} and {@code REJECTED} are terminal;
 * {@code ESCALATED} waits for a human decision.
 */
public enum TaskOutcome {
    PENDING,
    APPROVED,
    ESCALATED,
    REJECTED,
    DONE;

    public boolean isTerminal() {
        return this == DONE || this == REJECTED;
    }

    /** Whether the pipeline may still run stages for a task in this outcome. */
    public boolean isActive() {
        return this == PENDING || this == APPROVED;
    }
}
