package com.keystone.core.model;

/**
 * The six pipeline stages, in their nominal order.
 */
public enum Stage {
    PLAN,
    GATHER,
    PRODUCE,
    REVIEW,
    RECONCILE,
    COMPLIANCE;

    /** Graph node id for this stage. */
    public String nodeId() {
        return name().toLowerCase();
    }
}
