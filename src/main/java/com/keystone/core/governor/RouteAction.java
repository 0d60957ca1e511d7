package com.keystone.core.governor;

public enum RouteAction {
    /** Run {@link RouteDecision#nextStage()}. */
    NEXT_STAGE,
    /** Stop and wait for a human. */
    ESCALATE,
    /** Terminate as REJECTED. */
    REJECT,
    /** Terminate as DONE. */
    COMPLETE
}
