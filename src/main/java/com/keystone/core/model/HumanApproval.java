package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A recorded human decision on an escalated task.
 */
public record HumanApproval(String approver, EscalationDecision decision, String note, Instant decidedAt)
        implements Serializable {

    public boolean approved() {
        return decision == EscalationDecision.APPROVE;
    }
}
