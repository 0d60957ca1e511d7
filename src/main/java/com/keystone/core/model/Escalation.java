package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An open request for a human decision.
 *
 * @param trigger     what caused the escalation
 * @param reason      human-readable explanation
 * @param raisedAt    stage the task was in when escalated
 * @param resumeStage stage the pipeline resumes at if a human approves
 * @param policyRefs  rules behind the escalation
 * @param timestamp   when the escalation was raised
 */
public record Escalation(
        EscalationTrigger trigger,
        String reason,
        Stage raisedAt,
        Stage resumeStage,
        List<String> policyRefs,
        Instant timestamp
) implements Serializable {

    public Escalation {
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }
}
