package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the Compliance stage.
 *
 * @param decision   APPROVE, HOLD (needs a human) or REJECT
 * @param reasons    why the decision was reached
 * @param policyRefs rules that drove the decision
 */
public record ComplianceVerdict(
        ComplianceDecision decision,
        List<String> reasons,
        List<String> policyRefs
) implements Serializable {

    public ComplianceVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }
}
