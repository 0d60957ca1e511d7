package com.keystone.core.governor;

import com.keystone.core.model.RiskTier;

import java.io.Serializable;
import java.util.List;

/**
 * Result of risk assessment.
 *
 * @param tier       assigned tier
 * @param primary    the signal reported as the main cause, null when no rule fired
 * @param signals    every signal found, in precedence order
 * @param policyRefs rules behind the tier
 * @param rationale  human-readable explanation
 */
public record RiskAssessment(
        RiskTier tier,
        RiskSignal primary,
        List<RiskSignal> signals,
        List<String> policyRefs,
        String rationale
) implements Serializable {

    public RiskAssessment {
        signals = signals == null ? List.of() : List.copyOf(signals);
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }
}
