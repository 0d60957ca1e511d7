package com.keystone.core.governor;

import com.keystone.core.model.RiskTier;

import java.io.Serializable;

/**
 * One piece of evidence behind a risk tier.
 *
 * @param kind        signal category
 * @param impliedTier tier this signal alone would assign
 * @param ruleId      rule that produced the signal
 * @param detail      the matched trigger or the breached limit
 */
public record RiskSignal(SignalKind kind, RiskTier impliedTier, String ruleId, String detail) implements Serializable {
}
