package com.keystone.core.governor;

/**
 * Categories of evidence the risk assessor weighs. The order in which they are
 * reported as the primary cause is configurable
 * ({@code keystone.governor.risk-precedence}).
 */
public enum SignalKind {
    IRREVERSIBLE_IMPACT,
    POLICY_CONFLICT,
    BUDGET_BREACH,
    HEURISTIC
}
