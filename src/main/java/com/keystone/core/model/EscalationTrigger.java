package com.keystone.core.model;

/**
 * Why a task was handed to a human.
 */
public enum EscalationTrigger {
    /** HIGH-tier tasks stop after Gather until a human approves. */
    HIGH_RISK_GATE,
    /** Review kept failing and the retry limit was reached. */
    RETRY_LIMIT,
    /** Compliance held the output for explicit approval. */
    COMPLIANCE_HOLD,
    /** A stage wrote outside its declared capabilities. */
    AUTHORITY_VIOLATION,
    /** A stage failed internally more often than the Governor retries. */
    STAGE_FAILURE,
    /** A stage surfaced a policy conflict it could not settle. */
    POLICY_CONFLICT
}
