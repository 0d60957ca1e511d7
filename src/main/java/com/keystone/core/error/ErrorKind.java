package com.keystone.core.error;

/**
 * Machine-readable category of a governance failure, surfaced by the REST and CLI layers.
 */
public enum ErrorKind {
    INSUFFICIENT_PROVENANCE,
    MALFORMED_PROVENANCE,
    AUTHORITY_VIOLATION,
    UNSUPPORTED_CLAIM,
    BUDGET_EXCEEDED,
    APPROVAL_REQUIRED,
    POLICY_CONFLICT,
    NOT_FOUND,
    STATE_CONFLICT
}
