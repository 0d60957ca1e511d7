package com.keystone.core.model;

public enum ComplianceDecision {
    APPROVE,
    HOLD,
    REJECT
}
