package com.keystone.core.model;

public enum EscalationDecision {
    APPROVE,
    REJECT
}
