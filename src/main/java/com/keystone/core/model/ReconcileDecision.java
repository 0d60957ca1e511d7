package com.keystone.core.model;

public enum ReconcileDecision {
    ACCEPT,
    RETRY,
    ESCALATE
}
