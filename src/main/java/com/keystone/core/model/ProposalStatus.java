package com.keystone.core.model;

public enum ProposalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isOpen() {
        return this == PENDING;
    }
}
