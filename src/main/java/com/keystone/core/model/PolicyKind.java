package com.keystone.core.model;

public enum PolicyKind {
    VALUE,
    INVARIANT,
    HEURISTIC,
    TRADEOFF
}
