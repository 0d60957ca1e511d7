package com.keystone.core.model;

/**
 * Risk classification assigned to a task at admission.
 * <p>
 * The tier selects the stage path the pipeline follows and the budget the
 * task runs under. Ordinal order is significant: later constants are riskier.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH;

    /** One tier above this one, capped at {@link #HIGH}. */
    public RiskTier raise() {
        return this == HIGH ? HIGH : values()[ordinal() + 1];
    }

    public boolean isAtLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }

    public static RiskTier max(RiskTier a, RiskTier b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
