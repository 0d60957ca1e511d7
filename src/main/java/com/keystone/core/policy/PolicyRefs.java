package com.keystone.core.policy;

/**
 * Ids of canon rules the governance core cites in its own decisions.
 * The rules themselves live in {@code canon.yaml}.
 */
public final class PolicyRefs {

    private PolicyRefs() {}

    public static final String REFUSAL_IS_VALID = "VAL-001";
    public static final String HUMAN_AUTHORITY = "VAL-002";

    public static final String CANON_IMMUTABLE = "INV-001";
    public static final String PROVENANCE_REQUIRED = "INV-002";
    public static final String TWO_SOURCES = "INV-003";
    public static final String DECISIONS_LOGGED = "INV-004";
    public static final String STAGE_AUTHORITY = "INV-005";
    public static final String NO_SKIPPED_CHECKS = "INV-006";
    public static final String CLAIMS_TRACEABLE = "INV-007";
    public static final String HUMAN_RESOLVES = "INV-008";

    public static final String IRREVERSIBLE_ACTIONS = "HEU-001";
    public static final String FINANCIAL_LEGAL = "HEU-002";
    public static final String ELEVATED_WORK = "HEU-003";
    public static final String BUDGET_BREACH = "HEU-004";
    public static final String DEFAULT_LOW = "HEU-005";
    public static final String RETRY_LIMIT = "HEU-006";
    public static final String STAGE_FAILURES = "HEU-007";

    public static final String SOURCE_DOMINANCE = "TRD-001";
    public static final String BUDGET_TERMINATES = "TRD-002";
}
