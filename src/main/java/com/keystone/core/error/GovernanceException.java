package com.keystone.core.error;

import java.util.List;

/**
 * Base class for every failure the governance core reports to callers.
 * <p>
 * Carries an {@link ErrorKind} and the policy rules the failure cites so that
 * callers can explain a refusal without parsing the message.
 */
public class GovernanceException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> policyRefs;

    public GovernanceException(ErrorKind kind, String message, List<String> policyRefs) {
        super(message);
        this.kind = kind;
        this.policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }

    public GovernanceException(ErrorKind kind, String message, List<String> policyRefs, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }

    public ErrorKind kind() {
        return kind;
    }

    public List<String> policyRefs() {
        return policyRefs;
    }
}
