package com.keystone.core.error;

import java.util.List;

/**
 * A goal or action collides with a blocking policy rule.
 */
public class PolicyConflictException extends GovernanceException {

    public PolicyConflictException(String message, List<String> policyRefs) {
        super(ErrorKind.POLICY_CONFLICT, message, policyRefs);
    }

    public PolicyConflictException(String message) {
        this(message, List.of());
    }
}
