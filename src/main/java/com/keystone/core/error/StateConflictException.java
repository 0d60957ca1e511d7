package com.keystone.core.error;

import java.util.List;

/**
 * An operation is not allowed in the subject's current state, e.g. resolving a task that is not escalated.
 */
public class StateConflictException extends GovernanceException {

    public StateConflictException(String message, List<String> policyRefs) {
        super(ErrorKind.STATE_CONFLICT, message, policyRefs);
    }

    public StateConflictException(String message) {
        this(message, List.of());
    }
}
