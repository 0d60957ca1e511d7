package com.keystone.core.error;

import java.util.List;

/**
 * An action needs a valid human approval and none (or an invalid one) was supplied.
 */
public class ApprovalRequiredException extends GovernanceException {

    public ApprovalRequiredException(String message, List<String> policyRefs) {
        super(ErrorKind.APPROVAL_REQUIRED, message, policyRefs);
    }

    public ApprovalRequiredException(String message) {
        this(message, List.of());
    }

    public ApprovalRequiredException(String message, Throwable cause) {
        super(ErrorKind.APPROVAL_REQUIRED, message, List.of(), cause);
    }
}
