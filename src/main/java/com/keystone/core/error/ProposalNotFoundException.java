package com.keystone.core.error;

import java.util.List;

/**
 * No promotion proposal exists with the requested id.
 */
public class ProposalNotFoundException extends GovernanceException {

    public ProposalNotFoundException(String message, List<String> policyRefs) {
        super(ErrorKind.NOT_FOUND, message, policyRefs);
    }

    public ProposalNotFoundException(String message) {
        this(message, List.of());
    }
}
