package com.keystone.core.error;

import java.util.List;

/**
 * Fewer distinct sources than required and no single-source override.
 */
public class InsufficientProvenanceException extends GovernanceException {

    public InsufficientProvenanceException(String message, List<String> policyRefs) {
        super(ErrorKind.INSUFFICIENT_PROVENANCE, message, policyRefs);
    }

    public InsufficientProvenanceException(String message) {
        this(message, List.of());
    }
}
