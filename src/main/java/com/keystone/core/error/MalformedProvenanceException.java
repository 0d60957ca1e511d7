package com.keystone.core.error;

import java.util.List;

/**
 * A provenance record is missing its source, timestamp or confidence, or carries an invalid value.
 */
public class MalformedProvenanceException extends GovernanceException {

    public MalformedProvenanceException(String message, List<String> policyRefs) {
        super(ErrorKind.MALFORMED_PROVENANCE, message, policyRefs);
    }

    public MalformedProvenanceException(String message) {
        this(message, List.of());
    }
}
