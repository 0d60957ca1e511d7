package com.keystone.core.error;

import java.util.List;

/**
 * A claim cites no provenance record that resolves in the ledger.
 */
public class UnsupportedClaimException extends GovernanceException {

    public UnsupportedClaimException(String message, List<String> policyRefs) {
        super(ErrorKind.UNSUPPORTED_CLAIM, message, policyRefs);
    }

    public UnsupportedClaimException(String message) {
        this(message, List.of());
    }
}
