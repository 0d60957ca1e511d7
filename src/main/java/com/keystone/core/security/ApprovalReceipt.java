package com.keystone.core.security;

import java.time.Instant;

/**
 * Proof that a human approved a policy change, produced by verifying an approval token.
 *
 * @param approver   subject of the token
 * @param proposalId the proposal the token was issued for
 * @param tokenId    token id ({@code jti}), recorded with the published rule
 * @param issuedAt   when the token was issued
 */
public record ApprovalReceipt(String approver, String proposalId, String tokenId, Instant issuedAt) {

    /** Receipt for the one-time bootstrap of the canon into an empty store. */
    public static ApprovalReceipt bootstrap(Instant at) {
        return new ApprovalReceipt("bootstrap", null, null, at);
    }
}
