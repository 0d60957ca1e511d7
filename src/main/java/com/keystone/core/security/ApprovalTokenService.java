package com.keystone.core.security;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.policy.PolicyRefs;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies the signed tokens a human presents to approve a
 * promotion proposal. A token is bound to one approver and one proposal and
 * expires after {@code keystone.approval.expiration-seconds}.
 */
@Service
public class ApprovalTokenService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalTokenService.class);

    static final String PROPOSAL_CLAIM = "proposalId";

    private final SecretKey signingKey;
    private final long expirationSeconds;
    private final String issuer;
    private final Clock clock;

    public ApprovalTokenService(KeystoneProperties props, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(props.getApproval().getSecret().getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = props.getApproval().getExpirationSeconds();
        this.issuer = props.getApproval().getIssuer();
        this.clock = clock;
    }

    public String issue(String approver, String proposalId) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("Approver identity is required");
        }
        if (proposalId == null || proposalId.isBlank()) {
            throw new IllegalArgumentException("Proposal id is required");
        }
        Instant now = clock.instant();
        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(issuer)
                .subject(approver.trim())
                .claim(PROPOSAL_CLAIM, proposalId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(expirationSeconds)))
                .signWith(signingKey)
                .compact();
        log.info("Issued approval token for {} on proposal {}", approver.trim(), proposalId);
        return token;
    }

    /**
     * Verifies a token for the given proposal.
     *
     * @throws ApprovalRequiredException if the token is missing, invalid, expired,
     *                                   or was issued for a different proposal or approver
     */
    public ApprovalReceipt verify(String token, String proposalId, String expectedApprover) {
        if (token == null || token.isBlank()) {
            throw new ApprovalRequiredException("An approval token is required", List.of(PolicyRefs.CANON_IMMUTABLE));
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new ApprovalRequiredException("Approval token rejected: " + e.getMessage(), e);
        }
        String boundProposal = claims.get(PROPOSAL_CLAIM, String.class);
        if (!proposalId.equals(boundProposal)) {
            throw new ApprovalRequiredException("Approval token was issued for proposal " + boundProposal
                    + ", not " + proposalId, List.of(PolicyRefs.CANON_IMMUTABLE));
        }
        if (expectedApprover != null && !expectedApprover.isBlank()
                && !expectedApprover.trim().equals(claims.getSubject())) {
            throw new ApprovalRequiredException("Approval token belongs to " + claims.getSubject()
                    + ", not " + expectedApprover.trim(), List.of(PolicyRefs.CANON_IMMUTABLE));
        }
        return new ApprovalReceipt(claims.getSubject(), boundProposal, claims.getId(),
                claims.getIssuedAt().toInstant());
    }
}
