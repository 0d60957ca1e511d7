package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A candidate policy rule mined from episodic history, waiting for a human.
 *
 * @param id             proposal id, e.g. {@code PRP-0001}
 * @param candidate      unpublished rule draft
 * @param evidence       task ids the pattern was observed in
 * @param rationale      why the pattern was proposed
 * @param impactAnalysis what publishing the rule would change
 * @param rollbackPlan   how to undo the rule once published
 * @param status         current status
 * @param disposition    who decided and why (approver and rule id, rejection reason, or expiry note)
 * @param createdAt      when the proposal was queued
 * @param decidedAt      when the status left PENDING
 */
public record PromotionProposal(
        String id,
        PolicyRule candidate,
        List<String> evidence,
        String rationale,
        String impactAnalysis,
        String rollbackPlan,
        ProposalStatus status,
        String disposition,
        Instant createdAt,
        Instant decidedAt
) implements Serializable {

    public PromotionProposal {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public PromotionProposal withId(String newId, Instant at) {
        return new PromotionProposal(newId, candidate, evidence, rationale, impactAnalysis, rollbackPlan,
                ProposalStatus.PENDING, null, at, null);
    }

    public PromotionProposal decided(ProposalStatus newStatus, String newDisposition, Instant at) {
        return new PromotionProposal(id, candidate, evidence, rationale, impactAnalysis, rollbackPlan,
                newStatus, newDisposition, createdAt, at);
    }
}
