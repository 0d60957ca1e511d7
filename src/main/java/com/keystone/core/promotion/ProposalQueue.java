package com.keystone.core.promotion;

import com.keystone.core.error.ProposalNotFoundException;
import com.keystone.core.error.StateConflictException;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.persistence.Journal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-managed queue of promotion proposals. Status changes are appended as
 * new snapshots; a proposal is never removed, so rejected and expired
 * proposals stay visible with their disposition.
 */
public class ProposalQueue {

    private final Journal<PromotionProposal> journal;

    public ProposalQueue(Journal<PromotionProposal> journal) {
        this.journal = journal;
    }

    public synchronized PromotionProposal add(PromotionProposal draft, Instant at) {
        String id = String.format("PRP-%04d", journal.keys().size() + 1);
        return journal.append(id, draft.withId(id, at));
    }

    /**
     * Appends a decided snapshot. Only an open proposal can be decided, so a
     * second disposition of the same proposal is refused.
     *
     * @throws StateConflictException if the proposal was already decided
     */
    public synchronized PromotionProposal update(PromotionProposal proposal) {
        PromotionProposal current = get(proposal.id());
        if (!current.status().isOpen()) {
            throw new StateConflictException("Proposal " + proposal.id() + " is already " + current.status());
        }
        return journal.append(proposal.id(), proposal);
    }

    public Optional<PromotionProposal> find(String proposalId) {
        return proposalId == null ? Optional.empty() : journal.latest(proposalId);
    }

    public PromotionProposal get(String proposalId) {
        return find(proposalId).orElseThrow(() -> new ProposalNotFoundException("No proposal " + proposalId));
    }

    /** Current snapshot of every proposal, oldest first. */
    public List<PromotionProposal> all() {
        return journal.keys().stream()
                .map(journal::latest)
                .flatMap(Optional::stream)
                .toList();
    }

    public List<PromotionProposal> withStatus(ProposalStatus status) {
        return all().stream().filter(p -> p.status() == status).toList();
    }

    /** Every snapshot of one proposal, oldest first. */
    public List<PromotionProposal> history(String proposalId) {
        return journal.read(proposalId);
    }
}
