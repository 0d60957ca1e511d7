package com.keystone.dispatch.api;

import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.service.GovernanceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * REST controller for the promotion queue.
 */
@RestController
@RequestMapping("/api/v1/proposals")
public class ProposalController {

    private final GovernanceService governance;

    public ProposalController(GovernanceService governance) {
        this.governance = governance;
    }

    @GetMapping
    public List<PromotionProposal> list(@RequestParam(required = false) String status) {
        return governance.proposals(Optional.ofNullable(status)
                .map(s -> ProposalStatus.valueOf(s.toUpperCase(Locale.ROOT))));
    }

    @GetMapping("/{id}")
    public PromotionProposal get(@PathVariable String id) {
        return governance.proposal(id);
    }

    /**
     * POST /api/v1/proposals/scan: Expire stale proposals and queue new ones.
     * Returns only the newly queued proposals.
     */
    @PostMapping("/scan")
    public List<PromotionProposal> scan() {
        return governance.scanProposals();
    }

    /**
     * POST /api/v1/proposals/{id}/approve: Publish the drafted rule. Needs a
     * valid approval token issued for this proposal and approver.
     */
    @PostMapping("/{id}/approve")
    public PolicyRule approve(@PathVariable String id, @RequestBody ProposalDecisionRequest request) {
        return governance.approveProposal(id, request.approver(), request.token());
    }

    @PostMapping("/{id}/reject")
    public PromotionProposal reject(@PathVariable String id, @RequestBody ProposalDecisionRequest request) {
        return governance.rejectProposal(id, request.reason());
    }
}
