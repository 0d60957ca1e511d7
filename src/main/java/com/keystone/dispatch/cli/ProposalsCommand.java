package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone proposals [list|scan|show|approve|reject]
 * <p>
 * Drives the promotion pipeline. Without a subcommand it lists pending proposals.
 */
@Command(name = "proposals", mixinStandardHelpOptions = true,
        description = "Review and decide canon promotion proposals")
@Component
public class ProposalsCommand implements Callable<Integer> {

    private final GovernanceService governance;

    public ProposalsCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        return list(ProposalStatus.PENDING);
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List proposals")
    int list(@Option(names = {"--status", "-s"}, description = "Only proposals with this status: ${COMPLETION-CANDIDATES}")
             ProposalStatus status) {
        ConsoleOutput.printBanner();
        List<PromotionProposal> proposals = governance.proposals(Optional.ofNullable(status));
        if (proposals.isEmpty()) {
            ConsoleOutput.info("No proposals found.");
            return 0;
        }
        System.out.println();
        proposals.forEach(ConsoleOutput::proposal);
        System.out.println();
        ConsoleOutput.info(proposals.size() + " proposal(s).");
        return 0;
    }

    @Command(name = "scan", mixinStandardHelpOptions = true,
            description = "Expire stale proposals and queue new ones from episodic history")
    int scan() {
        ConsoleOutput.printBanner();
        List<PromotionProposal> queued = governance.scanProposals();
        if (queued.isEmpty()) {
            ConsoleOutput.info("No new recurring patterns found.");
            return 0;
        }
        queued.forEach(ConsoleOutput::proposal);
        ConsoleOutput.success(queued.size() + " proposal(s) queued for review.");
        return 0;
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show one proposal")
    int show(@Parameters(paramLabel = "PROPOSAL_ID") String proposalId) {
        try {
            ConsoleOutput.proposal(governance.proposal(proposalId));
            return 0;
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    @Command(name = "approve", mixinStandardHelpOptions = true,
            description = "Publish a proposal's rule (needs a token from 'keystone token')")
    int approve(@Parameters(paramLabel = "PROPOSAL_ID") String proposalId,
                @Option(names = "--approver", required = true, description = "Approver named in the token") String approver,
                @Option(names = "--token", required = true, description = "Signed approval token") String token) {
        try {
            PolicyRule rule = governance.approveProposal(proposalId, approver, token);
            ConsoleOutput.success("Published " + rule.id() + " v" + rule.version() + ": " + rule.text());
            return 0;
        } catch (GovernanceException e) {
            ConsoleOutput.error("Approval refused (" + e.kind() + "): " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "reject", mixinStandardHelpOptions = true, description = "Reject a proposal")
    int reject(@Parameters(paramLabel = "PROPOSAL_ID") String proposalId,
               @Option(names = "--reason", required = true, description = "Why the proposal is rejected") String reason) {
        try {
            PromotionProposal rejected = governance.rejectProposal(proposalId, reason);
            ConsoleOutput.success(rejected.id() + " rejected.");
            return 0;
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
