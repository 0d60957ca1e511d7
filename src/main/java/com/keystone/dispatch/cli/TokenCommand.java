package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone token &lt;proposal-id&gt; --approver NAME
 * <p>
 * Issues a signed approval token bound to one approver and one proposal.
 * Only the token is printed on stdout so it can be captured by a script.
 */
@Command(name = "token", mixinStandardHelpOptions = true, description = "Issue an approval token for a proposal")
@Component
public class TokenCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Proposal ID")
    private String proposalId;

    @Option(names = "--approver", required = true, description = "Approver the token is issued to")
    private String approver;

    private final GovernanceService governance;

    public TokenCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(governance.issueApprovalToken(approver, proposalId));
            return 0;
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
