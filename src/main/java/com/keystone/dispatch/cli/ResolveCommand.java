package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: keystone resolve &lt;task-id&gt; --approve|--reject --approver NAME
 * <p>
 * Records a human decision on an escalated task. Approval resumes the pipeline
 * at the stage the escalation named; the command waits for that run to settle.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Approve or reject an escalated task")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Decision decision;

    static class Decision {
        @Option(names = "--approve", required = true, description = "Approve and resume the task")
        boolean approve;

        @Option(names = "--reject", required = true, description = "Reject the task")
        boolean reject;
    }

    @Option(names = "--approver", required = true, description = "Who is making the decision")
    private String approver;

    @Option(names = "--note", description = "Reason recorded with the decision")
    private String note;

    @Option(names = "--timeout", description = "Seconds to wait for the resumed run (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private long timeoutSeconds;

    private final GovernanceService governance;

    public ResolveCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        EscalationDecision choice = decision.approve ? EscalationDecision.APPROVE : EscalationDecision.REJECT;

        TaskRecord resolved;
        try {
            resolved = governance.resolveEscalation(taskId, choice, approver, note);
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (resolved.outcome() != TaskOutcome.APPROVED) {
            ConsoleOutput.task(resolved);
            return SubmitCommand.exitCode(resolved.outcome());
        }

        ConsoleOutput.success("Approved by " + approver + "; resuming " + taskId);
        try {
            TaskRecord settled = governance.awaitTask(taskId, Duration.ofSeconds(timeoutSeconds));
            ConsoleOutput.task(settled);
            return SubmitCommand.exitCode(settled.outcome());
        } catch (TimeoutException e) {
            ConsoleOutput.warn("Still running after " + timeoutSeconds + "s; check with: keystone status " + taskId);
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 130;
        }
    }
}
