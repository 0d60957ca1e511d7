package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone cancel &lt;task-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a task that has not settled")
@Component
public class CancelCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = "--reason", description = "Why the task is cancelled (default: ${DEFAULT-VALUE})",
            defaultValue = "Cancelled from CLI")
    private String reason;

    private final GovernanceService governance;

    public CancelCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        try {
            TaskRecord task = governance.cancel(taskId, reason);
            ConsoleOutput.success("Cancellation requested for " + task.id() + " (" + task.outcome() + ")");
            return 0;
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
