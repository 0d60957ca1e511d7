package com.keystone.dispatch.cli;

import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: keystone tasks
 * <p>
 * Lists known tasks, optionally filtered by outcome.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List tasks")
@Component
public class TasksCommand implements Runnable {

    @Option(names = {"--outcome", "-o"}, description = "Only tasks with this outcome: ${COMPLETION-CANDIDATES}")
    private TaskOutcome outcome;

    private final GovernanceService governance;

    public TasksCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<TaskRecord> tasks = governance.tasks(Optional.ofNullable(outcome));
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks found.");
            return;
        }

        System.out.println();
        System.out.printf("  %-12s %-10s %-6s %-11s %-20s %s%n",
                "ID", "OUTCOME", "RISK", "STAGE", "UPDATED", "GOAL");
        System.out.println("  " + "-".repeat(90));

        for (TaskRecord task : tasks) {
            System.out.printf("  %-12s %-10s %-6s %-11s %-20s %s%n",
                    task.id(),
                    task.outcome(),
                    task.riskTier(),
                    task.currentStage() == null ? "-" : task.currentStage(),
                    task.updatedAt() == null ? "-" : task.updatedAt().toString().substring(0, 19),
                    ConsoleOutput.truncate(task.goal(), 40));
        }

        System.out.println();
        ConsoleOutput.info(tasks.size() + " task(s) found.");
    }
}
