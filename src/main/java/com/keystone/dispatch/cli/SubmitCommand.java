package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: keystone submit "goal" --source "name|confidence|contentRef"
 * <p>
 * Admits a goal through the Governor and, unless {@code --no-wait} is given,
 * waits for the pipeline to settle and prints the outcome.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a goal to the governed pipeline")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Goal in plain language")
    private String goal;

    @Option(names = {"--source", "-s"},
            description = "Provenance as name|confidence[|contentRef[|timestamp]] (repeatable)")
    private List<String> sources = new ArrayList<>();

    @Option(names = "--allow-single-source", description = "Admit with fewer distinct sources than required")
    private boolean allowSingleSource;

    @Option(names = "--override-reason", description = "Why the single-source override is needed")
    private String overrideReason;

    @Option(names = "--steps", description = "Projected number of steps")
    private Integer projectedSteps;

    @Option(names = "--tool-calls", description = "Projected number of tool calls")
    private Integer projectedToolCalls;

    @Option(names = "--by", description = "Submitter (default: ${DEFAULT-VALUE})", defaultValue = "cli")
    private String submittedBy;

    @Option(names = "--no-wait", description = "Return as soon as the task is admitted")
    private boolean noWait;

    @Option(names = "--timeout", description = "Seconds to wait for the outcome (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private long timeoutSeconds;

    private final GovernanceService governance;
    private final Clock clock;

    public SubmitCommand(GovernanceService governance, Clock clock) {
        this.governance = governance;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<ProvenanceRecord> provenance;
        try {
            provenance = sources.stream().map(this::parseSource).toList();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            ConsoleOutput.error("Invalid --source: " + e.getMessage());
            return 2;
        }

        TaskRecord task;
        try {
            task = governance.submit(goal, provenance, new SubmitOptions(
                    allowSingleSource, overrideReason, projectedSteps, projectedToolCalls, submittedBy));
        } catch (GovernanceException e) {
            ConsoleOutput.error("Submission refused (" + e.kind() + "): " + e.getMessage());
            if (!e.policyRefs().isEmpty()) {
                ConsoleOutput.info("Policy: " + String.join(", ", e.policyRefs()));
            }
            return 1;
        }

        ConsoleOutput.success("Admitted " + task.id() + " at " + task.riskTier() + " risk");
        if (noWait) {
            return 0;
        }

        ConsoleOutput.info("Running pipeline...");
        try {
            TaskRecord settled = governance.awaitTask(task.id(), Duration.ofSeconds(timeoutSeconds));
            ConsoleOutput.task(settled);
            return exitCode(settled.outcome());
        } catch (TimeoutException e) {
            ConsoleOutput.warn("Still running after " + timeoutSeconds + "s; check with: keystone status " + task.id());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 130;
        }
    }

    /** 0 when done, 1 when rejected, 3 when waiting on a human. */
    static int exitCode(TaskOutcome outcome) {
        return switch (outcome) {
            case REJECTED -> 1;
            case ESCALATED -> 3;
            default -> 0;
        };
    }

    ProvenanceRecord parseSource(String spec) {
        String[] parts = spec.split("\\|", -1);
        if (parts.length < 2 || parts[0].isBlank()) {
            throw new IllegalArgumentException("expected name|confidence[|contentRef[|timestamp]] but got '" + spec + "'");
        }
        double confidence;
        try {
            confidence = Double.parseDouble(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("confidence '" + parts[1] + "' is not a number", e);
        }
        String contentRef = parts.length > 2 && !parts[2].isBlank() ? parts[2].trim() : null;
        Instant timestamp = parts.length > 3 && !parts[3].isBlank() ? Instant.parse(parts[3].trim()) : clock.instant();
        return ProvenanceRecord.of(parts[0].trim(), timestamp, confidence, contentRef);
    }
}
