package com.keystone.dispatch.cli;

import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Keystone CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KEYSTONE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KEYSTONE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void task(TaskRecord task) {
        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("Goal: " + task.goal());
        System.out.println("Risk: " + task.riskTier() + " - " + task.riskRationale());
        System.out.println("Stage: " + (task.currentStage() == null ? "-" : task.currentStage()));
        System.out.println("Usage: " + task.usage().steps() + " steps, " + task.usage().toolCalls() + " tool calls");
        String line = "Outcome: " + task.outcome() + (task.rationale() == null ? "" : " - " + task.rationale());
        if (task.outcome() == TaskOutcome.DONE) {
            success(line);
        } else if (task.outcome() == TaskOutcome.REJECTED) {
            error(line);
        } else if (task.outcome() == TaskOutcome.ESCALATED) {
            warn(line);
        } else {
            info(line);
        }
        if (task.escalation() != null) {
            warn("Escalation " + task.escalation().trigger() + ": resumes at " + task.escalation().resumeStage()
                    + " once approved (keystone resolve " + task.id() + " --approve --approver <you>)");
        }
        if (task.output() != null && task.output().hasContent() && task.outcome() == TaskOutcome.DONE) {
            System.out.println();
            System.out.println(task.output().content());
        }
    }

    public static void auditEntry(AuditEntry entry) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|faint #%-5d|@ %-12s @|bold %-12s|@ %-22s %s @|faint %s|@",
                entry.sequence(), entry.subjectId(), entry.stage(), entry.decision(),
                entry.rationale(), entry.policyRefs())));
    }

    public static void rule(PolicyRule rule) {
        System.out.printf("  %-8s v%-3d %-10s %-9s %s%n",
                rule.id(), rule.version(), rule.kind(), rule.effect(), truncate(rule.text(), 70));
    }

    public static void proposal(PromotionProposal proposal) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + proposal.id() + "|@ [" + proposal.status() + "] " + proposal.candidate().text()));
        System.out.println("    Evidence: " + String.join(", ", proposal.evidence()));
        System.out.println("    Impact:   " + proposal.impactAnalysis());
        System.out.println("    Rollback: " + proposal.rollbackPlan());
        if (proposal.disposition() != null) {
            System.out.println("    Decision: " + proposal.disposition());
        }
    }

    public static void watchEvent(String eventType, String data) {
        String color = switch (eventType) {
            case "task.completed" -> "green";
            case "task.rejected", "stage.failed" -> "red";
            case "task.escalated" -> "yellow";
            default -> "cyan";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(" + color + ") " + eventType + "|@ " + truncate(data, 120)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
