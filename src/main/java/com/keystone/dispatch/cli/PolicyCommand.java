package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone policy [--history RULE]
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show the current canon or a rule's history")
@Component
public class PolicyCommand implements Callable<Integer> {

    @Option(names = "--history", description = "Show every version of this rule")
    private String ruleId;

    @Option(names = {"--verbose", "-v"}, description = "Print full rule text and triggers")
    private boolean verbose;

    private final GovernanceService governance;

    public PolicyCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<PolicyRule> rules;
        try {
            rules = ruleId == null ? governance.policy() : governance.policyHistory(ruleId);
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.printf("  %-8s %-4s %-10s %-9s %s%n", "ID", "VER", "KIND", "EFFECT", "TEXT");
        System.out.println("  " + "-".repeat(90));
        for (PolicyRule rule : rules) {
            ConsoleOutput.rule(rule);
            if (verbose) {
                System.out.println("           " + rule.text());
                if (!rule.triggers().isEmpty()) {
                    System.out.println("           triggers: " + String.join(", ", rule.triggers()));
                }
                if (rule.approvedBy() != null) {
                    System.out.println("           approved by " + rule.approvedBy() + " at " + rule.createdAt());
                }
            }
        }
        System.out.println();
        ConsoleOutput.info(rules.size() + " rule version(s).");
        return 0;
    }
}
