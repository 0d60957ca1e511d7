package com.keystone.dispatch.cli;

import com.keystone.core.audit.AuditQuery;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Instant;
import java.util.List;

/**
 * CLI command: keystone audit [--task ID] [--from T] [--to T]
 * <p>
 * Prints audit entries in append order.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Query the audit log")
@Component
public class AuditCommand implements Runnable {

    @Option(names = {"--task", "-t"}, description = "Only entries about this task or proposal")
    private String subjectId;

    @Option(names = "--from", description = "Inclusive lower bound, ISO-8601 instant")
    private Instant from;

    @Option(names = "--to", description = "Exclusive upper bound, ISO-8601 instant")
    private Instant to;

    private final GovernanceService governance;

    public AuditCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<AuditEntry> entries = governance.audit(new AuditQuery(subjectId, from, to));
        if (entries.isEmpty()) {
            ConsoleOutput.info("No audit entries found.");
            return;
        }
        System.out.println();
        entries.forEach(ConsoleOutput::auditEntry);
        System.out.println();
        ConsoleOutput.info(entries.size() + " entr" + (entries.size() == 1 ? "y" : "ies") + ".");
    }
}
