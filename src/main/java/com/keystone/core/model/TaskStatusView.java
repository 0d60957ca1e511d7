package com.keystone.core.model;

import java.util.List;

/**
 * Read-only snapshot of a task returned by status queries.
 */
public record TaskStatusView(
        String taskId,
        String goal,
        Stage stage,
        RiskTier riskTier,
        TaskOutcome outcome,
        String rationale,
        Escalation escalation,
        List<AuditEntry> latestAuditEntries
) {

    public TaskStatusView {
        latestAuditEntries = latestAuditEntries == null ? List.of() : List.copyOf(latestAuditEntries);
    }
}
