package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.Escalation;
import com.keystone.core.model.TaskRecord;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for task endpoints.
 */
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    String goal,
    String stage,
    @JsonProperty("risk_tier") String riskTier,
    @JsonProperty("risk_rationale") String riskRationale,
    String outcome,
    String rationale,
    Escalation escalation,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("steps_used") int stepsUsed,
    @JsonProperty("tool_calls_used") int toolCallsUsed,
    @JsonProperty("provenance_ids") List<String> provenanceIds,
    String output,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("latest_audit") List<AuditEntry> latestAudit
) {

    public static TaskResponse from(TaskRecord task, List<AuditEntry> latestAudit) {
        return new TaskResponse(
                task.id(),
                task.goal(),
                task.currentStage() != null ? task.currentStage().name() : null,
                task.riskTier().name(),
                task.riskRationale(),
                task.outcome().name(),
                task.rationale(),
                task.escalation(),
                task.retryCount(),
                task.usage().steps(),
                task.usage().toolCalls(),
                task.provenanceIds(),
                task.output() != null ? task.output().content() : null,
                task.updatedAt(),
                latestAudit);
    }
}
