package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Summary of a task that reached a terminal or escalated state, mined by the promotion pipeline.
 *
 * @param taskId     the task
 * @param goal       the submitted goal text
 * @param riskTier   tier the task ran under
 * @param outcome    DONE, REJECTED or ESCALATED
 * @param finalStage stage the task stopped in (null if it never ran one)
 * @param reasonKind machine-readable reason, e.g. an escalation trigger or {@code COMPLETED}
 * @param retries    review retries consumed
 * @param recordedAt when the episode was recorded
 */
public record EpisodeRecord(
        String taskId,
        String goal,
        RiskTier riskTier,
        TaskOutcome outcome,
        Stage finalStage,
        String reasonKind,
        int retries,
        Instant recordedAt
) implements Serializable {

    public boolean adverse() {
        return outcome == TaskOutcome.REJECTED || outcome == TaskOutcome.ESCALATED;
    }
}
