package com.keystone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task moves through governance, used for SSE streaming
 * and CLI progress output.
 *
 * @param eventType event type, e.g. {@code task.admitted}, {@code stage.completed}, {@code task.escalated}
 * @param subjectId the task (or proposal) this event belongs to
 * @param stage     the stage the event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GovernanceEvent(
        String eventType,
        String subjectId,
        String stage,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static GovernanceEvent of(String eventType, String subjectId, String stage, Map<String, Object> payload) {
        return new GovernanceEvent(eventType, subjectId, stage, payload == null ? Map.of() : payload, Instant.now());
    }
}
