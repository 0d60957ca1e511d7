package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One logged decision.
 *
 * @param sequence   position in the global log, assigned on append, strictly increasing
 * @param subjectId  task id, or proposal id for promotion decisions
 * @param stage      stage name, or {@code GOVERNOR} / {@code PROMOTION} for decisions made outside a stage
 * @param decision   short decision code, e.g. {@code ADMITTED}, {@code PASS}, {@code ESCALATED}
 * @param rationale  why the decision was made
 * @param policyRefs rule ids the decision cites; every one exists in the Policy Store
 * @param timestamp  when the entry was appended
 */
public record AuditEntry(
        long sequence,
        String subjectId,
        String stage,
        String decision,
        String rationale,
        List<String> policyRefs,
        Instant timestamp
) implements Serializable {

    public static final String GOVERNOR = "GOVERNOR";
    public static final String PROMOTION = "PROMOTION";

    public AuditEntry {
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }
}
