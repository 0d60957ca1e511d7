package com.keystone.core.audit;

import java.time.Instant;

/**
 * Filter for audit exports. Null fields do not filter.
 *
 * @param subjectId task or proposal id
 * @param from      inclusive lower bound on the entry timestamp
 * @param to        exclusive upper bound on the entry timestamp
 */
public record AuditQuery(String subjectId, Instant from, Instant to) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null);
    }

    public static AuditQuery forSubject(String subjectId) {
        return new AuditQuery(subjectId, null, null);
    }
}
