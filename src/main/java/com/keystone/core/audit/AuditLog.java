package com.keystone.core.audit;

import com.keystone.core.model.AuditEntry;
import com.keystone.core.persistence.Journal;
import com.keystone.core.policy.PolicyView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of every governance decision.
 * <p>
 * Each entry receives the next global sequence number under the journal's write
 * lock, so entries for one task appear in the order their decisions were made.
 * Entries cannot cite a rule the Policy Store does not hold.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final Journal<AuditEntry> journal;
    private final PolicyView policy;
    private final Clock clock;

    public AuditLog(Journal<AuditEntry> journal, PolicyView policy, Clock clock) {
        this.journal = journal;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Appends one decision.
     *
     * @throws IllegalArgumentException if the rationale is blank or a policy ref does not exist
     */
    public AuditEntry append(String subjectId, String stage, String decision, String rationale,
                             List<String> policyRefs) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Audit entry needs a subject id");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("Audit entry for " + subjectId + " needs a rationale");
        }
        List<String> refs = policyRefs == null ? List.of() : policyRefs.stream().distinct().toList();
        for (String ref : refs) {
            if (!policy.exists(ref)) {
                throw new IllegalArgumentException("Audit entry for " + subjectId + " cites unknown policy rule " + ref);
            }
        }
        AuditEntry entry = journal.append(subjectId,
                seq -> new AuditEntry(seq, subjectId, stage, decision, rationale, refs, clock.instant()));
        log.info("[audit #{}] {} {} {}: {}", entry.sequence(), subjectId, stage, decision, rationale);
        return entry;
    }

    /** Entries for one subject, in sequence order. */
    public List<AuditEntry> forSubject(String subjectId) {
        return journal.read(subjectId);
    }

    /** The last {@code n} entries for a subject, in sequence order. */
    public List<AuditEntry> latest(String subjectId, int n) {
        List<AuditEntry> entries = journal.read(subjectId);
        return entries.subList(Math.max(0, entries.size() - n), entries.size());
    }

    public Optional<AuditEntry> last(String subjectId) {
        return journal.latest(subjectId);
    }

    public List<AuditEntry> query(AuditQuery query) {
        List<AuditEntry> source = query.subjectId() != null ? journal.read(query.subjectId()) : journal.readAll();
        return source.stream()
                .filter(e -> query.from() == null || !e.timestamp().isBefore(query.from()))
                .filter(e -> query.to() == null || e.timestamp().isBefore(query.to()))
                .toList();
    }

    public long size() {
        return journal.size();
    }
}
