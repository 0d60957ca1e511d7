package com.keystone.core.provenance;

import com.keystone.core.error.MalformedProvenanceException;
import com.keystone.core.error.UnsupportedClaimException;
import com.keystone.core.model.Claim;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.persistence.Journal;
import com.keystone.core.policy.PolicyRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Append-only ledger of provenance records.
 * <p>
 * Records are validated before they are written: a record without a source,
 * timestamp or confidence, a confidence outside [0, 1], or a timestamp further
 * in the future than the allowed clock skew is refused. Ids are assigned by the
 * ledger ({@code PRV-000001}, ...) and never reused.
 */
public class ProvenanceLedger implements ProvenanceView {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceLedger.class);

    /** Ids derive from the journal sequence, so all records share one key. */
    private static final String JOURNAL_KEY = "provenance";

    private final Journal<ProvenanceRecord> journal;
    private final Clock clock;
    private final Duration timestampSkew;

    public ProvenanceLedger(Journal<ProvenanceRecord> journal, Clock clock, Duration timestampSkew) {
        this.journal = journal;
        this.clock = clock;
        this.timestampSkew = timestampSkew;
    }

    /**
     * Checks a record without writing it.
     *
     * @throws MalformedProvenanceException naming the first problem found
     */
    public void validate(ProvenanceRecord record) {
        if (record == null) {
            throw malformed("Provenance record is missing");
        }
        if (record.source() == null || record.source().isBlank()) {
            throw malformed("Provenance record has no source");
        }
        if (record.timestamp() == null) {
            throw malformed("Provenance record from '" + record.source() + "' has no timestamp");
        }
        if (record.timestamp().isAfter(clock.instant().plus(timestampSkew))) {
            throw malformed("Provenance record from '" + record.source() + "' is timestamped in the future: "
                    + record.timestamp());
        }
        Double confidence = record.confidence();
        if (confidence == null) {
            throw malformed("Provenance record from '" + record.source() + "' has no confidence");
        }
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw malformed("Provenance record from '" + record.source() + "' has confidence outside [0, 1]: "
                    + confidence);
        }
    }

    /** Validates every record; nothing is written if any record is malformed. */
    public void validateAll(Collection<ProvenanceRecord> records) {
        records.forEach(this::validate);
    }

    public ProvenanceRecord append(ProvenanceRecord record) {
        validate(record);
        ProvenanceRecord stored = journal.append(JOURNAL_KEY, seq -> record.withId(formatId(seq)));
        log.debug("Appended provenance {} from {}", stored.id(), stored.source());
        return stored;
    }

    /**
     * Validates all records first, then appends them in order as one unit:
     * a storage failure part way leaves none of them in the ledger.
     */
    public List<ProvenanceRecord> appendAll(List<ProvenanceRecord> records) {
        validateAll(records);
        List<LongFunction<ProvenanceRecord>> entries = new ArrayList<>(records.size());
        for (ProvenanceRecord record : records) {
            entries.add(seq -> record.withId(formatId(seq)));
        }
        List<ProvenanceRecord> stored = journal.appendAll(JOURNAL_KEY, entries);
        log.debug("Appended {} provenance record(s)", stored.size());
        return stored;
    }

    @Override
    public Optional<ProvenanceRecord> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return journal.readAll().stream().filter(r -> id.equals(r.id())).findFirst();
    }

    @Override
    public List<ProvenanceRecord> findAll(List<String> ids) {
        Map<String, ProvenanceRecord> byId = index();
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    @Override
    public List<ProvenanceRecord> resolve(String contentRef) {
        if (contentRef == null) {
            return List.of();
        }
        return journal.readAll().stream()
                .filter(r -> contentRef.equals(r.contentRef()))
                .toList();
    }

    @Override
    public List<ProvenanceRecord> resolveClaim(Claim claim) {
        List<ProvenanceRecord> backing = findAll(claim.provenanceIds());
        if (backing.isEmpty()) {
            throw new UnsupportedClaimException("Claim has no resolvable provenance: \"" + claim.text() + "\"",
                    List.of(PolicyRefs.CLAIMS_TRACEABLE));
        }
        return backing;
    }

    /**
     * Reports the most dominant source if it backs more than {@code threshold}
     * of the given records. An empty collection never dominates.
     */
    public static Optional<SourceDominanceWarning> checkDominance(Collection<ProvenanceRecord> backing,
                                                                  double threshold) {
        if (backing.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ProvenanceRecord r : backing) {
            counts.merge(r.sourceKey(), 1, Integer::sum);
        }
        var top = counts.entrySet().stream().max(Map.Entry.comparingByValue()).orElseThrow();
        double share = (double) top.getValue() / backing.size();
        if (share > threshold) {
            return Optional.of(new SourceDominanceWarning(top.getKey(), share, threshold));
        }
        return Optional.empty();
    }

    public long size() {
        return journal.size();
    }

    private Map<String, ProvenanceRecord> index() {
        Map<String, ProvenanceRecord> byId = new LinkedHashMap<>();
        for (ProvenanceRecord r : journal.readAll()) {
            byId.put(r.id(), r);
        }
        return byId;
    }

    private static String formatId(long sequence) {
        return String.format("PRV-%06d", sequence);
    }

    private static MalformedProvenanceException malformed(String message) {
        return new MalformedProvenanceException(message, List.of(PolicyRefs.PROVENANCE_REQUIRED));
    }
}
