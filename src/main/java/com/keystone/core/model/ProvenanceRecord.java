package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An append-only record of where a piece of information came from.
 *
 * @param id         ledger-assigned identifier; null until appended
 * @param source     origin of the information (document, URL, system)
 * @param timestamp  when the information was observed
 * @param confidence confidence in [0, 1]; null means missing
 * @param contentRef optional locator of the content inside the source
 */
public record ProvenanceRecord(
        String id,
        String source,
        Instant timestamp,
        Double confidence,
        String contentRef
) implements Serializable {

    public static ProvenanceRecord of(String source, Instant timestamp, Double confidence, String contentRef) {
        return new ProvenanceRecord(null, source, timestamp, confidence, contentRef);
    }

    public ProvenanceRecord withId(String newId) {
        return new ProvenanceRecord(newId, source, timestamp, confidence, contentRef);
    }

    /** Source identity used for distinct-source counting and dominance checks. */
    public String sourceKey() {
        return source == null ? "" : source.trim().toLowerCase();
    }
}
