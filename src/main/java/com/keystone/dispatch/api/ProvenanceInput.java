package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.core.model.ProvenanceRecord;

import java.time.Instant;

/**
 * One supporting source in a task submission.
 *
 * @param source      who or what supplied the fact
 * @param timestamp   when the fact was observed
 * @param confidence  0.0 to 1.0
 * @param contentRef  pointer to the content; nullable
 */
public record ProvenanceInput(
    String source,
    Instant timestamp,
    Double confidence,
    @JsonProperty("content_ref") String contentRef
) {

    public ProvenanceRecord toRecord() {
        return ProvenanceRecord.of(source, timestamp, confidence, contentRef);
    }
}
