package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A statement inside produced output together with the provenance records it cites.
 */
public record Claim(String text, List<String> provenanceIds) implements Serializable {

    public Claim {
        provenanceIds = provenanceIds == null ? List.of() : List.copyOf(provenanceIds);
    }
}
