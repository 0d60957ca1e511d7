package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output written by the Produce stage.
 *
 * @param content  the deliverable text
 * @param claims   claims the content makes, each citing provenance
 * @param producer which content producer generated it
 * @param attempt  1 for the first attempt, incremented on each retry
 */
public record ProducedOutput(String content, List<Claim> claims, String producer, int attempt) implements Serializable {

    public ProducedOutput {
        claims = claims == null ? List.of() : List.copyOf(claims);
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
