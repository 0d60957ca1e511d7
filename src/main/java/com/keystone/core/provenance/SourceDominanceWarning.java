package com.keystone.core.provenance;

import java.io.Serializable;

/**
 * One source backs more than the allowed share of a conclusion.
 */
public record SourceDominanceWarning(String source, double share, double threshold) implements Serializable {

    public String describe() {
        return String.format("Source '%s' backs %.0f%% of the evidence (threshold %.0f%%)",
                source, share * 100, threshold * 100);
    }
}
