package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the Review stage.
 *
 * @param passed            whether the output may proceed
 * @param requiredChanges   what must change before the output passes
 * @param unsupportedClaims claims with no resolvable provenance
 * @param warnings          non-blocking findings (e.g. source dominance)
 */
public record ReviewVerdict(
        boolean passed,
        List<String> requiredChanges,
        List<String> unsupportedClaims,
        List<String> warnings
) implements Serializable {

    public ReviewVerdict {
        requiredChanges = requiredChanges == null ? List.of() : List.copyOf(requiredChanges);
        unsupportedClaims = unsupportedClaims == null ? List.of() : List.copyOf(unsupportedClaims);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
