package com.keystone.core.provenance;

import com.keystone.core.model.Claim;
import com.keystone.core.model.ProvenanceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the Provenance Ledger, handed to pipeline stages.
 */
public interface ProvenanceView {

    Optional<ProvenanceRecord> find(String id);

    /** Records whose content reference equals {@code contentRef}. */
    List<ProvenanceRecord> resolve(String contentRef);

    /**
     * Records backing a claim.
     *
     * @throws com.keystone.core.error.UnsupportedClaimException if none of the cited ids resolve
     */
    List<ProvenanceRecord> resolveClaim(Claim claim);

    /** Records for the given ids, skipping ids that do not resolve. */
    List<ProvenanceRecord> findAll(List<String> ids);
}
