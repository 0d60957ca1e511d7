package com.keystone.core.policy;

import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.persistence.Journal;
import com.keystone.core.security.ApprovalReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned store of governance rules.
 * <p>
 * The store is seeded once from the bootstrap canon and afterwards changes only
 * through {@link #publish}, which requires an {@link ApprovalReceipt} obtained
 * from a verified human approval token. Every version is kept; {@link #rules()}
 * returns the latest version of each rule.
 */
public class PolicyStore implements PolicyView {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private static final String PROMOTED_PREFIX = "PRM-";

    private final Journal<PolicyRule> journal;
    private final Clock clock;

    public PolicyStore(Journal<PolicyRule> journal, Clock clock) {
        this.journal = journal;
        this.clock = clock;
    }

    /**
     * Loads the bootstrap canon into an empty store. A no-op when the store
     * already holds rules.
     *
     * @return true if the canon was written
     */
    public synchronized boolean seedIfEmpty(List<PolicyRule> canon) {
        if (journal.size() > 0) {
            log.info("Policy store already holds {} rule versions; canon bootstrap skipped", journal.size());
            return false;
        }
        var receipt = ApprovalReceipt.bootstrap(clock.instant());
        for (PolicyRule rule : canon) {
            if (rule.id() == null || rule.id().isBlank()) {
                throw new IllegalArgumentException("Canon rule without id: " + rule.text());
            }
            journal.append(rule.id(), rule.published(rule.id(), 1, receipt.issuedAt(), receipt.approver()));
        }
        log.info("Seeded policy store with {} canon rules", canon.size());
        return true;
    }

    /**
     * Publishes a rule. A draft without id receives a new {@code PRM-nnn} id and
     * version 1; a rule with an existing id is published as the next version.
     *
     * @throws ApprovalRequiredException when no receipt is supplied
     */
    public synchronized PolicyRule publish(PolicyRule draft, ApprovalReceipt receipt) {
        if (receipt == null || receipt.approver() == null || receipt.approver().isBlank()) {
            throw new ApprovalRequiredException("Publishing a policy rule requires a verified human approval",
                    List.of(PolicyRefs.CANON_IMMUTABLE));
        }
        String id = draft.id() != null && !draft.id().isBlank() ? draft.id() : nextPromotedId();
        int version = journal.latest(id).map(PolicyRule::version).orElse(0) + 1;
        PolicyRule published = draft.published(id, version, clock.instant(), receipt.approver());
        journal.append(id, published);
        log.info("Published policy rule {} v{} approved by {}", id, version, receipt.approver());
        return published;
    }

    @Override
    public List<PolicyRule> rules() {
        Map<String, PolicyRule> latest = new LinkedHashMap<>();
        for (PolicyRule rule : journal.readAll()) {
            latest.put(rule.id(), rule);
        }
        return latest.values().stream()
                .sorted(Comparator.comparing(PolicyRule::id))
                .toList();
    }

    @Override
    public Optional<PolicyRule> find(String ruleId) {
        return ruleId == null ? Optional.empty() : journal.latest(ruleId);
    }

    /** Every published version of a rule, oldest first. */
    public List<PolicyRule> history(String ruleId) {
        return journal.read(ruleId);
    }

    public int size() {
        return journal.keys().size();
    }

    private String nextPromotedId() {
        long promoted = journal.keys().stream().filter(k -> k.startsWith(PROMOTED_PREFIX)).count();
        return PROMOTED_PREFIX + String.format("%03d", promoted + 1);
    }
}
