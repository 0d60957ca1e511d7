package com.keystone.core.promotion;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.episodic.EpisodicHistory;
import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.error.StateConflictException;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.GovernanceMetrics;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.EpisodeRecord;
import com.keystone.core.model.EscalationTrigger;
import com.keystone.core.model.PolicyKind;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyStore;
import com.keystone.core.security.ApprovalReceipt;
import com.keystone.core.security.ApprovalTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns recurring adverse outcomes into human-reviewable policy proposals.
 * <p>
 * {@link #scan} only drafts; {@link #scanAndQueue} queues new drafts; the
 * Policy Store changes only through {@link #apply} with a verified approval
 * token. Rejections and expiries stay in the queue and are audited.
 * Dispositions run one at a time, so a proposal is decided exactly once and
 * its rule is published only if the approval wins.
 */
public class PromotionPipeline {

    private static final Logger log = LoggerFactory.getLogger(PromotionPipeline.class);

    private static final Set<String> STOPWORDS = Set.of(
            "about", "after", "again", "also", "before", "below", "between", "could", "each", "every",
            "from", "have", "into", "more", "most", "other", "over", "should", "some", "such", "than",
            "that", "their", "them", "then", "there", "these", "they", "this", "those", "through",
            "under", "until", "very", "what", "when", "where", "which", "while", "will", "with",
            "would", "your", "please", "using", "make");

    /** Outcomes that are expected governance, not a pattern worth a rule. */
    private static final Set<String> IGNORED_REASONS = Set.of(
            EscalationTrigger.HIGH_RISK_GATE.name(), "CANCELLED");

    private final EpisodicHistory episodes;
    private final ProposalQueue queue;
    private final PolicyStore policy;
    private final ApprovalTokenService tokens;
    private final AuditLog audit;
    private final GovernanceMetrics metrics;
    private final Clock clock;
    private final int minOccurrences;
    private final Duration proposalTtl;

    public PromotionPipeline(EpisodicHistory episodes, ProposalQueue queue, PolicyStore policy,
                             ApprovalTokenService tokens, AuditLog audit, GovernanceMetrics metrics,
                             Clock clock, int minOccurrences, Duration proposalTtl) {
        this.episodes = episodes;
        this.queue = queue;
        this.policy = policy;
        this.tokens = tokens;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.minOccurrences = minOccurrences;
        this.proposalTtl = proposalTtl;
    }

    /**
     * Drafts proposals from episodic history without queueing them. A pattern is a
     * goal term, not yet covered by any rule trigger, that appears in adverse
     * episodes of at least {@code minOccurrences} distinct tasks with the same
     * reason kind. Terms sharing the same evidence collapse into one proposal.
     */
    public List<PromotionProposal> scan(List<EpisodeRecord> history, int minOccurrences) {
        Set<String> covered = new HashSet<>();
        List<PolicyRule> rules = policy.rules();
        rules.forEach(r -> r.triggers().forEach(t -> covered.add(t.toLowerCase(Locale.ROOT))));

        // reason kind -> term -> tasks
        Map<String, Map<String, Set<String>>> observed = new TreeMap<>();
        for (EpisodeRecord episode : history) {
            if (!episode.adverse() || IGNORED_REASONS.contains(episode.reasonKind())) {
                continue;
            }
            for (String term : terms(episode.goal())) {
                if (covered.contains(term) || rules.stream().anyMatch(r -> r.matches(term))) {
                    continue;
                }
                observed.computeIfAbsent(episode.reasonKind(), k -> new TreeMap<>())
                        .computeIfAbsent(term, k -> new TreeSet<>())
                        .add(episode.taskId());
            }
        }

        List<PromotionProposal> drafts = new ArrayList<>();
        observed.forEach((reason, byTerm) -> {
            Map<Set<String>, List<String>> byEvidence = new LinkedHashMap<>();
            byTerm.forEach((term, tasks) -> {
                if (tasks.size() >= minOccurrences) {
                    byEvidence.computeIfAbsent(tasks, k -> new ArrayList<>()).add(term);
                }
            });
            byEvidence.forEach((tasks, terms) -> drafts.add(draft(reason, terms, tasks, history)));
        });
        return drafts;
    }

    /**
     * Scans the full episodic history and queues drafts whose triggers are not
     * already pending, approved or rejected.
     */
    public synchronized List<PromotionProposal> scanAndQueue() {
        List<PromotionProposal> drafts = scan(episodes.all(), minOccurrences);
        Set<List<String>> known = new HashSet<>();
        queue.all().stream()
                .filter(p -> p.status() != ProposalStatus.EXPIRED)
                .forEach(p -> known.add(p.candidate().triggers()));

        List<PromotionProposal> queued = new ArrayList<>();
        Instant now = clock.instant();
        for (PromotionProposal draft : drafts) {
            if (!known.add(draft.candidate().triggers())) {
                log.debug("Skipping duplicate proposal for triggers {}", draft.candidate().triggers());
                continue;
            }
            PromotionProposal proposal = queue.add(draft, now);
            audit.append(proposal.id(), AuditEntry.PROMOTION, "PROPOSAL_QUEUED", proposal.rationale(),
                    List.of(PolicyRefs.CANON_IMMUTABLE));
            metrics.recordProposal(ProposalStatus.PENDING.name());
            queued.add(proposal);
        }
        log.info("Promotion scan drafted {} proposal(s), queued {}", drafts.size(), queued.size());
        return queued;
    }

    /**
     * Publishes a pending proposal's drafted rule. The approver is the subject of the token.
     *
     * @throws ApprovalRequiredException if the token is missing or invalid for this proposal
     */
    public PolicyRule apply(String proposalId, String approvalToken) {
        return approve(proposalId, null, approvalToken);
    }

    /**
     * Like {@link #apply}, additionally requiring the token to belong to {@code approver}.
     */
    public synchronized PolicyRule approve(String proposalId, String approver, String approvalToken) {
        MdcContext.setProposal(proposalId);
        try {
            PromotionProposal proposal = pending(proposalId);
            ApprovalReceipt receipt;
            try {
                receipt = tokens.verify(approvalToken, proposalId, approver);
            } catch (ApprovalRequiredException e) {
                audit.append(proposalId, AuditEntry.PROMOTION, "APPROVAL_REFUSED", e.getMessage(),
                        List.of(PolicyRefs.CANON_IMMUTABLE));
                throw e;
            }
            PolicyRule published = policy.publish(proposal.candidate(), receipt);
            queue.update(proposal.decided(ProposalStatus.APPROVED,
                    "Approved by " + receipt.approver() + " as " + published.id() + " v" + published.version(),
                    clock.instant()));
            audit.append(proposalId, AuditEntry.PROMOTION, "APPROVED",
                    "Published " + published.id() + " v" + published.version() + " approved by " + receipt.approver()
                            + " (token " + receipt.tokenId() + ")",
                    List.of(PolicyRefs.CANON_IMMUTABLE, PolicyRefs.HUMAN_AUTHORITY));
            metrics.recordProposal(ProposalStatus.APPROVED.name());
            return published;
        } finally {
            MdcContext.clear();
        }
    }

    public synchronized PromotionProposal reject(String proposalId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Rejecting a proposal requires a reason");
        }
        MdcContext.setProposal(proposalId);
        try {
            PromotionProposal proposal = pending(proposalId);
            PromotionProposal rejected = queue.update(
                    proposal.decided(ProposalStatus.REJECTED, reason.trim(), clock.instant()));
            audit.append(proposalId, AuditEntry.PROMOTION, "REJECTED", reason.trim(),
                    List.of(PolicyRefs.CANON_IMMUTABLE, PolicyRefs.HUMAN_AUTHORITY));
            metrics.recordProposal(ProposalStatus.REJECTED.name());
            return rejected;
        } finally {
            MdcContext.clear();
        }
    }

    /** Expires pending proposals older than the TTL. */
    public synchronized List<PromotionProposal> expireStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(proposalTtl);
        List<PromotionProposal> expired = new ArrayList<>();
        for (PromotionProposal proposal : queue.withStatus(ProposalStatus.PENDING)) {
            if (proposal.createdAt().isBefore(cutoff)) {
                String note = "Expired after " + proposalTtl.toDays() + " day(s) without a decision";
                expired.add(queue.update(proposal.decided(ProposalStatus.EXPIRED, note, now)));
                audit.append(proposal.id(), AuditEntry.PROMOTION, "EXPIRED", note,
                        List.of(PolicyRefs.CANON_IMMUTABLE));
                metrics.recordProposal(ProposalStatus.EXPIRED.name());
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} stale proposal(s)", expired.size());
        }
        return expired;
    }

    public List<PromotionProposal> list() {
        return queue.all();
    }

    public List<PromotionProposal> list(ProposalStatus status) {
        return queue.withStatus(status);
    }

    public PromotionProposal get(String proposalId) {
        return queue.get(proposalId);
    }

    private PromotionProposal pending(String proposalId) {
        PromotionProposal proposal = queue.get(proposalId);
        if (!proposal.status().isOpen()) {
            throw new StateConflictException("Proposal " + proposalId + " is " + proposal.status());
        }
        return proposal;
    }

    private PromotionProposal draft(String reason, List<String> terms, Set<String> tasks, List<EpisodeRecord> history) {
        String quoted = String.join("', '", terms);
        String text = "Goals mentioning '" + quoted + "' have repeatedly ended " + reason
                + "; run them at MEDIUM risk or above with full review.";
        PolicyRule candidate = PolicyRule.draft(PolicyKind.HEURISTIC, text, terms, RuleEffect.ELEVATE);

        Set<String> touched = new TreeSet<>();
        Set<String> adverse = new TreeSet<>();
        for (EpisodeRecord episode : history) {
            if (candidate.matches(episode.goal())) {
                touched.add(episode.taskId());
                if (episode.adverse()) {
                    adverse.add(episode.taskId());
                }
            }
        }
        String rationale = tasks.size() + " distinct task(s) mentioning '" + quoted + "' ended " + reason
                + ": " + String.join(", ", tasks);
        String impact = "Would have touched " + touched.size() + " recorded task(s), " + adverse.size()
                + " of them adverse; matching goals are admitted at MEDIUM or above and always pass Review";
        String rollback = "Publish a superseding version of the rule with effect NONE; tasks already admitted"
                + " keep their tier";
        return new PromotionProposal(null, candidate, List.copyOf(tasks), rationale, impact, rollback,
                ProposalStatus.PENDING, null, null, null);
    }

    static List<String> terms(String goal) {
        if (goal == null) {
            return List.of();
        }
        return Arrays.stream(goal.toLowerCase(Locale.ROOT).split("[^\\p{L}]+"))
                .filter(t -> t.length() >= 4)
                .filter(t -> !STOPWORDS.contains(t))
                .distinct()
                .toList();
    }
}
