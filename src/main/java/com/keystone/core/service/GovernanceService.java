package com.keystone.core.service;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.audit.AuditQuery;
import com.keystone.core.engine.TaskEngine;
import com.keystone.core.governor.Governor;
import com.keystone.core.governor.TaskStore;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.model.TaskStatusView;
import com.keystone.core.policy.PolicyStore;
import com.keystone.core.promotion.PromotionPipeline;
import com.keystone.core.provenance.ProvenanceLedger;
import com.keystone.core.security.ApprovalTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point used by the REST controllers and CLI commands.
 * <p>
 * Admission and escalation decisions go to the {@link Governor}; accepted and
 * approved tasks are handed to the {@link TaskEngine}, which runs them in the
 * background.
 */
@Service
public class GovernanceService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final Governor governor;
    private final TaskEngine engine;
    private final TaskStore tasks;
    private final AuditLog audit;
    private final PolicyStore policy;
    private final ProvenanceLedger ledger;
    private final PromotionPipeline promotion;
    private final ApprovalTokenService tokens;

    public GovernanceService(Governor governor, TaskEngine engine, TaskStore tasks, AuditLog audit,
                             PolicyStore policy, ProvenanceLedger ledger, PromotionPipeline promotion,
                             ApprovalTokenService tokens) {
        this.governor = governor;
        this.engine = engine;
        this.tasks = tasks;
        this.audit = audit;
        this.policy = policy;
        this.ledger = ledger;
        this.promotion = promotion;
        this.tokens = tokens;
    }

    // ── Tasks ────────────────────────────────────────────────────────

    /** Admits a goal and starts its pipeline. Refused submissions throw and start nothing. */
    public TaskRecord submit(String goal, List<ProvenanceRecord> provenance, SubmitOptions options) {
        TaskRecord task = governor.submit(goal, provenance, options);
        engine.start(task.id());
        return task;
    }

    public TaskStatusView status(String taskId) {
        return governor.status(taskId);
    }

    public TaskRecord task(String taskId) {
        return tasks.get(taskId);
    }

    public List<TaskRecord> tasks(Optional<TaskOutcome> outcome) {
        return outcome.map(tasks::byOutcome).orElseGet(tasks::all);
    }

    /** Records a human decision; an approved task resumes in the background. */
    public TaskRecord resolveEscalation(String taskId, EscalationDecision decision, String approver, String note) {
        TaskRecord resolved = governor.resolveEscalation(taskId, decision, approver, note);
        if (resolved.outcome() == TaskOutcome.APPROVED) {
            engine.start(taskId);
        }
        return resolved;
    }

    public TaskRecord cancel(String taskId, String reason) {
        return governor.cancel(taskId, reason);
    }

    /** Waits for the task's current run, then returns its latest snapshot. */
    public TaskRecord awaitTask(String taskId, Duration timeout) throws InterruptedException, TimeoutException {
        return engine.await(taskId, timeout);
    }

    public Optional<ProvenanceRecord> provenance(String id) {
        return ledger.find(id);
    }

    // ── Audit & policy ───────────────────────────────────────────────

    public List<AuditEntry> audit(AuditQuery query) {
        return audit.query(query);
    }

    public List<PolicyRule> policy() {
        return policy.rules();
    }

    public List<PolicyRule> policyHistory(String ruleId) {
        return policy.history(ruleId);
    }

    // ── Promotion ────────────────────────────────────────────────────

    public List<PromotionProposal> proposals(Optional<ProposalStatus> status) {
        return status.map(s -> promotion.list(s)).orElseGet(() -> promotion.list());
    }

    public PromotionProposal proposal(String proposalId) {
        return promotion.get(proposalId);
    }

    /** Expires stale proposals, then queues new ones from episodic history. */
    public List<PromotionProposal> scanProposals() {
        promotion.expireStale();
        return promotion.scanAndQueue();
    }

    public PolicyRule approveProposal(String proposalId, String approver, String approvalToken) {
        PolicyRule rule = promotion.approve(proposalId, approver, approvalToken);
        log.info("Proposal {} published as {} v{}", proposalId, rule.id(), rule.version());
        return rule;
    }

    public PromotionProposal rejectProposal(String proposalId, String reason) {
        return promotion.reject(proposalId, reason);
    }

    public String issueApprovalToken(String approver, String proposalId) {
        promotion.get(proposalId);
        return tokens.issue(approver, proposalId);
    }
}
