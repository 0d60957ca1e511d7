package com.keystone.core.config;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.engine.TaskEngine;
import com.keystone.core.episodic.EpisodicHistory;
import com.keystone.core.events.EventBus;
import com.keystone.core.governor.CancellationRegistry;
import com.keystone.core.governor.Governor;
import com.keystone.core.governor.RiskAssessor;
import com.keystone.core.governor.TaskStore;
import com.keystone.core.governor.TransitionTable;
import com.keystone.core.governor.WorkloadEstimator;
import com.keystone.core.graph.PipelineGraph;
import com.keystone.core.llm.LlmContentProducer;
import com.keystone.core.llm.LlmService;
import com.keystone.core.metrics.GovernanceMetrics;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.EpisodeRecord;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.nodes.SettleNode;
import com.keystone.core.nodes.StageNode;
import com.keystone.core.persistence.JournalFactory;
import com.keystone.core.pipeline.ContentProducer;
import com.keystone.core.pipeline.EvidenceSource;
import com.keystone.core.pipeline.ExtractiveContentProducer;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageRunner;
import com.keystone.core.pipeline.stages.ComplianceStage;
import com.keystone.core.pipeline.stages.GatherStage;
import com.keystone.core.pipeline.stages.PlanStage;
import com.keystone.core.pipeline.stages.ProduceStage;
import com.keystone.core.pipeline.stages.ReconcileStage;
import com.keystone.core.pipeline.stages.ReviewStage;
import com.keystone.core.policy.CanonLoader;
import com.keystone.core.policy.PolicyStore;
import com.keystone.core.promotion.PromotionPipeline;
import com.keystone.core.promotion.ProposalQueue;
import com.keystone.core.provenance.ProvenanceLedger;
import com.keystone.core.security.ApprovalTokenService;
import org.bsc.langgraph4j.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Wires the governance core: the journals behind each store, the Governor,
 * the stage pipeline and graph, and the promotion pipeline.
 */
@Configuration
public class GovernanceConfig {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfig.class);

    // ── Stores ───────────────────────────────────────────────────────

    @Bean
    public PolicyStore policyStore(JournalFactory journals, KeystoneProperties props, ResourceLoader resources,
                                   Clock clock) {
        var store = new PolicyStore(journals.create("policy", PolicyRule.class), clock);
        store.seedIfEmpty(CanonLoader.load(resources.getResource(props.getStore().getCanon())));
        return store;
    }

    @Bean
    public ProvenanceLedger provenanceLedger(JournalFactory journals, KeystoneProperties props, Clock clock) {
        return new ProvenanceLedger(journals.create("provenance", ProvenanceRecord.class), clock,
                props.getGovernor().getTimestampSkew());
    }

    @Bean
    public AuditLog auditLog(JournalFactory journals, PolicyStore policy, Clock clock) {
        return new AuditLog(journals.create("audit", AuditEntry.class), policy, clock);
    }

    @Bean
    public EpisodicHistory episodicHistory(JournalFactory journals) {
        return new EpisodicHistory(journals.create("episodes", EpisodeRecord.class));
    }

    @Bean
    public TaskStore taskStore(JournalFactory journals, Clock clock) {
        return new TaskStore(journals.create("tasks", TaskRecord.class),
                journals.create("task_ids", String.class), clock);
    }

    @Bean
    public ProposalQueue proposalQueue(JournalFactory journals) {
        return new ProposalQueue(journals.create("proposals", PromotionProposal.class));
    }

    // ── Governor ─────────────────────────────────────────────────────

    @Bean
    public WorkloadEstimator workloadEstimator() {
        return new WorkloadEstimator();
    }

    @Bean
    public RiskAssessor riskAssessor(PolicyStore policy, WorkloadEstimator estimator, KeystoneProperties props) {
        return new RiskAssessor(policy, estimator, props::budgetFor, props.getGovernor().getRiskPrecedence());
    }

    @Bean
    public TransitionTable transitionTable(Clock clock) {
        return new TransitionTable(clock);
    }

    @Bean
    public CancellationRegistry cancellationRegistry() {
        return new CancellationRegistry();
    }

    @Bean
    public Governor governor(PolicyStore policy, ProvenanceLedger ledger, AuditLog audit, TaskStore tasks,
                             EpisodicHistory episodes, RiskAssessor riskAssessor, TransitionTable transitions,
                             CancellationRegistry cancellations, KeystoneProperties props,
                             GovernanceMetrics metrics, EventBus eventBus, Clock clock) {
        return new Governor(policy, ledger, audit, tasks, episodes, riskAssessor, transitions, cancellations,
                props, metrics, eventBus, clock);
    }

    // ── Stage pipeline ───────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public EvidenceSource evidenceSource() {
        return EvidenceSource.submittedOnly();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentProducer contentProducer(KeystoneProperties props,
                                           ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        String mode = props.getProducer().getMode();
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if ("llm".equalsIgnoreCase(mode) && builder == null) {
            throw new IllegalStateException("keystone.producer.mode=llm but no chat model is configured");
        }
        if (builder != null && !"extractive".equalsIgnoreCase(mode)) {
            log.info("Produce stage uses the configured chat model");
            return new LlmContentProducer(new LlmService(builder));
        }
        log.info("Produce stage uses the extractive producer");
        return new ExtractiveContentProducer();
    }

    @Bean
    public StageRunner stageRunner(ProvenanceLedger ledger, PolicyStore policy, AuditLog audit, TaskStore tasks,
                                   Governor governor, CancellationRegistry cancellations,
                                   GovernanceMetrics metrics, EventBus eventBus) {
        return new StageRunner(ledger, policy, audit, tasks, governor, cancellations, metrics, eventBus);
    }

    @Bean
    public PipelineGraph pipelineGraph(WorkloadEstimator estimator, EvidenceSource evidenceSource,
                                       ContentProducer producer, KeystoneProperties props, StageRunner runner,
                                       Governor governor) throws GraphStateException {
        List<StageNode> nodes = stages(estimator, evidenceSource, producer, props).stream()
                .map(s -> new StageNode(s, runner))
                .toList();
        return new PipelineGraph(nodes, new SettleNode(governor), governor);
    }

    public static List<PipelineStage> stages(WorkloadEstimator estimator, EvidenceSource evidenceSource,
                                      ContentProducer producer, KeystoneProperties props) {
        return List.of(
                new PlanStage(estimator, props.getPipeline().getOutboundMarkers()),
                new GatherStage(evidenceSource),
                new ProduceStage(producer),
                new ReviewStage(props.getGovernor().getDominanceThreshold()),
                new ReconcileStage(props.getGovernor().getMaxRetries()),
                new ComplianceStage());
    }

    @Bean
    public TaskEngine taskEngine(PipelineGraph graph, TaskStore tasks, ExecutorService pipelineExecutor) {
        return new TaskEngine(graph, tasks, pipelineExecutor);
    }

    // ── Promotion ────────────────────────────────────────────────────

    @Bean
    public PromotionPipeline promotionPipeline(EpisodicHistory episodes, ProposalQueue queue, PolicyStore policy,
                                               ApprovalTokenService tokens, AuditLog audit,
                                               GovernanceMetrics metrics, KeystoneProperties props, Clock clock) {
        return new PromotionPipeline(episodes, queue, policy, tokens, audit, metrics, clock,
                props.getPromotion().getMinOccurrences(), props.getPromotion().getProposalTtl());
    }
}
