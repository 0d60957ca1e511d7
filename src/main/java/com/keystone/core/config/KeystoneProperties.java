package com.keystone.core.config;

import com.keystone.core.model.Budget;
import com.keystone.core.model.RiskTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Governance configuration bound from {@code keystone.*}.
 * <p>
 * Every default here is a working configuration; {@code application.yml}
 * only restates the values operators are expected to tune.
 */
@ConfigurationProperties(prefix = "keystone")
public class KeystoneProperties {

    private Governor governor = new Governor();
    private Budgets budgets = new Budgets();
    private Engine engine = new Engine();
    private Pipeline pipeline = new Pipeline();
    private Promotion promotion = new Promotion();
    private Approval approval = new Approval();
    private Store store = new Store();
    private Producer producer = new Producer();

    public Governor getGovernor() { return governor; }
    public void setGovernor(Governor governor) { this.governor = governor; }
    public Budgets getBudgets() { return budgets; }
    public void setBudgets(Budgets budgets) { this.budgets = budgets; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Promotion getPromotion() { return promotion; }
    public void setPromotion(Promotion promotion) { this.promotion = promotion; }
    public Approval getApproval() { return approval; }
    public void setApproval(Approval approval) { this.approval = approval; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Producer getProducer() { return producer; }
    public void setProducer(Producer producer) { this.producer = producer; }

    /** Budget for the given tier. */
    public Budget budgetFor(RiskTier tier) {
        return switch (tier) {
            case LOW -> budgets.getLow().toBudget();
            case MEDIUM -> budgets.getMedium().toBudget();
            case HIGH -> budgets.getHigh().toBudget();
        };
    }

    public static class Governor {
        /** Distinct sources a submission needs unless the single-source override is used. */
        private int minDistinctSources = 2;
        /** Review retries before Reconcile escalates. */
        private int maxRetries = 2;
        /** Times the Governor re-runs a stage that failed internally before escalating. */
        private int stageFailureRetries = 1;
        /** Share of backing evidence one source may hold before Review warns. */
        private double dominanceThreshold = 0.5;
        /** Provenance timestamps may lie this far in the future (clock skew). */
        private Duration timestampSkew = Duration.ofMinutes(5);
        /** Order in which risk signals are reported; the first present signal is the primary cause. */
        private List<String> riskPrecedence = new ArrayList<>(List.of(
                "IRREVERSIBLE_IMPACT", "POLICY_CONFLICT", "BUDGET_BREACH", "HEURISTIC"));

        public int getMinDistinctSources() { return minDistinctSources; }
        public void setMinDistinctSources(int minDistinctSources) { this.minDistinctSources = minDistinctSources; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getStageFailureRetries() { return stageFailureRetries; }
        public void setStageFailureRetries(int stageFailureRetries) { this.stageFailureRetries = stageFailureRetries; }
        public double getDominanceThreshold() { return dominanceThreshold; }
        public void setDominanceThreshold(double dominanceThreshold) { this.dominanceThreshold = dominanceThreshold; }
        public Duration getTimestampSkew() { return timestampSkew; }
        public void setTimestampSkew(Duration timestampSkew) { this.timestampSkew = timestampSkew; }
        public List<String> getRiskPrecedence() { return riskPrecedence; }
        public void setRiskPrecedence(List<String> riskPrecedence) { this.riskPrecedence = riskPrecedence; }
    }

    public static class Budgets {
        private TierBudget low = new TierBudget(8, 3, Duration.ofSeconds(60));
        private TierBudget medium = new TierBudget(12, 5, Duration.ofSeconds(120));
        private TierBudget high = new TierBudget(16, 8, Duration.ofSeconds(300));

        public TierBudget getLow() { return low; }
        public void setLow(TierBudget low) { this.low = low; }
        public TierBudget getMedium() { return medium; }
        public void setMedium(TierBudget medium) { this.medium = medium; }
        public TierBudget getHigh() { return high; }
        public void setHigh(TierBudget high) { this.high = high; }
    }

    public static class TierBudget {
        private int maxSteps;
        private int maxToolCalls;
        private Duration maxDuration;

        public TierBudget() {
            this(12, 5, Duration.ofSeconds(120));
        }

        public TierBudget(int maxSteps, int maxToolCalls, Duration maxDuration) {
            this.maxSteps = maxSteps;
            this.maxToolCalls = maxToolCalls;
            this.maxDuration = maxDuration;
        }

        public Budget toBudget() {
            return new Budget(maxSteps, maxToolCalls, maxDuration);
        }

        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }
        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }
    }

    public static class Engine {
        /** Tasks executed concurrently; further submissions queue. */
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class Pipeline {
        /** Words marking a goal whose output leaves the system. */
        private List<String> outboundMarkers = new ArrayList<>(List.of(
                "publish", "post", "send", "email", "tweet", "announce", "press", "share", "submit"));

        public List<String> getOutboundMarkers() { return outboundMarkers; }
        public void setOutboundMarkers(List<String> outboundMarkers) { this.outboundMarkers = outboundMarkers; }
    }

    public static class Promotion {
        /** Distinct tasks a pattern must recur in before it is proposed. */
        private int minOccurrences = 2;
        /** Pending proposals older than this expire. */
        private Duration proposalTtl = Duration.ofDays(14);
        /** Run the batch scan on a schedule. */
        private boolean scheduled = false;
        /** Cron for the scheduled scan. */
        private String scanCron = "0 0 3 * * *";

        public int getMinOccurrences() { return minOccurrences; }
        public void setMinOccurrences(int minOccurrences) { this.minOccurrences = minOccurrences; }
        public Duration getProposalTtl() { return proposalTtl; }
        public void setProposalTtl(Duration proposalTtl) { this.proposalTtl = proposalTtl; }
        public boolean isScheduled() { return scheduled; }
        public void setScheduled(boolean scheduled) { this.scheduled = scheduled; }
        public String getScanCron() { return scanCron; }
        public void setScanCron(String scanCron) { this.scanCron = scanCron; }
    }

    public static class Approval {
        /** HMAC secret for approval tokens; at least 32 bytes. */
        private String secret = "keystone-development-secret-change-me-0123456789";
        /** Lifetime of an approval token in seconds. */
        private long expirationSeconds = 900;
        private String issuer = "keystone";

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public long getExpirationSeconds() { return expirationSeconds; }
        public void setExpirationSeconds(long expirationSeconds) { this.expirationSeconds = expirationSeconds; }
        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }
    }

    public static class Store {
        /** {@code jdbc} or {@code memory}. */
        private String type = "jdbc";
        /** Resource location of the bootstrap canon. */
        private String canon = "classpath:canon.yaml";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCanon() { return canon; }
        public void setCanon(String canon) { this.canon = canon; }
    }

    public static class Producer {
        /** {@code extractive}, {@code llm}, or {@code auto} (LLM when a chat model is configured). */
        private String mode = "auto";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }
}
