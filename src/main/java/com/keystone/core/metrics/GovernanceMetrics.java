package com.keystone.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for governance decisions.
 */
@Service
public class GovernanceMetrics {

    private final MeterRegistry registry;

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** @param result {@code admitted} or the error kind of a refused submission */
    public void recordSubmission(String result) {
        Counter.builder("keystone.submissions.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordRiskTier(String tier) {
        Counter.builder("keystone.risk.assignments")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordStageExecution(String stage, String decision, long ms) {
        Timer.builder("keystone.stage.duration")
                .tag("stage", stage)
                .tag("decision", decision)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReviewRetry() {
        Counter.builder("keystone.review.retries")
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String trigger) {
        Counter.builder("keystone.escalations.total")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void recordAuthorityViolation(String stage) {
        Counter.builder("keystone.authority.violations")
                .description("Stage writes outside declared capabilities")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordBudgetBreach(String dimension) {
        Counter.builder("keystone.budget.breaches")
                .tag("dimension", dimension)
                .register(registry)
                .increment();
    }

    public void recordTaskOutcome(String outcome) {
        Counter.builder("keystone.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStepsUsed(int steps) {
        DistributionSummary.builder("keystone.task.steps")
                .description("Stage executions per settled task")
                .register(registry)
                .record(steps);
    }

    public void recordProposal(String status) {
        Counter.builder("keystone.promotion.proposals")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
