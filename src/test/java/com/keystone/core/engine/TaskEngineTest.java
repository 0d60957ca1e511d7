package com.keystone.core.engine;

import com.keystone.core.GovernanceFixture;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.InsufficientProvenanceException;
import com.keystone.core.model.Claim;
import com.keystone.core.model.ComplianceDecision;
import com.keystone.core.model.EscalationDecision;
import com.keystone.core.model.EscalationTrigger;
import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.Stage;
import com.keystone.core.model.SubmitOptions;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.ContentProducer;
import com.keystone.core.pipeline.EvidenceSource;
import com.keystone.core.pipeline.ExtractiveContentProducer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the governed pipeline over in-memory stores.
 */
class TaskEngineTest {

    private GovernanceFixture fx;

    @AfterEach
    void tearDown() {
        if (fx != null) {
            fx.executor.shutdownNow();
        }
    }

    @Nested
    @DisplayName("LOW-risk summary")
    class LowRisk {

        @Test
        @DisplayName("runs Plan, Gather, Produce and Compliance, then completes with a post-hoc audit")
        void completesWithoutReview() {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(),
                    SubmitOptions.defaults());
            assertEquals(RiskTier.LOW, admitted.riskTier());
            assertEquals(TaskOutcome.PENDING, admitted.outcome());

            TaskRecord done = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.DONE, done.outcome());
            assertEquals(Stage.COMPLIANCE, done.currentStage());
            assertNull(done.review(), "LOW tier never runs Review");
            assertEquals(4, done.usage().steps());
            assertTrue(done.output().content().startsWith("Summary"));
            assertEquals(List.of(
                    "GOVERNOR:ADMITTED",
                    "PLAN:PLANNED",
                    "GATHER:GATHERED",
                    "PRODUCE:PRODUCED",
                    "COMPLIANCE:APPROVE",
                    "GOVERNOR:POST_HOC_AUDIT",
                    "GOVERNOR:DONE"), fx.auditTrail(done.id()));
        }

        @Test
        @DisplayName("every audit entry cites rules that exist in the policy store")
        void auditRefsResolve() {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(), null);
            fx.engine.run(admitted.id());

            fx.audit.forSubject(admitted.id()).forEach(entry ->
                    entry.policyRefs().forEach(ref -> assertTrue(fx.policy.exists(ref), ref)));
        }

        @Test
        @DisplayName("records a COMPLETED episode")
        void recordsEpisode() {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(), null);
            fx.engine.run(admitted.id());

            var episodes = fx.episodes.forTask(admitted.id());
            assertEquals(1, episodes.size());
            assertEquals("COMPLETED", episodes.get(0).reasonKind());
            assertFalse(episodes.get(0).adverse());
        }
    }

    @Nested
    @DisplayName("HIGH-risk payment")
    class HighRisk {

        @Test
        @DisplayName("escalates after Gather and completes once a human approves")
        void gatesOnHumanApproval() {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Wire $5,000 payment to the vendor",
                    GovernanceFixture.twoSources(), SubmitOptions.defaults());
            assertEquals(RiskTier.HIGH, admitted.riskTier());
            assertTrue(admitted.riskPolicyRefs().contains("HEU-001"));

            TaskRecord gated = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.ESCALATED, gated.outcome());
            assertEquals(EscalationTrigger.HIGH_RISK_GATE, gated.escalation().trigger());
            assertEquals(Stage.PRODUCE, gated.escalation().resumeStage());
            assertNull(gated.output(), "nothing is produced before approval");

            TaskRecord approved = fx.governor.resolveEscalation(admitted.id(), EscalationDecision.APPROVE,
                    "alice", "vendor verified");
            assertEquals(TaskOutcome.APPROVED, approved.outcome());

            TaskRecord done = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.DONE, done.outcome());
            assertTrue(done.review().passed());
            assertEquals(ComplianceDecision.APPROVE, done.compliance().decision());
            assertTrue(done.compliance().policyRefs().contains("INV-008"));
            assertTrue(fx.auditTrail(done.id()).containsAll(List.of(
                    "GOVERNOR:ESCALATED", "GOVERNOR:ESCALATION_APPROVED", "REVIEW:PASS", "RECONCILE:ACCEPT",
                    "COMPLIANCE:APPROVE", "GOVERNOR:DONE")));
        }

        @Test
        @DisplayName("a human rejection terminates the task")
        void humanRejects() {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Wire $5,000 payment to the vendor",
                    GovernanceFixture.twoSources(), null);
            fx.engine.run(admitted.id());

            TaskRecord rejected = fx.governor.resolveEscalation(admitted.id(), EscalationDecision.REJECT,
                    "alice", "unknown vendor");

            assertEquals(TaskOutcome.REJECTED, rejected.outcome());
            assertEquals(rejected, fx.engine.run(admitted.id()), "settled tasks do not run again");
        }
    }

    @Nested
    @DisplayName("Single-source submissions")
    class SingleSource {

        @Test
        @DisplayName("are refused without an override and create no task")
        void refusedWithoutOverride() {
            fx = new GovernanceFixture();
            var one = List.of(GovernanceFixture.source("vendor-portal", 0.7, "doc://vendor/1"));

            var e = assertThrows(InsufficientProvenanceException.class,
                    () -> fx.governor.submit("Summarize input", one, SubmitOptions.defaults()));

            assertTrue(e.policyRefs().contains("INV-003"));
            assertTrue(fx.tasks.all().isEmpty());
            assertEquals(0, fx.ledger.size(), "refused provenance is not written");
        }

        @Test
        @DisplayName("are admitted with an audited override and complete")
        void admittedWithOverride() {
            fx = new GovernanceFixture();
            var one = List.of(GovernanceFixture.source("vendor-portal", 0.7, "doc://vendor/1"));

            TaskRecord admitted = fx.governor.submit("Summarize input", one,
                    SubmitOptions.singleSource("vendor portal is the only system of record"));
            TaskRecord done = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.DONE, done.outcome());
            assertEquals("vendor portal is the only system of record", done.singleSourceOverride());
            assertTrue(fx.auditTrail(done.id()).contains("GOVERNOR:SINGLE_SOURCE_OVERRIDE"));
        }
    }

    @Nested
    @DisplayName("Unsupported claims")
    class UnsupportedClaims {

        @Test
        @DisplayName("are retried up to the limit and then escalated")
        void escalatesAfterRetryLimit() {
            AtomicInteger calls = new AtomicInteger();
            ContentProducer fabricating = new ContentProducer() {
                @Override
                public ProducedOutput produce(Request request) {
                    calls.incrementAndGet();
                    return new ProducedOutput("Analysis: revenue grew 40% last quarter",
                            List.of(new Claim("revenue grew 40% last quarter", List.of("PRV-999999"))),
                            name(), request.attempt());
                }

                @Override
                public String name() {
                    return "fabricating";
                }
            };
            fx = new GovernanceFixture(fabricating);

            TaskRecord admitted = fx.governor.submit("Analyze quarterly revenue trends",
                    GovernanceFixture.twoSources(), null);
            assertEquals(RiskTier.MEDIUM, admitted.riskTier());

            TaskRecord escalated = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.ESCALATED, escalated.outcome());
            assertEquals(EscalationTrigger.RETRY_LIMIT, escalated.escalation().trigger());
            assertEquals(Stage.COMPLIANCE, escalated.escalation().resumeStage());
            assertEquals(2, escalated.retryCount());
            assertEquals(3, calls.get());
            assertEquals(3, escalated.output().attempt());
            assertEquals(List.of("revenue grew 40% last quarter"), escalated.review().unsupportedClaims());
            assertEquals(3, fx.auditTrail(admitted.id()).stream().filter("REVIEW:UNSUPPORTED_CLAIM"::equals).count());
            assertTrue(escalated.escalation().reason().contains("UNSUPPORTED_CLAIM"));
            assertTrue(escalated.rationale().contains("revenue grew 40% last quarter"));
            String escalationEntry = fx.audit.last(admitted.id()).orElseThrow().rationale();
            assertTrue(escalationEntry.startsWith("RETRY_LIMIT: "));
            assertTrue(escalationEntry.contains("UNSUPPORTED_CLAIM"));
        }
    }

    @Nested
    @DisplayName("Cancellation during a stage")
    class CancelDuringStage {

        private GovernanceFixture cancellingDuringGather() {
            AtomicReference<GovernanceFixture> self = new AtomicReference<>();
            EvidenceSource cancelling = (task, submitted) -> {
                self.get().governor.cancel(task.id(), "vendor withdrew the invoice");
                return EvidenceSource.Gathered.NONE;
            };
            self.set(new GovernanceFixture(new ExtractiveContentProducer(), cancelling, new KeystoneProperties()));
            return self.get();
        }

        @Test
        @DisplayName("a HIGH task cancelled while gathering is rejected instead of escalated")
        void highTaskRejected() {
            fx = cancellingDuringGather();
            TaskRecord admitted = fx.governor.submit("Wire $5,000 payment to the vendor",
                    GovernanceFixture.twoSources(), null);

            TaskRecord settled = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.REJECTED, settled.outcome());
            assertNull(settled.escalation());
            assertTrue(settled.rationale().contains("vendor withdrew the invoice"));
            assertEquals(List.of(
                    "GOVERNOR:ADMITTED",
                    "PLAN:PLANNED",
                    "GOVERNOR:CANCEL_REQUESTED",
                    "GATHER:GATHERED",
                    "GOVERNOR:REJECTED"), fx.auditTrail(admitted.id()));
            assertFalse(fx.cancellations.isRequested(admitted.id()));
            assertEquals("CANCELLED", fx.episodes.forTask(admitted.id()).get(0).reasonKind());
        }

        @Test
        @DisplayName("a LOW task cancelled while gathering stops before Produce")
        void lowTaskStopsAtBoundary() {
            fx = cancellingDuringGather();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(), null);

            TaskRecord settled = fx.engine.run(admitted.id());

            assertEquals(TaskOutcome.REJECTED, settled.outcome());
            assertEquals(Stage.GATHER, settled.currentStage());
            assertNull(settled.output());
            assertFalse(fx.auditTrail(admitted.id()).contains("PRODUCE:PRODUCED"));
            assertFalse(fx.cancellations.isRequested(admitted.id()));
        }
    }

    @Nested
    @DisplayName("Background runs")
    class BackgroundRuns {

        @Test
        @DisplayName("start runs on the executor and await returns the settled task")
        void startAndAwait() throws Exception {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(), null);

            fx.engine.start(admitted.id());
            TaskRecord settled = fx.engine.await(admitted.id(), Duration.ofSeconds(10));

            assertEquals(TaskOutcome.DONE, settled.outcome());
        }

        @Test
        @DisplayName("a second start while running returns the same run")
        void startIsIdempotentWhileRunning() throws Exception {
            fx = new GovernanceFixture();
            TaskRecord admitted = fx.governor.submit("Summarize input", GovernanceFixture.twoSources(), null);

            var first = fx.engine.start(admitted.id());
            var second = fx.engine.start(admitted.id());
            first.get();

            assertTrue(first == second || second.isDone());
            assertEquals(TaskOutcome.DONE, fx.tasks.get(admitted.id()).outcome());
        }
    }
}
