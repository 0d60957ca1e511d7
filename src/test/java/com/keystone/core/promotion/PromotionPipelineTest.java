package com.keystone.core.promotion;

import com.keystone.core.GovernanceFixture;
import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.error.ProposalNotFoundException;
import com.keystone.core.error.StateConflictException;
import com.keystone.core.model.EpisodeRecord;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.PromotionProposal;
import com.keystone.core.model.ProposalStatus;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class PromotionPipelineTest {

    private GovernanceFixture fx;
    private PromotionPipeline promotion;

    @BeforeEach
    void setUp() {
        fx = new GovernanceFixture();
        promotion = fx.promotion;
    }

    private void episode(String taskId, String goal, TaskOutcome outcome, String reasonKind) {
        fx.episodes.record(new EpisodeRecord(taskId, goal, RiskTier.LOW, outcome, Stage.COMPLIANCE, reasonKind, 0,
                fx.clock.instant()));
    }

    private PromotionProposal queueChurnProposal() {
        episode("KST-2026-0001", "Summarize churn figures", TaskOutcome.REJECTED, "COMPLIANCE_REJECT");
        episode("KST-2026-0002", "Tabulate churn figures", TaskOutcome.REJECTED, "COMPLIANCE_REJECT");
        return promotion.scanAndQueue().get(0);
    }

    /** Starts both actions together and returns what they threw. */
    private static List<Throwable> race(Runnable first, Runnable second) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (Runnable action : List.of(first, second)) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    action.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            });
            thread.start();
            threads.add(thread);
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join(5_000);
        }
        return failures;
    }

    @Nested
    @DisplayName("scan")
    class Scan {

        @Test
        @DisplayName("drafts one proposal for terms recurring in adverse episodes of distinct tasks")
        void draftsFromRepeatedAdverseEpisodes() {
            episode("KST-2026-0001", "Summarize churn figures", TaskOutcome.REJECTED, "COMPLIANCE_REJECT");
            episode("KST-2026-0002", "Tabulate churn figures", TaskOutcome.REJECTED, "COMPLIANCE_REJECT");
            episode("KST-2026-0003", "Summarize churn figures", TaskOutcome.DONE, "COMPLETED");

            List<PromotionProposal> drafts = promotion.scan(fx.episodes.all(), 2);

            assertEquals(1, drafts.size());
            PromotionProposal draft = drafts.get(0);
            assertEquals(List.of("churn", "figures"), draft.candidate().triggers());
            assertEquals(RuleEffect.ELEVATE, draft.candidate().effect());
            assertEquals(List.of("KST-2026-0001", "KST-2026-0002"), draft.evidence());
            assertTrue(draft.impactAnalysis().startsWith("Would have touched 3 recorded task(s), 2 of them adverse"));
            assertNotNull(draft.rollbackPlan());
        }

        @Test
        @DisplayName("ignores gate escalations, cancellations and terms the canon already covers")
        void ignoresExpectedOutcomes() {
            episode("KST-2026-0001", "Wire vendor money", TaskOutcome.ESCALATED, "HIGH_RISK_GATE");
            episode("KST-2026-0002", "Wire vendor money", TaskOutcome.ESCALATED, "HIGH_RISK_GATE");
            episode("KST-2026-0003", "Collate vendor money", TaskOutcome.REJECTED, "CANCELLED");
            episode("KST-2026-0004", "Collate vendor money", TaskOutcome.REJECTED, "CANCELLED");
            episode("KST-2026-0005", "Transfer money", TaskOutcome.REJECTED, "BUDGET_EXCEEDED");
            episode("KST-2026-0006", "Transfer money", TaskOutcome.REJECTED, "BUDGET_EXCEEDED");

            assertTrue(promotion.scan(fx.episodes.all(), 2).isEmpty());
        }

        @Test
        @DisplayName("one occurrence is not a pattern")
        void singleOccurrence() {
            episode("KST-2026-0001", "Summarize churn figures", TaskOutcome.REJECTED, "COMPLIANCE_REJECT");
            assertTrue(promotion.scan(fx.episodes.all(), 2).isEmpty());
        }

        @Test
        @DisplayName("scanning never touches the policy store")
        void scanIsReadOnly() {
            int before = fx.policy.size();
            queueChurnProposal();
            assertEquals(before, fx.policy.size());
        }

        @Test
        @DisplayName("a second scan does not queue the same triggers again")
        void dedupes() {
            queueChurnProposal();
            assertTrue(promotion.scanAndQueue().isEmpty());
            assertEquals(1, promotion.list().size());
        }
    }

    @Nested
    @DisplayName("approval")
    class Approval {

        @Test
        @DisplayName("a valid token publishes exactly the drafted rule")
        void publishesDraft() {
            PromotionProposal proposal = queueChurnProposal();
            String token = fx.tokens.issue("dana", proposal.id());

            PolicyRule published = promotion.approve(proposal.id(), "dana", token);

            assertEquals("PRM-001", published.id());
            assertEquals(1, published.version());
            assertEquals(proposal.candidate().text(), published.text());
            assertEquals(proposal.candidate().triggers(), published.triggers());
            assertEquals("dana", published.approvedBy());
            assertEquals(published, fx.policy.find("PRM-001").orElseThrow());
            assertEquals(ProposalStatus.APPROVED, promotion.get(proposal.id()).status());
            assertEquals("PROMOTION:APPROVED", fx.auditTrail(proposal.id()).get(1));
        }

        @Test
        @DisplayName("a published rule changes how later goals are assessed")
        void publishedRuleTakesEffect() {
            PromotionProposal proposal = queueChurnProposal();
            promotion.apply(proposal.id(), fx.tokens.issue("dana", proposal.id()));

            assertEquals(RiskTier.MEDIUM, fx.governor.assessRisk("Summarize churn figures", null).tier());
        }

        @Test
        @DisplayName("a token for another approver is refused and audited")
        void wrongApprover() {
            PromotionProposal proposal = queueChurnProposal();
            String token = fx.tokens.issue("mallory", proposal.id());

            assertThrows(ApprovalRequiredException.class, () -> promotion.approve(proposal.id(), "dana", token));

            assertEquals(ProposalStatus.PENDING, promotion.get(proposal.id()).status());
            assertTrue(fx.policy.find("PRM-001").isEmpty());
            assertEquals("PROMOTION:APPROVAL_REFUSED", fx.auditTrail(proposal.id()).get(1));
        }

        @Test
        @DisplayName("a missing token is refused")
        void missingToken() {
            PromotionProposal proposal = queueChurnProposal();
            assertThrows(ApprovalRequiredException.class, () -> promotion.apply(proposal.id(), null));
        }

        @Test
        @DisplayName("unknown proposals are reported as such")
        void unknown() {
            assertThrows(ProposalNotFoundException.class, () -> promotion.apply("PRP-0404", "token"));
        }
    }

    @Nested
    @DisplayName("rejection and expiry")
    class Disposition {

        @Test
        @DisplayName("a rejected proposal never reaches the store and cannot be approved later")
        void rejected() {
            PromotionProposal proposal = queueChurnProposal();

            PromotionProposal rejected = promotion.reject(proposal.id(), "too broad");

            assertEquals(ProposalStatus.REJECTED, rejected.status());
            assertEquals("too broad", rejected.disposition());
            assertTrue(fx.policy.find("PRM-001").isEmpty());
            String token = fx.tokens.issue("dana", proposal.id());
            assertThrows(StateConflictException.class, () -> promotion.approve(proposal.id(), "dana", token));
        }

        @Test
        @DisplayName("rejection needs a reason")
        void reasonRequired() {
            PromotionProposal proposal = queueChurnProposal();
            assertThrows(IllegalArgumentException.class, () -> promotion.reject(proposal.id(), " "));
        }

        @Test
        @DisplayName("pending proposals older than the TTL expire")
        void expires() {
            PromotionProposal proposal = queueChurnProposal();
            fx.clock.advance(Duration.ofDays(13));
            assertTrue(promotion.expireStale().isEmpty());

            fx.clock.advance(Duration.ofDays(2));
            List<PromotionProposal> expired = promotion.expireStale();

            assertEquals(1, expired.size());
            assertEquals(ProposalStatus.EXPIRED, promotion.get(proposal.id()).status());
            assertEquals(List.of(proposal.id()),
                    promotion.list(ProposalStatus.EXPIRED).stream().map(PromotionProposal::id).toList());
        }

        @Test
        @DisplayName("concurrent approve and reject decide the proposal once, consistently with the store")
        void concurrentApproveAndReject() throws Exception {
            PromotionProposal proposal = queueChurnProposal();
            String token = fx.tokens.issue("dana", proposal.id());

            List<Throwable> failures = race(
                    () -> promotion.approve(proposal.id(), "dana", token),
                    () -> promotion.reject(proposal.id(), "too broad"));

            assertEquals(1, failures.size());
            assertInstanceOf(StateConflictException.class, failures.get(0));
            ProposalStatus status = promotion.get(proposal.id()).status();
            assertEquals(status == ProposalStatus.APPROVED, fx.policy.find("PRM-001").isPresent());
            assertEquals(2, fx.proposals.history(proposal.id()).size());
        }

        @Test
        @DisplayName("two concurrent approvals publish one rule")
        void concurrentApprovals() throws Exception {
            PromotionProposal proposal = queueChurnProposal();
            String token = fx.tokens.issue("dana", proposal.id());

            List<Throwable> failures = race(
                    () -> promotion.approve(proposal.id(), "dana", token),
                    () -> promotion.approve(proposal.id(), "dana", token));

            assertEquals(1, failures.size());
            assertInstanceOf(StateConflictException.class, failures.get(0));
            assertTrue(fx.policy.find("PRM-001").isPresent());
            assertTrue(fx.policy.find("PRM-002").isEmpty());
        }

        @Test
        @DisplayName("the queue refuses a second disposition of a decided proposal")
        void queueRefusesRedecision() {
            PromotionProposal proposal = queueChurnProposal();
            PromotionProposal rejected = promotion.reject(proposal.id(), "too broad");

            assertThrows(StateConflictException.class, () -> fx.proposals.update(
                    rejected.decided(ProposalStatus.APPROVED, "late approval", fx.clock.instant())));
            assertEquals(ProposalStatus.REJECTED, promotion.get(proposal.id()).status());
        }

        @Test
        @DisplayName("an expired pattern can be proposed again")
        void requeueAfterExpiry() {
            queueChurnProposal();
            fx.clock.advance(Duration.ofDays(15));
            promotion.expireStale();

            List<PromotionProposal> requeued = promotion.scanAndQueue();

            assertEquals(1, requeued.size());
            assertEquals("PRP-0002", requeued.get(0).id());
        }
    }
}
