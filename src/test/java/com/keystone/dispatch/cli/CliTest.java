package com.keystone.dispatch.cli;

import com.keystone.core.audit.AuditQuery;
import com.keystone.core.error.ApprovalRequiredException;
import com.keystone.core.error.InsufficientProvenanceException;
import com.keystone.core.error.TaskNotFoundException;
import com.keystone.core.health.HealthCheckService;
import com.keystone.core.health.HealthStatus;
import com.keystone.core.model.*;
import com.keystone.core.service.GovernanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Keystone CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, output and exit codes.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private GovernanceService governance;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        governance = mock(GovernanceService.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    private static TaskRecord task(String id, TaskOutcome outcome, RiskTier tier) {
        return TaskRecord.builder()
                .id(id)
                .goal("Summarize the meeting notes")
                .riskTier(tier)
                .riskRationale("No risk signal matched")
                .outcome(outcome)
                .provenanceIds(List.of("PRV-000001", "PRV-000002"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private CommandLine.IFactory createFactory() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SubmitCommand.class) return (K) new SubmitCommand(governance, clock);
                if (cls == StatusCommand.class) return (K) new StatusCommand(governance);
                if (cls == TasksCommand.class) return (K) new TasksCommand(governance);
                if (cls == ResolveCommand.class) return (K) new ResolveCommand(governance);
                if (cls == CancelCommand.class) return (K) new CancelCommand(governance);
                if (cls == ProposalsCommand.class) return (K) new ProposalsCommand(governance);
                if (cls == TokenCommand.class) return (K) new TokenCommand(governance);
                if (cls == AuditCommand.class) return (K) new AuditCommand(governance);
                if (cls == PolicyCommand.class) return (K) new PolicyCommand(governance);
                if (cls == HealthCommand.class) return (K) new HealthCommand(healthCheckService);
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new KeystoneCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("submit", "status", "tasks", "resolve", "cancel", "proposals",
                    "token", "audit", "policy", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Keystone 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommand fails with usage error")
        void unknownSubcommand() {
            CliResult result = execute("launch");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  submit
    // =====================================================================

    @Nested
    @DisplayName("submit")
    class SubmitTests {

        @Test
        @DisplayName("parses sources and waits for the outcome")
        void submitAndWait() throws Exception {
            when(governance.submit(anyString(), anyList(), any(SubmitOptions.class)))
                    .thenReturn(task("KST-2026-0001", TaskOutcome.APPROVED, RiskTier.LOW));
            when(governance.awaitTask(eq("KST-2026-0001"), any(Duration.class)))
                    .thenReturn(task("KST-2026-0001", TaskOutcome.DONE, RiskTier.LOW));

            CliResult result = execute("submit", "Summarize the meeting notes",
                    "-s", "crm|0.9|doc://notes/1", "-s", "wiki|0.8||2026-03-01T09:00:00Z");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Admitted KST-2026-0001 at LOW risk"));
            assertTrue(result.output().contains("Outcome: DONE"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ProvenanceRecord>> provenance = ArgumentCaptor.forClass(List.class);
            verify(governance).submit(eq("Summarize the meeting notes"), provenance.capture(), any());
            List<ProvenanceRecord> records = provenance.getValue();
            assertEquals(2, records.size());
            assertEquals("doc://notes/1", records.get(0).contentRef());
            assertEquals(NOW, records.get(0).timestamp());
            assertNull(records.get(1).contentRef());
            assertEquals(Instant.parse("2026-03-01T09:00:00Z"), records.get(1).timestamp());
        }

        @Test
        @DisplayName("an escalated outcome exits with 3")
        void escalatedExitCode() throws Exception {
            when(governance.submit(anyString(), anyList(), any(SubmitOptions.class)))
                    .thenReturn(task("KST-2026-0002", TaskOutcome.APPROVED, RiskTier.HIGH));
            when(governance.awaitTask(eq("KST-2026-0002"), any(Duration.class)))
                    .thenReturn(task("KST-2026-0002", TaskOutcome.ESCALATED, RiskTier.HIGH));

            CliResult result = execute("submit", "Wire payment", "-s", "a|0.9", "-s", "b|0.9");

            assertEquals(3, result.exitCode());
        }

        @Test
        @DisplayName("a refused submission prints kind and policy refs and exits with 1")
        void refused() {
            when(governance.submit(anyString(), anyList(), any(SubmitOptions.class)))
                    .thenThrow(new InsufficientProvenanceException("Need at least 2 distinct sources, got 1",
                            List.of("INV-003")));

            CliResult result = execute("submit", "Summarize", "-s", "crm|0.9");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("INSUFFICIENT_PROVENANCE"));
            assertTrue(result.output().contains("INV-003"));
        }

        @Test
        @DisplayName("a malformed source exits with 2 before submitting")
        void malformedSource() {
            CliResult result = execute("submit", "Summarize", "-s", "crm|high");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("not a number"));
            verify(governance, never()).submit(anyString(), anyList(), any());
        }

        @Test
        @DisplayName("--no-wait returns right after admission")
        void noWait() throws Exception {
            when(governance.submit(anyString(), anyList(), any(SubmitOptions.class)))
                    .thenReturn(task("KST-2026-0003", TaskOutcome.APPROVED, RiskTier.LOW));

            CliResult result = execute("submit", "Summarize", "-s", "a|0.9", "-s", "b|0.9", "--no-wait");

            assertEquals(0, result.exitCode());
            verify(governance, never()).awaitTask(anyString(), any());
        }

        @Test
        @DisplayName("a timeout while waiting still exits with 0")
        void timeout() throws Exception {
            when(governance.submit(anyString(), anyList(), any(SubmitOptions.class)))
                    .thenReturn(task("KST-2026-0004", TaskOutcome.APPROVED, RiskTier.LOW));
            when(governance.awaitTask(eq("KST-2026-0004"), any(Duration.class)))
                    .thenThrow(new TimeoutException("still running"));

            CliResult result = execute("submit", "Summarize", "-s", "a|0.9", "-s", "b|0.9", "--timeout", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("keystone status KST-2026-0004"));
        }
    }

    // =====================================================================
    //  status / tasks / cancel / resolve
    // =====================================================================

    @Nested
    @DisplayName("task commands")
    class TaskCommandTests {

        @Test
        @DisplayName("status prints the snapshot and recent decisions")
        void status() {
            TaskRecord t = task("KST-2026-0005", TaskOutcome.DONE, RiskTier.LOW);
            when(governance.task("KST-2026-0005")).thenReturn(t);
            when(governance.status("KST-2026-0005")).thenReturn(new TaskStatusView(t.id(), t.goal(), null,
                    RiskTier.LOW, TaskOutcome.DONE, null, null,
                    List.of(new AuditEntry(4, t.id(), "COMPLIANCE", "APPROVE", "No rule matched",
                            List.of("INV-005"), NOW))));

            CliResult result = execute("status", "KST-2026-0005");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK KST-2026-0005"));
            assertTrue(result.output().contains("PRV-000001, PRV-000002"));
            assertTrue(result.output().contains("Recent decisions:"));
            assertTrue(result.output().contains("No rule matched"));
        }

        @Test
        @DisplayName("status of an unknown task exits with 1")
        void statusUnknown() {
            when(governance.task("KST-2026-9999")).thenThrow(new TaskNotFoundException("Unknown task: KST-2026-9999"));

            CliResult result = execute("status", "KST-2026-9999");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown task"));
        }

        @Test
        @DisplayName("tasks --outcome filters and prints a table")
        void tasksFiltered() {
            when(governance.tasks(Optional.of(TaskOutcome.ESCALATED)))
                    .thenReturn(List.of(task("KST-2026-0006", TaskOutcome.ESCALATED, RiskTier.HIGH)));

            CliResult result = execute("tasks", "--outcome", "ESCALATED");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("KST-2026-0006"));
            assertTrue(result.output().contains("1 task(s) found."));
        }

        @Test
        @DisplayName("tasks with none found says so")
        void tasksEmpty() {
            when(governance.tasks(Optional.empty())).thenReturn(List.of());

            CliResult result = execute("tasks");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No tasks found."));
        }

        @Test
        @DisplayName("cancel passes the reason")
        void cancel() {
            when(governance.cancel("KST-2026-0007", "wrong goal"))
                    .thenReturn(task("KST-2026-0007", TaskOutcome.REJECTED, RiskTier.LOW));

            CliResult result = execute("cancel", "KST-2026-0007", "--reason", "wrong goal");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Cancellation requested for KST-2026-0007"));
        }

        @Test
        @DisplayName("resolve --reject prints the rejected task and exits with 1")
        void resolveReject() {
            when(governance.resolveEscalation("KST-2026-0008", EscalationDecision.REJECT, "carol", null))
                    .thenReturn(task("KST-2026-0008", TaskOutcome.REJECTED, RiskTier.HIGH));

            CliResult result = execute("resolve", "KST-2026-0008", "--reject", "--approver", "carol");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Outcome: REJECTED"));
        }

        @Test
        @DisplayName("resolve --approve waits for the resumed run")
        void resolveApprove() throws Exception {
            when(governance.resolveEscalation("KST-2026-0009", EscalationDecision.APPROVE, "carol", "verified"))
                    .thenReturn(task("KST-2026-0009", TaskOutcome.APPROVED, RiskTier.HIGH));
            when(governance.awaitTask(eq("KST-2026-0009"), any(Duration.class)))
                    .thenReturn(task("KST-2026-0009", TaskOutcome.DONE, RiskTier.HIGH));

            CliResult result = execute("resolve", "KST-2026-0009", "--approve", "--approver", "carol",
                    "--note", "verified");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Approved by carol"));
        }

        @Test
        @DisplayName("resolve requires exactly one of --approve and --reject")
        void resolveNeedsDecision() {
            CliResult result = execute("resolve", "KST-2026-0009", "--approver", "carol");

            assertNotEquals(0, result.exitCode());
            verify(governance, never()).resolveEscalation(anyString(), any(), anyString(), any());
        }
    }

    // =====================================================================
    //  proposals / token / policy / audit
    // =====================================================================

    @Nested
    @DisplayName("governance commands")
    class GovernanceCommandTests {

        private PromotionProposal pending() {
            return new PromotionProposal("PRP-0001",
                    PolicyRule.draft(PolicyKind.HEURISTIC, "Churn reports need review", List.of("churn"),
                            RuleEffect.ELEVATE),
                    List.of("KST-2026-0001", "KST-2026-0002"), "Seen twice", "Raises to MEDIUM",
                    "Supersede with NONE", ProposalStatus.PENDING, null, NOW, null);
        }

        @Test
        @DisplayName("proposals without a subcommand lists pending ones")
        void proposalsDefaultList() {
            when(governance.proposals(Optional.of(ProposalStatus.PENDING))).thenReturn(List.of(pending()));

            CliResult result = execute("proposals");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PRP-0001"));
            assertTrue(result.output().contains("KST-2026-0001, KST-2026-0002"));
        }

        @Test
        @DisplayName("proposals scan reports when nothing recurs")
        void scanNothing() {
            when(governance.scanProposals()).thenReturn(List.of());

            CliResult result = execute("proposals", "scan");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No new recurring patterns found."));
        }

        @Test
        @DisplayName("proposals approve publishes the rule")
        void approve() {
            when(governance.approveProposal("PRP-0001", "dana", "tok"))
                    .thenReturn(pending().candidate().published("PRM-001", 1, NOW, "dana"));

            CliResult result = execute("proposals", "approve", "PRP-0001", "--approver", "dana", "--token", "tok");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Published PRM-001 v1"));
        }

        @Test
        @DisplayName("proposals approve with a bad token exits with 1")
        void approveRefused() {
            when(governance.approveProposal("PRP-0001", "dana", "forged"))
                    .thenThrow(new ApprovalRequiredException("Approval token rejected"));

            CliResult result = execute("proposals", "approve", "PRP-0001", "--approver", "dana", "--token", "forged");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("APPROVAL_REQUIRED"));
        }

        @Test
        @DisplayName("proposals reject requires a reason")
        void rejectNeedsReason() {
            CliResult result = execute("proposals", "reject", "PRP-0001");

            assertNotEquals(0, result.exitCode());
            verify(governance, never()).rejectProposal(anyString(), anyString());
        }

        @Test
        @DisplayName("token prints only the token")
        void token() {
            when(governance.issueApprovalToken("dana", "PRP-0001")).thenReturn("header.payload.signature");

            CliResult result = execute("token", "PRP-0001", "--approver", "dana");

            assertEquals(0, result.exitCode());
            assertEquals("header.payload.signature", result.output().trim());
        }

        @Test
        @DisplayName("policy --history shows every version")
        void policyHistory() {
            when(governance.policyHistory("PRM-001")).thenReturn(List.of(
                    new PolicyRule("PRM-001", PolicyKind.HEURISTIC, "Churn reports need review", 1,
                            List.of("churn"), RuleEffect.ELEVATE, NOW, "dana"),
                    new PolicyRule("PRM-001", PolicyKind.HEURISTIC, "Churn reports need review", 2,
                            List.of("churn"), RuleEffect.NONE, NOW, "erin")));

            CliResult result = execute("policy", "--history", "PRM-001", "-v");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 rule version(s)."));
            assertTrue(result.output().contains("approved by erin"));
        }

        @Test
        @DisplayName("audit passes subject and range to the query")
        void auditRange() {
            when(governance.audit(any())).thenReturn(List.of(
                    new AuditEntry(1, "KST-2026-0001", AuditEntry.GOVERNOR, "ADMITTED", "Two sources",
                            List.of("INV-003"), NOW)));

            CliResult result = execute("audit", "--task", "KST-2026-0001", "--from", "2026-03-01T00:00:00Z");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("1 entry."));
            ArgumentCaptor<AuditQuery> query = ArgumentCaptor.forClass(AuditQuery.class);
            verify(governance).audit(query.capture());
            assertEquals("KST-2026-0001", query.getValue().subjectId());
            assertEquals(Instant.parse("2026-03-01T00:00:00Z"), query.getValue().from());
            assertNull(query.getValue().to());
        }
    }

    // =====================================================================
    //  health
    // =====================================================================

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("a DOWN component exits with 1")
        void downExitsOne() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled", Map.of()),
                    new HealthStatus("database", HealthStatus.Status.DOWN, "Connection refused", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("database: Connection refused"));
            assertTrue(result.output().contains("Overall: DOWN (1 of 2 components)"));
        }

        @Test
        @DisplayName("DEGRADED alone still exits with 0 and --verbose prints metadata")
        void degradedExitsZero() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("tasks", HealthStatus.Status.DEGRADED, "1 escalated task",
                            Map.of("escalated", "1"))));

            CliResult result = execute("health", "--verbose");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("escalated = 1"));
            assertTrue(result.output().contains("1 component(s) need a human"));
        }
    }
}
