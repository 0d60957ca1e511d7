package com.keystone.core.health;

import com.keystone.core.audit.AuditLog;
import com.keystone.core.governor.TaskStore;
import com.keystone.core.graph.PipelineGraph;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PipelineGraph pipelineGraph;
    private final PolicyStore policyStore;
    private final TaskStore taskStore;
    private final AuditLog auditLog;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) PipelineGraph pipelineGraph,
            @Autowired(required = false) PolicyStore policyStore,
            @Autowired(required = false) TaskStore taskStore,
            @Autowired(required = false) AuditLog auditLog,
            @Autowired(required = false) DataSource dataSource) {
        this.pipelineGraph = pipelineGraph;
        this.policyStore = policyStore;
        this.taskStore = taskStore;
        this.auditLog = auditLog;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkCanon());
        results.add(checkTasks());
        results.add(checkDatabase());
        return results;
    }

    private HealthStatus checkGraph() {
        if (pipelineGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Pipeline graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Pipeline graph not available", Map.of());
    }

    private HealthStatus checkCanon() {
        if (policyStore == null) {
            return new HealthStatus("canon", HealthStatus.Status.DOWN, "Policy store not available", Map.of());
        }
        int rules = policyStore.size();
        // Refusal and the human-authority value must always be present.
        boolean core = policyStore.exists(PolicyRefs.REFUSAL_IS_VALID) && policyStore.exists(PolicyRefs.HUMAN_AUTHORITY);
        if (rules == 0 || !core) {
            return new HealthStatus("canon", HealthStatus.Status.DOWN,
                    "Canon missing core values (" + rules + " rules)", Map.of("rules", String.valueOf(rules)));
        }
        return new HealthStatus("canon", HealthStatus.Status.UP, rules + " rules loaded",
                Map.of("rules", String.valueOf(rules)));
    }

    private HealthStatus checkTasks() {
        if (taskStore == null) {
            return new HealthStatus("tasks", HealthStatus.Status.DOWN, "Task store not available", Map.of());
        }
        int escalated = taskStore.byOutcome(TaskOutcome.ESCALATED).size();
        String audited = auditLog == null ? "?" : String.valueOf(auditLog.size());
        var metadata = Map.of("escalated", String.valueOf(escalated), "auditEntries", audited);
        if (escalated > 0) {
            return new HealthStatus("tasks", HealthStatus.Status.DEGRADED,
                    escalated + " task(s) waiting for a human decision", metadata);
        }
        return new HealthStatus("tasks", HealthStatus.Status.UP, "No tasks waiting for a human", metadata);
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; journals are in memory", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}
