package com.keystone.dispatch.api;

import com.keystone.core.audit.AuditQuery;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.service.GovernanceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST controller exporting the audit log.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final GovernanceService governance;

    public AuditController(GovernanceService governance) {
        this.governance = governance;
    }

    /**
     * GET /api/v1/audit?taskId=&from=&to=: Entries in sequence order. Timestamps are ISO-8601 instants.
     */
    @GetMapping
    public List<AuditEntry> export(@RequestParam(required = false) String taskId,
                                   @RequestParam(required = false) String from,
                                   @RequestParam(required = false) String to) {
        return governance.audit(new AuditQuery(taskId, parse(from), parse(to)));
    }

    private static Instant parse(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
