package com.keystone.dispatch.api;

import com.keystone.core.model.PolicyRule;
import com.keystone.core.service.GovernanceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the Policy Store. Rules change only through approved proposals.
 */
@RestController
@RequestMapping("/api/v1/policy")
public class PolicyController {

    private final GovernanceService governance;

    public PolicyController(GovernanceService governance) {
        this.governance = governance;
    }

    @GetMapping
    public List<PolicyRule> rules() {
        return governance.policy();
    }

    @GetMapping("/{id}/history")
    public List<PolicyRule> history(@PathVariable String id) {
        return governance.policyHistory(id);
    }
}
