package com.keystone.dispatch.api;

import com.keystone.core.model.PolicyKind;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.service.GovernanceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PolicyController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PolicyControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GovernanceService governance;

    @Test
    @DisplayName("GET /policy lists the current rules with their effects")
    void listRules() throws Exception {
        when(governance.policy()).thenReturn(List.of(
                new PolicyRule("INV-012", PolicyKind.INVARIANT, "Never handle credentials", 1,
                        List.of("password", "api key"), RuleEffect.PROHIBIT, NOW, "canon"),
                new PolicyRule("HEU-005", PolicyKind.HEURISTIC, "Default to LOW", 1,
                        List.of(), RuleEffect.NONE, NOW, "canon")));

        mockMvc.perform(get("/api/v1/policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("INV-012"))
                .andExpect(jsonPath("$[0].effect").value("PROHIBIT"))
                .andExpect(jsonPath("$[1].kind").value("HEURISTIC"));
    }

    @Test
    @DisplayName("GET /policy/{id}/history returns every version in order")
    void history() throws Exception {
        when(governance.policyHistory("PRM-001")).thenReturn(List.of(
                new PolicyRule("PRM-001", PolicyKind.HEURISTIC, "Churn reports need review", 1,
                        List.of("churn"), RuleEffect.ELEVATE, NOW, "dana"),
                new PolicyRule("PRM-001", PolicyKind.HEURISTIC, "Churn reports need review", 2,
                        List.of("churn"), RuleEffect.NONE, NOW.plusSeconds(60), "erin")));

        mockMvc.perform(get("/api/v1/policy/PRM-001/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version").value(1))
                .andExpect(jsonPath("$[1].version").value(2))
                .andExpect(jsonPath("$[1].approvedBy").value("erin"));
    }
}
