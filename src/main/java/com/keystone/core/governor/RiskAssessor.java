package com.keystone.core.governor;

import com.keystone.core.model.Budget;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.RiskTier;
import com.keystone.core.model.RuleEffect;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Assigns a risk tier to a goal.
 * <p>
 * Signals are collected from the current canon: IMPACT and CONFLICT rules imply
 * HIGH, ELEVATE rules imply MEDIUM, and no signal means LOW. The tier is the
 * highest implied tier. If the projected workload then exceeds that tier's
 * budget, the tier is raised by one (capped at HIGH). Signals are reported in
 * the configured precedence order; the first one that implies the final tier is
 * the primary cause.
 */
public class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    private final PolicyView policy;
    private final WorkloadEstimator estimator;
    private final Function<RiskTier, Budget> budgets;
    private final List<SignalKind> precedence;

    public RiskAssessor(PolicyView policy, WorkloadEstimator estimator, Function<RiskTier, Budget> budgets,
                        List<String> precedence) {
        this.policy = policy;
        this.estimator = estimator;
        this.budgets = budgets;
        this.precedence = resolvePrecedence(precedence);
    }

    /**
     * @param projectedSteps     caller's step estimate, or null to use the heuristics
     * @param projectedToolCalls caller's tool-call estimate, or null to use the heuristics
     */
    public RiskAssessment assess(String goal, Integer projectedSteps, Integer projectedToolCalls) {
        List<RiskSignal> signals = new ArrayList<>();
        addRuleSignals(signals, goal, RuleEffect.IMPACT, SignalKind.IRREVERSIBLE_IMPACT, RiskTier.HIGH);
        addRuleSignals(signals, goal, RuleEffect.CONFLICT, SignalKind.POLICY_CONFLICT, RiskTier.HIGH);
        addRuleSignals(signals, goal, RuleEffect.ELEVATE, SignalKind.HEURISTIC, RiskTier.MEDIUM);

        RiskTier base = signals.stream().map(RiskSignal::impliedTier).reduce(RiskTier.LOW, RiskTier::max);

        WorkloadEstimator.Projection estimate = estimator.estimate(goal, base);
        int steps = projectedSteps != null ? projectedSteps : estimate.steps();
        int toolCalls = projectedToolCalls != null ? projectedToolCalls : estimate.toolCalls();
        Budget budget = budgets.apply(base);
        RiskTier tier = base;
        if (steps > budget.maxSteps() || toolCalls > budget.maxToolCalls()) {
            tier = base.raise();
            signals.add(new RiskSignal(SignalKind.BUDGET_BREACH, tier, PolicyRefs.BUDGET_BREACH,
                    String.format("projected %d steps / %d tool calls exceed the %s budget of %d / %d",
                            steps, toolCalls, base, budget.maxSteps(), budget.maxToolCalls())));
        }

        signals.sort(Comparator.comparingInt(s -> precedence.indexOf(s.kind())));
        final RiskTier finalTier = tier;
        RiskSignal primary = signals.stream()
                .filter(s -> s.impliedTier() == finalTier)
                .findFirst()
                .orElse(signals.isEmpty() ? null : signals.get(0));

        List<String> refs = signals.isEmpty()
                ? List.of(PolicyRefs.DEFAULT_LOW)
                : signals.stream().map(RiskSignal::ruleId).distinct().toList();

        String rationale = primary == null
                ? "No risk signal found; default tier LOW"
                : finalTier + " because of " + describe(primary)
                        + (signals.size() > 1 ? " (" + (signals.size() - 1) + " further signal(s))" : "");
        log.debug("Assessed '{}' as {}: {}", goal, finalTier, rationale);
        return new RiskAssessment(finalTier, primary, signals, refs, rationale);
    }

    private void addRuleSignals(List<RiskSignal> signals, String goal, RuleEffect effect, SignalKind kind,
                                RiskTier implied) {
        for (PolicyRule rule : policy.matching(goal, effect)) {
            signals.add(new RiskSignal(kind, implied, rule.id(), "'" + rule.firstMatch(goal) + "'"));
        }
    }

    private static String describe(RiskSignal signal) {
        return switch (signal.kind()) {
            case IRREVERSIBLE_IMPACT -> "irreversible or high-impact wording " + signal.detail() + " (" + signal.ruleId() + ")";
            case POLICY_CONFLICT -> "policy conflict " + signal.detail() + " (" + signal.ruleId() + ")";
            case BUDGET_BREACH -> "budget breach: " + signal.detail() + " (" + signal.ruleId() + ")";
            case HEURISTIC -> "heuristic " + signal.detail() + " (" + signal.ruleId() + ")";
        };
    }

    private static List<SignalKind> resolvePrecedence(List<String> configured) {
        List<SignalKind> order = new ArrayList<>();
        if (configured != null) {
            for (String name : configured) {
                SignalKind kind = SignalKind.valueOf(name.trim().toUpperCase());
                if (!order.contains(kind)) {
                    order.add(kind);
                }
            }
        }
        for (SignalKind kind : SignalKind.values()) {
            if (!order.contains(kind)) {
                order.add(kind);
            }
        }
        return List.copyOf(order);
    }
}
