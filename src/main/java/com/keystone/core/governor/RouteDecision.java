package com.keystone.core.governor;

import com.keystone.core.model.Escalation;
import com.keystone.core.model.Stage;

import java.io.Serializable;
import java.util.List;

/**
 * What the Governor decided should happen after a stage.
 *
 * @param action     next step
 * @param nextStage  stage to run for {@link RouteAction#NEXT_STAGE}
 * @param escalation escalation to open for {@link RouteAction#ESCALATE}
 * @param reason     explanation for REJECT, COMPLETE or a retried stage
 * @param policyRefs rules behind the decision
 * @param kind       machine-readable reason recorded in episodic history, e.g. {@code CANCELLED}
 */
public record RouteDecision(
        RouteAction action,
        Stage nextStage,
        Escalation escalation,
        String reason,
        List<String> policyRefs,
        String kind
) implements Serializable {

    public RouteDecision {
        policyRefs = policyRefs == null ? List.of() : List.copyOf(policyRefs);
    }

    public static RouteDecision next(Stage stage) {
        return new RouteDecision(RouteAction.NEXT_STAGE, stage, null, null, List.of(), null);
    }

    public static RouteDecision retry(Stage stage, String reason, List<String> policyRefs) {
        return new RouteDecision(RouteAction.NEXT_STAGE, stage, null, reason, policyRefs, "RETRY");
    }

    public static RouteDecision escalate(Escalation escalation) {
        return new RouteDecision(RouteAction.ESCALATE, null, escalation, escalation.reason(), escalation.policyRefs(),
                escalation.trigger().name());
    }

    public static RouteDecision reject(String kind, String reason, List<String> policyRefs) {
        return new RouteDecision(RouteAction.REJECT, null, null, reason, policyRefs, kind);
    }

    public static RouteDecision complete(String reason, List<String> policyRefs) {
        return new RouteDecision(RouteAction.COMPLETE, null, null, reason, policyRefs, "COMPLETED");
    }

    /** Graph node that carries out this decision. */
    public String target() {
        return action == RouteAction.NEXT_STAGE ? nextStage.nodeId() : action.name().toLowerCase();
    }
}
