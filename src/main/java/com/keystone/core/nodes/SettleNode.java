package com.keystone.core.nodes;

import com.keystone.core.governor.Governor;
import com.keystone.core.governor.RouteDecision;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.state.TaskState;

import java.util.List;
import java.util.Map;

/**
 * Terminal node: applies an ESCALATE, REJECT or COMPLETE route through the
 * Governor so that the outcome, audit entry and episode are written once.
 */
public class SettleNode {

    private final Governor governor;

    public SettleNode(Governor governor) {
        this.governor = governor;
    }

    public Map<String, Object> apply(TaskState state) {
        RouteDecision route = state.route();
        TaskRecord task = state.task();
        if (route == null) {
            throw new IllegalStateException("Task " + task.id() + " reached settle without a route");
        }
        TaskRecord settled = switch (route.action()) {
            case ESCALATE -> governor.escalate(task, route.escalation());
            case REJECT -> governor.reject(task, route.kind(), route.reason(), route.policyRefs());
            case COMPLETE -> governor.complete(task, route);
            case NEXT_STAGE -> throw new IllegalStateException(
                    "Task " + task.id() + " reached settle with a NEXT_STAGE route");
        };
        return Map.of("task", settled, "trail", List.of("SETTLED:" + settled.outcome()));
    }
}
