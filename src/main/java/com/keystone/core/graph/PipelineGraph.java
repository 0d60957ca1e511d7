package com.keystone.core.graph;

import com.keystone.core.governor.Governor;
import com.keystone.core.governor.RouteAction;
import com.keystone.core.governor.RouteDecision;
import com.keystone.core.nodes.SettleNode;
import com.keystone.core.nodes.StageNode;
import com.keystone.core.state.TaskState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a
 * task through the stage pipeline.
 * <p>
 * Every stage node is followed by a conditional edge on the Governor's route,
 * so stages never pick their successor:
 * <pre>
 *   START -> [entry stage]
 *   plan | gather | produce | review | reconcile | compliance
 *         -> [routeAfterStage]
 *            -> any stage node            (NEXT_STAGE, incl. retries)
 *            -> settle -> END             (ESCALATE, REJECT, COMPLETE)
 * </pre>
 * A resumed task enters at its current stage.
 */
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    static final String SETTLE = "settle";

    private final CompiledGraph<TaskState> compiledGraph;
    private final Governor governor;

    public PipelineGraph(List<StageNode> stageNodes, SettleNode settleNode, Governor governor)
            throws GraphStateException {
        this.governor = governor;

        Map<String, String> targets = new HashMap<>();
        stageNodes.forEach(n -> targets.put(n.id(), n.id()));
        targets.put(SETTLE, SETTLE);

        var graph = new StateGraph<>(TaskState.SCHEMA, TaskState::new);
        for (StageNode node : stageNodes) {
            graph.addNode(node.id(), node_async(node::apply));
        }
        graph.addNode(SETTLE, node_async(settleNode::apply))
                .addConditionalEdges(START, edge_async(this::routeFromStart), Map.copyOf(targets));
        for (StageNode node : stageNodes) {
            graph.addConditionalEdges(node.id(), edge_async(this::routeAfterStage), Map.copyOf(targets));
        }
        graph.addEdge(SETTLE, END);

        this.compiledGraph = graph.compile();
        log.info("Pipeline graph compiled with {} stage node(s)", stageNodes.size());
    }

    String routeFromStart(TaskState state) {
        return governor.entryStage(state.task()).nodeId();
    }

    String routeAfterStage(TaskState state) {
        RouteDecision route = state.route();
        if (route == null) {
            throw new IllegalStateException("Stage finished without a route for task " + state.task().id());
        }
        return route.action() == RouteAction.NEXT_STAGE ? route.target() : SETTLE;
    }

    public CompiledGraph<TaskState> getCompiledGraph() {
        return compiledGraph;
    }
}
