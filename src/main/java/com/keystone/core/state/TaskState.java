package com.keystone.core.state;

import com.keystone.core.governor.RouteDecision;
import com.keystone.core.model.TaskRecord;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph state for one pipeline run.
 * <p>
 * {@code task} always holds the latest persisted snapshot; {@code route} holds
 * the Governor's decision after the last stage. {@code trail} accumulates a
 * {@code STAGE:DECISION} line per executed node.
 */
public class TaskState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            "task", Channels.base((Reducer<TaskRecord>) null),
            "route", Channels.base((Reducer<RouteDecision>) null),
            "trail", Channels.appender(ArrayList::new)
    );

    public TaskState(Map<String, Object> initData) {
        super(initData);
    }

    public TaskRecord task() {
        return this.<TaskRecord>value("task")
                .orElseThrow(() -> new IllegalStateException("Graph state has no task"));
    }

    public RouteDecision route() {
        return this.<RouteDecision>value("route").orElse(null);
    }

    public List<String> trail() {
        return this.<List<String>>value("trail").orElse(List.of());
    }
}
