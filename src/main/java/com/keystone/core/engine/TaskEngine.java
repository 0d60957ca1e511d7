package com.keystone.core.engine;

import com.keystone.core.governor.TaskStore;
import com.keystone.core.graph.PipelineGraph;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs tasks through the compiled pipeline graph on the pipeline executor.
 * <p>
 * A task has at most one run in flight. A run ends when the task settles
 * (DONE, REJECTED or ESCALATED); an approved escalation starts a new run from
 * the stage the task resumes at.
 */
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);

    private final PipelineGraph graph;
    private final TaskStore tasks;
    private final ExecutorService executor;
    private final Map<String, CompletableFuture<TaskRecord>> running = new ConcurrentHashMap<>();

    public TaskEngine(PipelineGraph graph, TaskStore tasks, ExecutorService executor) {
        this.graph = graph;
        this.tasks = tasks;
        this.executor = executor;
    }

    /** Starts (or resumes) a task in the background. Returns the in-flight run if one exists. */
    public synchronized CompletableFuture<TaskRecord> start(String taskId) {
        CompletableFuture<TaskRecord> existing = running.get(taskId);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<TaskRecord> future = new CompletableFuture<>();
        running.put(taskId, future);
        executor.execute(() -> {
            try {
                future.complete(run(taskId));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                running.remove(taskId, future);
            }
        });
        return future;
    }

    /**
     * Runs a task on the calling thread until it settles.
     *
     * @return the settled snapshot
     */
    public TaskRecord run(String taskId) {
        MdcContext.setTask(taskId);
        try {
            TaskRecord task = tasks.get(taskId);
            if (!task.outcome().isActive()) {
                log.info("Task {} is {}; nothing to run", taskId, task.outcome());
                return task;
            }
            log.info("Running task {} from {}", taskId, task.currentStage() == null ? "the start" : task.currentStage());
            TaskState state = graph.getCompiledGraph()
                    .invoke(Map.of("task", task))
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for task " + taskId));
            log.info("Task {} settled as {} via {}", taskId, state.task().outcome(), String.join(" -> ", state.trail()));
            return state.task();
        } catch (RuntimeException e) {
            log.error("Pipeline run for task {} aborted: {}", taskId, e.getMessage(), e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public boolean isRunning(String taskId) {
        return running.containsKey(taskId);
    }

    /**
     * Waits for the in-flight run of a task, if any, and returns the latest snapshot.
     */
    public TaskRecord await(String taskId, Duration timeout) throws InterruptedException, TimeoutException {
        CompletableFuture<TaskRecord> future = running.get(taskId);
        if (future != null) {
            try {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                log.warn("Run for task {} ended with an error: {}", taskId, e.getCause().getMessage());
            }
        }
        return tasks.get(taskId);
    }
}
