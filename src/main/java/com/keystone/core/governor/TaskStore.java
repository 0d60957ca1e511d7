package com.keystone.core.governor;

import com.keystone.core.error.StateConflictException;
import com.keystone.core.error.TaskNotFoundException;
import com.keystone.core.model.TaskOutcome;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.persistence.Journal;

import java.time.Clock;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Snapshot store for tasks.
 * <p>
 * Every save appends a new snapshot with the next revision; the latest snapshot
 * is the task's current state and earlier ones remain readable. Saves are
 * checked against the stored revision so a stale snapshot cannot overwrite a
 * newer one.
 * <p>
 * Task ids are reserved in their own journal when issued. A refused submission
 * is audited under its id without ever creating a task, so the reservation is
 * what keeps that id from being issued again after a restart.
 */
public class TaskStore {

    private static final Pattern TASK_ID = Pattern.compile("KST-\\d{4}-(\\d+)");

    private final Journal<TaskRecord> journal;
    private final Journal<String> reservedIds;
    private final Clock clock;
    private final AtomicInteger counter;

    public TaskStore(Journal<TaskRecord> journal, Journal<String> reservedIds, Clock clock) {
        this.journal = journal;
        this.reservedIds = reservedIds;
        this.clock = clock;
        this.counter = new AtomicInteger(highestIssued());
    }

    /**
     * Reserves the next task id in {@code KST-YYYY-NNNN} format. The counter
     * starts after the highest id ever reserved, so ids stay unique across
     * restarts whether or not the submission was admitted.
     */
    public synchronized String nextId() {
        int year = Year.now(clock.withZone(ZoneOffset.UTC)).getValue();
        String id;
        do {
            id = String.format("KST-%d-%04d", year, counter.incrementAndGet());
        } while (journal.latest(id).isPresent() || reservedIds.latest(id).isPresent());
        return reservedIds.append(id, id);
    }

    /** Stores the first snapshot of a new task. */
    public synchronized TaskRecord create(TaskRecord task) {
        if (journal.latest(task.id()).isPresent()) {
            throw new StateConflictException("Task " + task.id() + " already exists");
        }
        TaskRecord first = task.toBuilder()
                .revision(1)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        return journal.append(first.id(), first);
    }

    /**
     * Appends a new snapshot. The given task must carry the current revision.
     *
     * @return the stored snapshot with its new revision
     */
    public synchronized TaskRecord save(TaskRecord task) {
        TaskRecord current = get(task.id());
        if (current.revision() != task.revision()) {
            throw new StateConflictException("Task " + task.id() + " was modified concurrently (expected revision "
                    + task.revision() + ", found " + current.revision() + ")");
        }
        TaskRecord next = task.toBuilder()
                .revision(current.revision() + 1)
                .updatedAt(clock.instant())
                .build();
        return journal.append(next.id(), next);
    }

    public Optional<TaskRecord> find(String taskId) {
        return taskId == null ? Optional.empty() : journal.latest(taskId);
    }

    public TaskRecord get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    /** Every snapshot of a task, oldest first. */
    public List<TaskRecord> history(String taskId) {
        return journal.read(taskId);
    }

    /** Current snapshot of every task, in creation order. */
    public List<TaskRecord> all() {
        return journal.keys().stream()
                .map(journal::latest)
                .flatMap(Optional::stream)
                .toList();
    }

    public List<TaskRecord> byOutcome(TaskOutcome outcome) {
        return all().stream().filter(t -> t.outcome() == outcome).toList();
    }

    private int highestIssued() {
        return Stream.concat(reservedIds.keys().stream(), journal.keys().stream())
                .map(TASK_ID::matcher)
                .filter(Matcher::matches)
                .mapToInt(m -> Integer.parseInt(m.group(1)))
                .max()
                .orElse(0);
    }
}
