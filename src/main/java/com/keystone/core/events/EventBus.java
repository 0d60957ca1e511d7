package com.keystone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory pub/sub of governance events, keyed by task or proposal id.
 * <p>
 * The bus remembers the most recent events of the most recently active
 * subjects, so a subscriber that joins mid-run (or after the task settled) can
 * replay what it missed. Replay and registration happen under the same lock as
 * recording, so a replaying subscriber sees every event exactly once. A
 * failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_EVENTS_PER_SUBJECT = 64;
    static final int DEFAULT_SUBJECTS_RETAINED = 512;

    private final int eventsPerSubject;
    private final Object lock = new Object();
    private final Map<String, List<Consumer<GovernanceEvent>>> subscribers = new HashMap<>();
    private final LinkedHashMap<String, Deque<GovernanceEvent>> recent;

    public EventBus() {
        this(DEFAULT_EVENTS_PER_SUBJECT, DEFAULT_SUBJECTS_RETAINED);
    }

    public EventBus(int eventsPerSubject, int subjectsRetained) {
        if (eventsPerSubject < 1 || subjectsRetained < 1) {
            throw new IllegalArgumentException("Event history bounds must be positive");
        }
        this.eventsPerSubject = eventsPerSubject;
        this.recent = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<GovernanceEvent>> eldest) {
                return size() > subjectsRetained;
            }
        };
    }

    public void publish(GovernanceEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.subjectId());
        List<Consumer<GovernanceEvent>> targets;
        synchronized (lock) {
            Deque<GovernanceEvent> history = recent.computeIfAbsent(event.subjectId(), k -> new ArrayDeque<>());
            history.addLast(event);
            if (history.size() > eventsPerSubject) {
                history.removeFirst();
            }
            List<Consumer<GovernanceEvent>> subs = subscribers.get(event.subjectId());
            targets = subs == null ? List.of() : List.copyOf(subs);
        }
        for (Consumer<GovernanceEvent> subscriber : targets) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one task or proposal from now on.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String subjectId, Consumer<GovernanceEvent> consumer) {
        synchronized (lock) {
            return register(subjectId, consumer);
        }
    }

    /**
     * Delivers the subject's remembered events to {@code consumer}, oldest
     * first, then subscribes it to new ones.
     */
    public Subscription subscribeWithReplay(String subjectId, Consumer<GovernanceEvent> consumer) {
        synchronized (lock) {
            Deque<GovernanceEvent> history = recent.get(subjectId);
            if (history != null) {
                for (GovernanceEvent event : history) {
                    deliverSafely(consumer, event);
                }
            }
            return register(subjectId, consumer);
        }
    }

    /** The remembered events of one subject, oldest first. */
    public List<GovernanceEvent> recent(String subjectId) {
        synchronized (lock) {
            Deque<GovernanceEvent> history = recent.get(subjectId);
            return history == null ? List.of() : List.copyOf(history);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(String subjectId, Consumer<GovernanceEvent> consumer) {
        subscribers.computeIfAbsent(subjectId, k -> new ArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", subjectId);
        return () -> {
            synchronized (lock) {
                List<Consumer<GovernanceEvent>> subs = subscribers.get(subjectId);
                if (subs != null) {
                    subs.remove(consumer);
                    if (subs.isEmpty()) {
                        subscribers.remove(subjectId);
                    }
                }
            }
        };
    }

    private void deliverSafely(Consumer<GovernanceEvent> subscriber, GovernanceEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
