package com.keystone.dispatch.api;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.GovernanceEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each client connection subscribes to one task's events, starting with a
 * replay of the events the bus still remembers. The emitter is completed when
 * the task settles, and heartbeat comments keep idle connections open through
 * proxies while a task waits in a stage.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    /** Events after which no more events follow for the current run. */
    private static final Set<String> SETTLING_EVENTS = Set.of("task.completed", "task.rejected", "task.escalated");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's completion/error callbacks remove the registration
                log.debug("Heartbeat skipped for task {}: {}", registration.taskId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given task. The task's
     * remembered events are replayed first; if the last of them settled the
     * task, the stream ends right after the replay.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for task {}: {}", taskId, e.getMessage());
        }

        TaskStream stream = new TaskStream(emitter);
        EventBus.Subscription subscription = eventBus.subscribeWithReplay(taskId, stream);
        var registration = new EmitterRegistration(taskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        int replayed = stream.goLive();
        log.info("SSE emitter created for task {} (replayed={}, timeout={}ms)", taskId, replayed, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static boolean settles(GovernanceEvent event) {
        return SETTLING_EVENTS.contains(event.eventType());
    }

    private static void send(SseEmitter emitter, GovernanceEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", event.subjectId());
            if (event.stage() != null) {
                data.put("stage", event.stage());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for task {}: {}",
                    event.eventType(), event.subjectId(), e.getMessage());
        }
    }

    /**
     * Forwards one task's events to its emitter. While replaying, a settling
     * event does not end the stream, since a later event may have resumed the
     * task; {@link #goLive} decides from the last replayed event instead.
     */
    private static final class TaskStream implements Consumer<GovernanceEvent> {

        private final SseEmitter emitter;
        private boolean replaying = true;
        private int replayed;
        private GovernanceEvent last;

        TaskStream(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public synchronized void accept(GovernanceEvent event) {
            send(emitter, event);
            if (replaying) {
                replayed++;
                last = event;
            } else if (settles(event)) {
                emitter.complete();
            }
        }

        synchronized int goLive() {
            replaying = false;
            if (last != null && settles(last)) {
                emitter.complete();
            }
            return replayed;
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
