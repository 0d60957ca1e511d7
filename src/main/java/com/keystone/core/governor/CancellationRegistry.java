package com.keystone.core.governor;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending cancellation requests. The stage runner checks it before and after
 * every stage, so a cancelled task stops at the next stage boundary. The
 * Governor clears any request still pending when a task settles.
 */
public class CancellationRegistry {

    private final ConcurrentHashMap<String, String> requests = new ConcurrentHashMap<>();

    public void request(String taskId, String reason) {
        requests.put(taskId, reason == null || reason.isBlank() ? "no reason given" : reason);
    }

    /** Removes and returns the cancellation reason for a task, if one is pending. */
    public Optional<String> consume(String taskId) {
        return Optional.ofNullable(requests.remove(taskId));
    }

    public boolean isRequested(String taskId) {
        return requests.containsKey(taskId);
    }
}
