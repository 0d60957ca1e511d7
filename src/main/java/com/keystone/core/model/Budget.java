package com.keystone.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Resource limits a task runs under, chosen by its risk tier.
 */
public record Budget(int maxSteps, int maxToolCalls, Duration maxDuration) implements Serializable {
}
