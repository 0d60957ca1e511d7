package com.keystone.core.model;

import java.io.Serializable;

/**
 * Decision written by the Reconcile stage after a review.
 */
public record Reconciliation(ReconcileDecision decision, String reason) implements Serializable {
}
