package com.keystone.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/escalation.
 *
 * @param decision APPROVE or REJECT
 * @param approver identity of the human deciding
 * @param note     optional note recorded in the audit log
 */
public record EscalationRequest(String decision, String approver, String note) {}
