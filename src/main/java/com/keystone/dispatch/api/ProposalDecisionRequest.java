package com.keystone.dispatch.api;

/**
 * Inbound JSON body for approving or rejecting a promotion proposal.
 * Approval needs {@code approver} and {@code token}; rejection needs {@code reason}.
 */
public record ProposalDecisionRequest(String approver, String token, String reason) {}
