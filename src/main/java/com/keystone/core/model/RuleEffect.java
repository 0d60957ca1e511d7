package com.keystone.core.model;

/**
 * What a policy rule does when one of its triggers matches.
 * <ul>
 *   <li>{@code NONE} - cited by decisions but never matched against text</li>
 *   <li>{@code ELEVATE} - raises risk to at least MEDIUM</li>
 *   <li>{@code IMPACT} - irreversible/financial/legal impact, forces HIGH</li>
 *   <li>{@code CONFLICT} - policy conflict, forces HIGH</li>
 *   <li>{@code BLOCK} - submission is refused outright</li>
 *   <li>{@code HOLD} - compliance holds output until a human approves</li>
 *   <li>{@code PROHIBIT} - compliance rejects output containing the trigger</li>
 * </ul>
 */
public enum RuleEffect {
    NONE,
    ELEVATE,
    IMPACT,
    CONFLICT,
    BLOCK,
    HOLD,
    PROHIBIT
}
