package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A versioned governance rule held by the Policy Store.
 * <p>
 * Rules are immutable: a change publishes a new version under the same id.
 * Triggers are matched case-insensitively as whole words or phrases.
 *
 * @param id         stable rule identifier, e.g. {@code INV-003}
 * @param kind       value, invariant, heuristic or tradeoff
 * @param text       human-readable rule statement
 * @param version    1-based version, incremented per published change
 * @param triggers   words or phrases the rule reacts to (may be empty)
 * @param effect     what a trigger match means
 * @param createdAt  when this version was published; null on an unpublished draft
 * @param approvedBy approver of this version; null on an unpublished draft
 */
public record PolicyRule(
        String id,
        PolicyKind kind,
        String text,
        int version,
        List<String> triggers,
        RuleEffect effect,
        Instant createdAt,
        String approvedBy
) implements Serializable {

    public PolicyRule {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        effect = effect == null ? RuleEffect.NONE : effect;
    }

    /** An unpublished candidate rule, as drafted by the promotion pipeline. */
    public static PolicyRule draft(PolicyKind kind, String text, List<String> triggers, RuleEffect effect) {
        return new PolicyRule(null, kind, text, 0, triggers, effect, null, null);
    }

    public PolicyRule published(String newId, int newVersion, Instant at, String approver) {
        return new PolicyRule(newId, kind, text, newVersion, triggers, effect, at, approver);
    }

    /** Whether any trigger occurs in {@code subject} as a whole word or phrase. */
    public boolean matches(String subject) {
        return firstMatch(subject) != null;
    }

    /** The first trigger found in {@code subject}, or null. */
    public String firstMatch(String subject) {
        if (subject == null || subject.isBlank() || triggers.isEmpty()) {
            return null;
        }
        String haystack = subject.toLowerCase(Locale.ROOT);
        for (String trigger : triggers) {
            if (trigger == null || trigger.isBlank()) continue;
            Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(trigger.toLowerCase(Locale.ROOT).trim())
                    + "(?![\\p{L}\\p{N}])");
            if (p.matcher(haystack).find()) {
                return trigger;
            }
        }
        return null;
    }
}
