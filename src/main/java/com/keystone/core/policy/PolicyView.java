package com.keystone.core.policy;

import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.RuleEffect;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the current canon. Stages and the risk assessor receive
 * this view; only promotion holds the writable {@link PolicyStore}.
 */
public interface PolicyView {

    /** Current version of every rule, ordered by id. */
    List<PolicyRule> rules();

    Optional<PolicyRule> find(String ruleId);

    default boolean exists(String ruleId) {
        return find(ruleId).isPresent();
    }

    /** Current rules with one of the given effects whose triggers match {@code text}. */
    default List<PolicyRule> matching(String text, RuleEffect... effects) {
        List<RuleEffect> wanted = List.of(effects);
        return rules().stream()
                .filter(r -> wanted.contains(r.effect()))
                .filter(r -> r.matches(text))
                .toList();
    }
}
