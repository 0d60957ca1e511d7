package com.keystone.core.error;

import com.keystone.core.model.Stage;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A stage changed task fields outside its declared capabilities. The change is
 * discarded and the task is escalated.
 */
public class AuthorityViolationException extends GovernanceException {

    private final Stage stage;
    private final Set<String> fields;

    public AuthorityViolationException(Stage stage, Set<String> fields, List<String> policyRefs) {
        super(ErrorKind.AUTHORITY_VIOLATION,
                "Stage " + stage + " wrote fields outside its capabilities: " + String.join(", ", new TreeSet<>(fields)),
                policyRefs);
        this.stage = stage;
        this.fields = Set.copyOf(fields);
    }

    public Stage stage() {
        return stage;
    }

    public Set<String> fields() {
        return fields;
    }
}
