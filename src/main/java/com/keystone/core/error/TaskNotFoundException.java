package com.keystone.core.error;

import java.util.List;

/**
 * No task exists with the requested id.
 */
public class TaskNotFoundException extends GovernanceException {

    public TaskNotFoundException(String message, List<String> policyRefs) {
        super(ErrorKind.NOT_FOUND, message, policyRefs);
    }

    public TaskNotFoundException(String message) {
        this(message, List.of());
    }
}
