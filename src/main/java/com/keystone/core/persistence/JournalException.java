package com.keystone.core.persistence;

/**
 * Thrown when a journal cannot read or write its backing store.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
