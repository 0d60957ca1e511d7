package com.keystone.core.persistence;

import java.util.List;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Append-only, ordered store of entries grouped by key.
 * <p>
 * Entries are never updated or deleted. Every append receives the next value of
 * a journal-wide sequence; reads return entries in sequence order. A "current"
 * view of mutable state is obtained by appending snapshots and reading the
 * {@link #latest(String) latest} one for a key.
 *
 * @param <T> entry type
 */
public interface Journal<T> {

    /**
     * Appends one entry. The factory receives the sequence number assigned to the
     * entry so that entries can carry their own position. Appends are serialized:
     * no two entries share a sequence and no append is lost under contention.
     *
     * @return the entry as stored
     */
    T append(String key, LongFunction<T> entryForSequence);

    default T append(String key, T entry) {
        return append(key, seq -> entry);
    }

    /**
     * Appends several entries under one key as a unit, with consecutive
     * sequence numbers. Either every entry is stored or none is.
     *
     * @return the entries as stored, in order
     */
    List<T> appendAll(String key, List<LongFunction<T>> entriesForSequence);

    /** All entries in append order. */
    List<T> readAll();

    /** Entries for one key in append order. */
    List<T> read(String key);

    /** The most recent entry for a key. */
    Optional<T> latest(String key);

    /** Distinct keys in order of their first append. */
    List<String> keys();

    /** Number of entries appended so far. */
    long size();
}
