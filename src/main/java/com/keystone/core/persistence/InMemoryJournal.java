package com.keystone.core.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongFunction;

/**
 * {@link Journal} kept on the heap. Used in tests and when no database is configured;
 * contents are lost on restart.
 */
public class InMemoryJournal<T> implements Journal<T> {

    private final String name;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<T> entries = new ArrayList<>();
    private final Map<String, List<T>> byKey = new LinkedHashMap<>();

    public InMemoryJournal(String name) {
        this.name = name;
    }

    @Override
    public T append(String key, LongFunction<T> entryForSequence) {
        lock.writeLock().lock();
        try {
            long sequence = entries.size() + 1L;
            T entry = entryForSequence.apply(sequence);
            entries.add(entry);
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<T> appendAll(String key, List<LongFunction<T>> entriesForSequence) {
        lock.writeLock().lock();
        try {
            long first = entries.size() + 1L;
            List<T> built = new ArrayList<>(entriesForSequence.size());
            for (int i = 0; i < entriesForSequence.size(); i++) {
                built.add(entriesForSequence.get(i).apply(first + i));
            }
            if (!built.isEmpty()) {
                entries.addAll(built);
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).addAll(built);
            }
            return List.copyOf(built);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<T> readAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<T> read(String key) {
        lock.readLock().lock();
        try {
            List<T> list = byKey.get(key);
            return list == null ? List.of() : List.copyOf(list);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<T> latest(String key) {
        lock.readLock().lock();
        try {
            List<T> list = byKey.get(key);
            return list == null || list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> keys() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(byKey.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "InMemoryJournal[" + name + "]";
    }
}
