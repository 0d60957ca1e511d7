package com.keystone.core.persistence;

/**
 * Creates the journals behind the governance stores. One implementation per
 * backing store; chosen once at startup by {@link StoreConfig}.
 */
public interface JournalFactory {

    <T> Journal<T> create(String name, Class<T> type);

    /** Heap-backed journals, for tests and database-less runs. */
    static JournalFactory inMemory() {
        return new JournalFactory() {
            @Override
            public <T> Journal<T> create(String name, Class<T> type) {
                return new InMemoryJournal<>(name);
            }
        };
    }
}
