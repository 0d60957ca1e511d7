package com.keystone.core.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJournalTest {

    record Entry(long seq, String value) {}

    @Test
    @DisplayName("assigns consecutive sequence numbers and keeps append order")
    void appendsInOrder() {
        var journal = new InMemoryJournal<Entry>("test");

        journal.append("a", seq -> new Entry(seq, "first"));
        journal.append("b", seq -> new Entry(seq, "second"));
        journal.append("a", seq -> new Entry(seq, "third"));

        assertEquals(List.of(1L, 2L, 3L), journal.readAll().stream().map(Entry::seq).toList());
        assertEquals(List.of("first", "third"), journal.read("a").stream().map(Entry::value).toList());
        assertEquals("third", journal.latest("a").orElseThrow().value());
        assertEquals(List.of("a", "b"), journal.keys());
        assertEquals(3, journal.size());
    }

    @Test
    @DisplayName("unknown keys read as empty")
    void unknownKey() {
        var journal = new InMemoryJournal<Entry>("test");

        assertTrue(journal.read("missing").isEmpty());
        assertTrue(journal.latest("missing").isEmpty());
    }

    @Test
    @DisplayName("returned lists are snapshots, not live views")
    void snapshots() {
        var journal = new InMemoryJournal<Entry>("test");
        journal.append("a", new Entry(1, "x"));
        List<Entry> before = journal.readAll();

        journal.append("a", new Entry(2, "y"));

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(new Entry(3, "z")));
    }

    @Test
    @DisplayName("appendAll stores nothing when an entry factory throws")
    void appendAllIsAtomic() {
        var journal = new InMemoryJournal<Entry>("test");
        journal.append("a", seq -> new Entry(seq, "first"));

        assertThrows(IllegalStateException.class, () -> journal.appendAll("a", List.of(
                seq -> new Entry(seq, "second"),
                seq -> {
                    throw new IllegalStateException("boom");
                })));
        List<Entry> stored = journal.appendAll("b", List.of(seq -> new Entry(seq, "x"), seq -> new Entry(seq, "y")));

        assertEquals(List.of(2L, 3L), stored.stream().map(Entry::seq).toList());
        assertEquals(List.of("first"), journal.read("a").stream().map(Entry::value).toList());
        assertEquals(3, journal.size());
    }

    @Test
    @DisplayName("concurrent appends never share or skip a sequence number")
    void concurrentAppends() throws Exception {
        var journal = new InMemoryJournal<Entry>("test");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> seen = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < 400; i++) {
            String key = "k" + (i % 5);
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                seen.add(journal.append(key, seq -> new Entry(seq, key)).seq());
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(400, journal.size());
        assertEquals(400, seen.stream().distinct().count());
        assertEquals(400L, seen.stream().mapToLong(Long::longValue).max().orElseThrow());
    }
}
