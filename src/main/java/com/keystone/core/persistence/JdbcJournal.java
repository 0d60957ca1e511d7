package com.keystone.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;
import java.util.regex.Pattern;

/**
 * JDBC-backed {@link Journal} storing each entry as a JSON row.
 * <p>
 * Each journal owns one table {@code ks_<name>} keyed by a sequence number
 * assigned under a process-wide lock, so a single Keystone instance is the only
 * writer. The table is created automatically via {@link #createTable()}.
 * Works against H2 (default, file-backed) and PostgreSQL.
 */
public class JdbcJournal<T> implements Journal<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcJournal.class);

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]{0,40}");

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq         BIGINT       NOT NULL PRIMARY KEY,
                entry_key   VARCHAR(255) NOT NULL,
                payload     TEXT         NOT NULL,
                recorded_at TIMESTAMP    DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_INDEX_SQL = "CREATE INDEX IF NOT EXISTS %s_key_idx ON %s (entry_key, seq)";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final String table;
    private final ReentrantLock appendLock = new ReentrantLock();
    private long lastSequence = -1;

    public JdbcJournal(DataSource dataSource, ObjectMapper objectMapper, String name, Class<T> type) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid journal name: " + name);
        }
        this.table = "ks_" + name;
    }

    /**
     * Object mapper used for journal payloads when none is supplied by Spring:
     * ISO-8601 timestamps, record support, lenient on unknown fields.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates the journal table and its key index if they do not exist.
     * Should be called once during startup.
     */
    public void createTable() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement create = conn.prepareStatement(CREATE_TABLE_SQL.formatted(table));
             PreparedStatement index = conn.prepareStatement(CREATE_INDEX_SQL.formatted(table, table))) {
            create.execute();
            index.execute();
            log.info("Journal table '{}' ensured", table);
        } catch (SQLException e) {
            throw new JournalException("Failed to create journal table " + table, e);
        }
    }

    @Override
    public T append(String key, LongFunction<T> entryForSequence) {
        appendLock.lock();
        try {
            long sequence = currentSequence() + 1;
            T entry = entryForSequence.apply(sequence);
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement stmt = conn.prepareStatement(
                         "INSERT INTO " + table + " (seq, entry_key, payload) VALUES (?, ?, ?)")) {
                stmt.setLong(1, sequence);
                stmt.setString(2, key);
                stmt.setString(3, objectMapper.writeValueAsString(entry));
                stmt.executeUpdate();
            } catch (SQLException e) {
                throw new JournalException("Failed to append to " + table + " for key '" + key + "'", e);
            } catch (JsonProcessingException e) {
                throw new JournalException("Failed to serialize " + type.getSimpleName() + " for " + table, e);
            }
            lastSequence = sequence;
            return entry;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Inserts the entries in one transaction, so a failure part way leaves the
     * table as it was and the sequence unchanged.
     */
    @Override
    public List<T> appendAll(String key, List<LongFunction<T>> entriesForSequence) {
        if (entriesForSequence.isEmpty()) {
            return List.of();
        }
        appendLock.lock();
        try {
            long first = currentSequence() + 1;
            List<T> built = new ArrayList<>(entriesForSequence.size());
            try (Connection conn = dataSource.getConnection()) {
                boolean autoCommit = conn.getAutoCommit();
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO " + table + " (seq, entry_key, payload) VALUES (?, ?, ?)")) {
                    for (int i = 0; i < entriesForSequence.size(); i++) {
                        long sequence = first + i;
                        T entry = entriesForSequence.get(i).apply(sequence);
                        stmt.setLong(1, sequence);
                        stmt.setString(2, key);
                        stmt.setString(3, objectMapper.writeValueAsString(entry));
                        stmt.addBatch();
                        built.add(entry);
                    }
                    stmt.executeBatch();
                    conn.commit();
                } catch (SQLException e) {
                    throw rollback(conn, new JournalException(
                            "Failed to append " + entriesForSequence.size() + " entries to " + table
                                    + " for key '" + key + "'", e));
                } catch (JsonProcessingException e) {
                    throw rollback(conn, new JournalException(
                            "Failed to serialize " + type.getSimpleName() + " for " + table, e));
                } catch (RuntimeException e) {
                    throw rollback(conn, e);
                } finally {
                    conn.setAutoCommit(autoCommit);
                }
            } catch (SQLException e) {
                throw new JournalException("Failed to open a transaction on " + table, e);
            }
            lastSequence = first + built.size() - 1;
            return List.copyOf(built);
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public List<T> readAll() {
        return query("SELECT payload FROM " + table + " ORDER BY seq ASC", null);
    }

    @Override
    public List<T> read(String key) {
        return query("SELECT payload FROM " + table + " WHERE entry_key = ? ORDER BY seq ASC", key);
    }

    @Override
    public Optional<T> latest(String key) {
        List<T> rows = query("SELECT payload FROM " + table + " WHERE entry_key = ? ORDER BY seq DESC LIMIT 1", key);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT entry_key, MIN(seq) AS first_seq FROM " + table
                             + " GROUP BY entry_key ORDER BY first_seq ASC");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                keys.add(rs.getString("entry_key"));
            }
        } catch (SQLException e) {
            throw new JournalException("Failed to list keys of " + table, e);
        }
        return keys;
    }

    @Override
    public long size() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM " + table);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new JournalException("Failed to count entries of " + table, e);
        }
    }

    String tableName() {
        return table;
    }

    private RuntimeException rollback(Connection conn, RuntimeException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback on {} failed: {}", table, e.getMessage());
            cause.addSuppressed(e);
        }
        return cause;
    }

    private long currentSequence() {
        if (lastSequence >= 0) {
            return lastSequence;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COALESCE(MAX(seq), 0) FROM " + table);
             ResultSet rs = stmt.executeQuery()) {
            lastSequence = rs.next() ? rs.getLong(1) : 0L;
            return lastSequence;
        } catch (SQLException e) {
            throw new JournalException("Failed to read sequence of " + table, e);
        }
    }

    private List<T> query(String sql, String key) {
        List<T> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (key != null) {
                stmt.setString(1, key);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(objectMapper.readValue(rs.getString("payload"), type));
                }
            }
        } catch (SQLException e) {
            throw new JournalException("Failed to read " + table, e);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to deserialize " + type.getSimpleName() + " from " + table, e);
        }
        return result;
    }
}
