package io.contextrunr.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SQLite-backed fact store with a history of superseded values.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code facts}: one row per (subject_id, key) with value, confidence, source message, timestamp</li>
 *   <li>{@code fact_history}: previous values, appended whenever a fact's value changes</li>
 * </ul>
 */
@Component
public class SQLiteFactStore implements MutableFactStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteFactStore.class);

    private final String dbPath;
    private final AtomicLong generation = new AtomicLong();
    private Connection connection;

    @Autowired
    public SQLiteFactStore(@Value("${memory.path:./data/memory}") String memoryPath) {
        Path dir = Path.of(memoryPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", dir, e);
        }
        this.dbPath = dir.resolve("facts.db").toString();
    }

    /** Constructor for testing with explicit db path. */
    public SQLiteFactStore(String dbPath, boolean isDirect) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("SQLiteFactStore initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite fact store at {}", dbPath, e);
            throw new FactStoreException("Fact store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS facts (
                    subject_id TEXT NOT NULL,
                    key TEXT NOT NULL,
                    value TEXT NOT NULL,
                    confidence REAL NOT NULL,
                    source_message_id TEXT,
                    updated_at TEXT NOT NULL,
                    PRIMARY KEY (subject_id, key)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS fact_history (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    subject_id TEXT NOT NULL,
                    key TEXT NOT NULL,
                    value TEXT NOT NULL,
                    confidence REAL NOT NULL,
                    source_message_id TEXT,
                    updated_at TEXT NOT NULL,
                    superseded_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_fact_history_subject ON fact_history(subject_id)
                """);
        }
    }

    /**
     * Stores a fact, archiving the value it replaces. The archive row and the new value are
     * written in one transaction.
     */
    @Override
    public synchronized void recordFact(Fact fact) {
        try {
            connection.setAutoCommit(false);
            try {
                upsert(fact);
                connection.commit();
            } catch (SQLException e) {
                rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            generation.incrementAndGet();
            log.debug("Stored fact: subject='{}', key='{}', confidence={}", fact.subjectId(), fact.key(), fact.confidence());
        } catch (SQLException e) {
            throw new FactStoreException("Failed to store fact " + fact.key() + " for " + fact.subjectId(), e);
        }
    }

    private void upsert(Fact fact) throws SQLException {
        Optional<Fact> existing = findFact(fact.subjectId(), fact.key());
        if (existing.isPresent() && !existing.get().value().equals(fact.value())) {
            archive(existing.get(), fact.updatedAt());
        }

        try (var stmt = connection.prepareStatement("""
                INSERT INTO facts (subject_id, key, value, confidence, source_message_id, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(subject_id, key) DO UPDATE SET
                    value = excluded.value,
                    confidence = excluded.confidence,
                    source_message_id = excluded.source_message_id,
                    updated_at = excluded.updated_at
                """)) {
            stmt.setString(1, fact.subjectId());
            stmt.setString(2, fact.key());
            stmt.setString(3, fact.value());
            stmt.setDouble(4, fact.confidence());
            stmt.setString(5, fact.sourceMessageId());
            stmt.setString(6, timestamp(fact.updatedAt()));
            stmt.executeUpdate();
        }
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Failed to roll back fact write", e);
        }
    }

    @Override
    public Map<String, Fact> getFacts(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            return Map.of();
        }

        Map<String, Fact> facts = new LinkedHashMap<>();
        String sql = """
            SELECT subject_id, key, value, confidence, source_message_id, updated_at
            FROM facts
            WHERE subject_id = ?
            ORDER BY key
            """;

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, subjectId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Fact fact = toFact(rs);
                    facts.put(fact.key(), fact);
                }
            }
        } catch (SQLException e) {
            throw new FactStoreException("Failed to load facts for " + subjectId, e);
        }

        return Collections.unmodifiableMap(facts);
    }

    @Override
    public List<Fact> getFactHistory(String subjectId) {
        List<Fact> history = new ArrayList<>();
        String sql = """
            SELECT subject_id, key, value, confidence, source_message_id, updated_at
            FROM fact_history
            WHERE subject_id = ?
            ORDER BY id
            """;

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, subjectId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    history.add(toFact(rs));
                }
            }
        } catch (SQLException e) {
            throw new FactStoreException("Failed to load fact history for " + subjectId, e);
        }

        return history;
    }

    @Override
    public boolean forget(String subjectId, String key) {
        try (var stmt = connection.prepareStatement("DELETE FROM facts WHERE subject_id = ? AND key = ?")) {
            stmt.setString(1, subjectId);
            stmt.setString(2, key);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                generation.incrementAndGet();
                log.debug("Forgot fact: subject='{}', key='{}'", subjectId, key);
                return true;
            }
            return false;
        } catch (SQLException e) {
            throw new FactStoreException("Failed to forget fact " + key + " for " + subjectId, e);
        }
    }

    @Override
    public long generation() {
        return generation.get();
    }

    /**
     * Health check: verifies the store is operational.
     */
    public boolean healthCheck() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Fact store health check failed: {}", e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteFactStore closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    private Optional<Fact> findFact(String subjectId, String key) throws SQLException {
        String sql = """
            SELECT subject_id, key, value, confidence, source_message_id, updated_at
            FROM facts
            WHERE subject_id = ? AND key = ?
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, subjectId);
            stmt.setString(2, key);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toFact(rs)) : Optional.empty();
            }
        }
    }

    private void archive(Fact previous, Instant supersededAt) throws SQLException {
        try (var stmt = connection.prepareStatement("""
                INSERT INTO fact_history (subject_id, key, value, confidence, source_message_id, updated_at, superseded_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, previous.subjectId());
            stmt.setString(2, previous.key());
            stmt.setString(3, previous.value());
            stmt.setDouble(4, previous.confidence());
            stmt.setString(5, previous.sourceMessageId());
            stmt.setString(6, timestamp(previous.updatedAt()));
            stmt.setString(7, timestamp(supersededAt));
            stmt.executeUpdate();
        }
    }

    private static String timestamp(Instant instant) {
        return (instant != null ? instant : Instant.EPOCH).toString();
    }

    private Fact toFact(ResultSet rs) throws SQLException {
        return new Fact(
                rs.getString("subject_id"),
                rs.getString("key"),
                rs.getString("value"),
                rs.getDouble("confidence"),
                rs.getString("source_message_id"),
                Instant.parse(rs.getString("updated_at"))
        );
    }
}
