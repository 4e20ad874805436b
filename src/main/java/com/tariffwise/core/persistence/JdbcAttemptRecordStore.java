package com.tariffwise.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.ThreadAttemptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link AttemptRecordStore} persisting thread attempt records to the
 * {@code classification_attempts} table.
 * <p>
 * The increment is a single conditional {@code UPDATE ... WHERE attempts < ?}, so the database
 * row lock serializes racing submissions and the counter cannot pass the maximum. A racing
 * first insert that loses on the primary key is retried as an update.
 * <p>
 * The table is created via {@link #createTables()}.
 */
public class JdbcAttemptRecordStore implements AttemptRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAttemptRecordStore.class);

    private static final String TABLE_NAME = "classification_attempts";
    private static final TypeReference<List<String>> CODE_LIST = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                thread_key  VARCHAR(64) PRIMARY KEY,
                subject     VARCHAR(1000),
                attempts    INT NOT NULL,
                prior_codes VARCHAR(4000) NOT NULL,
                first_seen  TIMESTAMP NOT NULL,
                last_seen   TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INCREMENT_SQL = """
            UPDATE %s SET attempts = attempts + 1, last_seen = ?
            WHERE thread_key = ? AND attempts < ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT thread_key, subject, attempts, prior_codes, first_seen, last_seen
            FROM %s WHERE thread_key = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_FOR_UPDATE_SQL = SELECT_SQL.strip() + " FOR UPDATE";

    private static final String TOUCH_SQL = """
            UPDATE %s SET last_seen = ? WHERE thread_key = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (thread_key, subject, attempts, prior_codes, first_seen, last_seen)
            VALUES (?, ?, 1, '[]', ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_CODES_SQL = """
            UPDATE %s SET prior_codes = ? WHERE thread_key = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcAttemptRecordStore(DataSource dataSource) {
        this(dataSource, new ObjectMapper(), Clock.systemUTC());
    }

    public JdbcAttemptRecordStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the attempts table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Attempt table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<ThreadAttemptRecord> get(String threadKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, threadKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new AttemptStoreException("Failed to read attempt record '" + threadKey + "'", e);
        }
    }

    @Override
    public AttemptStatus incrementOrCreate(String threadKey, int maxAttempts, String subject) {
        try {
            return incrementOrCreateOnce(threadKey, maxAttempts, subject);
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                // a concurrent request created the row first
                log.debug("Insert race on thread key {}; retrying as increment", threadKey);
                try {
                    return incrementOrCreateOnce(threadKey, maxAttempts, subject);
                } catch (SQLException retry) {
                    throw new AttemptStoreException("Failed to record attempt for '" + threadKey + "'", retry);
                }
            }
            throw new AttemptStoreException("Failed to record attempt for '" + threadKey + "'", e);
        }
    }

    private AttemptStatus incrementOrCreateOnce(String threadKey, int maxAttempts, String subject) throws SQLException {
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                AttemptStatus status = incrementInTransaction(conn, threadKey, maxAttempts, subject, now);
                conn.commit();
                return status;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    private AttemptStatus incrementInTransaction(Connection conn, String threadKey, int maxAttempts,
                                                 String subject, Timestamp now) throws SQLException {
        int updated;
        try (PreparedStatement stmt = conn.prepareStatement(INCREMENT_SQL)) {
            stmt.setTimestamp(1, now);
            stmt.setString(2, threadKey);
            stmt.setInt(3, maxAttempts);
            updated = stmt.executeUpdate();
        }
        if (updated == 1) {
            ThreadAttemptRecord record = select(conn, SELECT_SQL, threadKey)
                    .orElseThrow(() -> new SQLException("Attempt record vanished after increment: " + threadKey));
            log.info("Thread {} attempt {} of {}", threadKey, record.attempts(), maxAttempts);
            return AttemptStatus.allowed(threadKey, record.attempts(), record.priorCodes());
        }

        Optional<ThreadAttemptRecord> existing = select(conn, SELECT_FOR_UPDATE_SQL, threadKey);
        if (existing.isPresent()) {
            try (PreparedStatement stmt = conn.prepareStatement(TOUCH_SQL)) {
                stmt.setTimestamp(1, now);
                stmt.setString(2, threadKey);
                stmt.executeUpdate();
            }
            ThreadAttemptRecord record = existing.get();
            log.warn("Thread {} reached {} attempt(s); escalation required", threadKey, record.attempts());
            return AttemptStatus.escalation(threadKey, record.attempts() + 1, record.priorCodes());
        }

        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, threadKey);
            stmt.setString(2, truncate(subject, 1000));
            stmt.setTimestamp(3, now);
            stmt.setTimestamp(4, now);
            stmt.executeUpdate();
        }
        log.info("Thread {} first attempt recorded", threadKey);
        return AttemptStatus.allowed(threadKey, 1, List.of());
    }

    @Override
    public void recordCodes(String threadKey, Collection<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                Optional<ThreadAttemptRecord> existing = select(conn, SELECT_FOR_UPDATE_SQL, threadKey);
                if (existing.isEmpty()) {
                    log.debug("No attempt record for {}; codes not recorded", threadKey);
                    conn.commit();
                    return;
                }
                var merged = new LinkedHashSet<>(existing.get().priorCodes());
                merged.addAll(codes);
                try (PreparedStatement stmt = conn.prepareStatement(UPDATE_CODES_SQL)) {
                    stmt.setString(1, objectMapper.writeValueAsString(new ArrayList<>(merged)));
                    stmt.setString(2, threadKey);
                    stmt.executeUpdate();
                }
                conn.commit();
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new AttemptStoreException("Failed to record codes for '" + threadKey + "'", e);
        }
    }

    private Optional<ThreadAttemptRecord> select(Connection conn, String sql, String threadKey) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private ThreadAttemptRecord fromResultSet(ResultSet rs) throws SQLException {
        List<String> codes;
        String json = rs.getString("prior_codes");
        try {
            codes = json == null || json.isBlank() ? List.of() : objectMapper.readValue(json, CODE_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt prior_codes for " + rs.getString("thread_key"), e);
        }
        return new ThreadAttemptRecord(
                rs.getString("thread_key"),
                rs.getString("subject"),
                rs.getInt("attempts"),
                codes,
                toInstant(rs.getTimestamp("first_seen")),
                toInstant(rs.getTimestamp("last_seen")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
