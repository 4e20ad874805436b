package com.tariffwise.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.ThreadAttemptRecord;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAttemptRecordStoreTest {

    private JdbcDataSource dataSource;
    private JdbcAttemptRecordStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:attempts;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        store = new JdbcAttemptRecordStore(dataSource, new ObjectMapper(), clock);
        store.createTables();
    }

    @AfterEach
    void tearDown() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS classification_attempts");
        }
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws SQLException {
        store.createTables();
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    @DisplayName("two attempts are allowed, the third escalates with the recorded codes")
    void escalatesOnThirdAttempt() {
        AttemptStatus first = store.incrementOrCreate("abc123", 2, "Quote for espresso machines");
        assertTrue(first.allowed());
        assertEquals(1, first.attemptNumber());
        store.recordCodes("abc123", List.of("8516710000"));

        AttemptStatus second = store.incrementOrCreate("abc123", 2, "Re: Quote for espresso machines");
        assertTrue(second.allowed());
        assertEquals(2, second.attemptNumber());
        assertEquals(List.of("8516710000"), second.priorCodes());
        store.recordCodes("abc123", List.of("8516710000", "8516790000"));

        AttemptStatus third = store.incrementOrCreate("abc123", 2, "Re: Re: Quote for espresso machines");
        assertTrue(third.escalate());
        assertFalse(third.allowed());
        assertEquals(3, third.attemptNumber());
        assertEquals(List.of("8516710000", "8516790000"), third.priorCodes());

        ThreadAttemptRecord record = store.get("abc123").orElseThrow();
        assertEquals(2, record.attempts());
        assertEquals("Quote for espresso machines", record.subject());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), record.firstSeen());
    }

    @Test
    @DisplayName("recording codes for an unknown key is a no-op")
    void recordCodesUnknownKey() {
        store.recordCodes("nope", List.of("8516710000"));
        assertTrue(store.get("nope").isEmpty());
    }

    @Test
    @DisplayName("racing increments never push the counter past the maximum")
    void concurrentIncrementsAreBounded() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<AttemptStatus>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(pool.submit(() -> store.incrementOrCreate("race", 2, "Race")));
            }
            int allowed = 0;
            for (Future<AttemptStatus> future : futures) {
                if (future.get().allowed()) {
                    allowed++;
                }
            }
            assertEquals(2, allowed);
            assertEquals(2, store.get("race").orElseThrow().attempts());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("database failures surface as AttemptStoreException")
    void failureIsWrapped() throws SQLException {
        tearDown();
        assertThrows(AttemptStoreException.class, () -> store.get("abc123"));
    }
}
