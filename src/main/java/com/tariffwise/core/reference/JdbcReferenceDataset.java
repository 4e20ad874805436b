package com.tariffwise.core.reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference dataset backed by the {@code tariff_codes} table.
 * <p>
 * Lookup failures are raised as {@link ReferenceDataException}; the code validation gate
 * treats them as an internal fault.
 */
public class JdbcReferenceDataset implements ReferenceDataset {

    private static final Logger log = LoggerFactory.getLogger(JdbcReferenceDataset.class);

    private static final String TABLE_NAME = "tariff_codes";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                code        VARCHAR(20) PRIMARY KEY,
                description VARCHAR(2000) NOT NULL,
                duty_rate   VARCHAR(100)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_CODE_SQL = """
            SELECT code, description, duty_rate FROM %s WHERE code = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_PREFIX_SQL = """
            SELECT code, description, duty_rate FROM %s WHERE code LIKE ? ORDER BY code
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_DESCRIPTION_SQL = """
            SELECT code, description, duty_rate FROM %s WHERE LOWER(description) LIKE ? ORDER BY code
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM " + TABLE_NAME;

    private final DataSource dataSource;

    public JdbcReferenceDataset(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Reference table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<ReferenceRecord> lookupByCode(String code) {
        String normalized = TariffCodes.normalize(code);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        List<ReferenceRecord> found = query(SELECT_BY_CODE_SQL, normalized, Integer.MAX_VALUE);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<ReferenceRecord> searchPrefix(String prefix) {
        String normalized = TariffCodes.normalize(prefix);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return query(SELECT_BY_PREFIX_SQL, escapeLike(normalized) + "%", Integer.MAX_VALUE);
    }

    @Override
    public List<ReferenceRecord> searchDescription(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String[] keywords = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        // first keyword narrows in SQL, the rest are checked in memory
        List<ReferenceRecord> candidates = query(SELECT_BY_DESCRIPTION_SQL, "%" + escapeLike(keywords[0]) + "%", Integer.MAX_VALUE);
        List<ReferenceRecord> matches = new ArrayList<>();
        for (ReferenceRecord record : candidates) {
            String description = record.description().toLowerCase(Locale.ROOT);
            boolean all = true;
            for (int i = 1; i < keywords.length && all; i++) {
                all = description.contains(keywords[i]);
            }
            if (all) {
                matches.add(record);
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }

    @Override
    public int size() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new ReferenceDataException("Failed to count reference records", e);
        }
    }

    private List<ReferenceRecord> query(String sql, String parameter, int limit) {
        List<ReferenceRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, parameter);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next() && records.size() < limit) {
                    records.add(new ReferenceRecord(rs.getString("code"), rs.getString("description"),
                            rs.getString("duty_rate")));
                }
            }
        } catch (SQLException e) {
            throw new ReferenceDataException("Reference query failed for '" + parameter + "'", e);
        }
        return records;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
