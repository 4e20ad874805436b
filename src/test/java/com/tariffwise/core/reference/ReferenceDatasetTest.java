package com.tariffwise.core.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDatasetTest {

    @Nested
    @DisplayName("bundled JSON dataset")
    class Bundled {

        private InMemoryReferenceDataset load() throws Exception {
            try (InputStream in = getClass().getResourceAsStream("/reference/tariff-codes.json")) {
                assertNotNull(in);
                return InMemoryReferenceDataset.load(in, new ObjectMapper());
            }
        }

        @Test
        @DisplayName("loads and resolves codes with separators")
        void lookup() throws Exception {
            var dataset = load();

            assertTrue(dataset.size() > 50);
            assertEquals("Coffee or tea makers", dataset.lookupByCode("8516.71.0000").orElseThrow().description());
            assertTrue(dataset.lookupByCode("8516.75.0000").isEmpty());
            assertTrue(dataset.lookupByCode("").isEmpty());
        }

        @Test
        @DisplayName("prefix search is ordered by code")
        void prefix() throws Exception {
            var siblings = load().searchPrefix("8516");

            assertTrue(siblings.size() >= 10);
            for (int i = 1; i < siblings.size(); i++) {
                assertTrue(siblings.get(i - 1).code().compareTo(siblings.get(i).code()) < 0);
            }
            assertTrue(siblings.stream().allMatch(r -> r.code().startsWith("8516")));
        }

        @Test
        @DisplayName("description search needs every keyword")
        void description() throws Exception {
            var dataset = load();

            assertEquals("8516710000", dataset.searchDescription("coffee makers", 5).get(0).code());
            assertTrue(dataset.searchDescription("coffee submarine", 5).isEmpty());
        }
    }

    @Nested
    @DisplayName("JDBC dataset")
    class Jdbc {

        private JdbcDataSource dataSource() throws SQLException {
            var ds = new JdbcDataSource();
            ds.setURL("jdbc:h2:mem:reference;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
            ds.setUser("sa");
            return ds;
        }

        @AfterEach
        void dropTable() throws SQLException {
            try (Connection conn = dataSource().getConnection(); Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS tariff_codes");
            }
        }

        @Test
        @DisplayName("reads codes from the tariff_codes table")
        void queries() throws SQLException {
            var ds = dataSource();
            var dataset = new JdbcReferenceDataset(ds);
            dataset.createTables();
            try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
                stmt.execute("INSERT INTO tariff_codes VALUES ('8516710000', 'Coffee or tea makers', 'Free')");
                stmt.execute("INSERT INTO tariff_codes VALUES ('8516720000', 'Toasters', 'Free')");
                stmt.execute("INSERT INTO tariff_codes VALUES ('8518300000', 'Headphones and earphones', NULL)");
            }

            assertEquals(3, dataset.size());
            assertEquals("Toasters", dataset.lookupByCode("8516.72.0000").orElseThrow().description());
            assertEquals(2, dataset.searchPrefix("8516").size());
            assertEquals("8518300000", dataset.searchDescription("HEADPHONES earphones", 5).get(0).code());
        }

        @Test
        @DisplayName("missing table surfaces as ReferenceDataException")
        void failure() throws SQLException {
            var dataset = new JdbcReferenceDataset(dataSource());

            assertThrows(ReferenceDataException.class, () -> dataset.lookupByCode("8516"));
        }
    }
}
