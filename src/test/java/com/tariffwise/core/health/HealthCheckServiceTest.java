package com.tariffwise.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.concurrent.BoundedCallExecutor;
import com.tariffwise.core.llm.ModelClient;
import com.tariffwise.core.llm.ModelProviders;
import com.tariffwise.core.reference.InMemoryReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import com.tariffwise.core.tools.AssessRiskTool;
import com.tariffwise.core.tools.ToolRegistry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static ModelClient client(String name) {
        ModelClient client = mock(ModelClient.class);
        when(client.name()).thenReturn(name);
        return client;
    }

    private static Map<String, HealthStatus> byComponent(List<HealthStatus> checks) {
        return checks.stream().collect(Collectors.toMap(HealthStatus::component, Function.identity()));
    }

    @Test
    @DisplayName("fully configured service reports every component UP")
    void allUp() {
        var ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:health;DB_CLOSE_DELAY=-1");
        var service = new HealthCheckService(
                new ModelProviders(client("gemini"), client("claude")),
                new InMemoryReferenceDataset(List.of(new ReferenceRecord("8516710000", "Coffee or tea makers", "Free"))),
                new ToolRegistry(List.of(new AssessRiskTool()), new BoundedCallExecutor(), new ObjectMapper(), null,
                        Duration.ofSeconds(1)),
                ds);

        Map<String, HealthStatus> checks = byComponent(service.checkAll());

        assertEquals(4, checks.size());
        checks.values().forEach(c -> assertEquals(HealthStatus.Status.UP, c.status(), c.component()));
        assertEquals("gemini", checks.get("providers").metadata().get("primary"));
        assertEquals("assess_risk", checks.get("tools").metadata().get("names"));
    }

    @Test
    @DisplayName("missing optional parts degrade; missing essentials are DOWN")
    void degradedAndDown() {
        var service = new HealthCheckService(new ModelProviders(client("gemini"), null),
                new InMemoryReferenceDataset(List.of()), null, null);

        Map<String, HealthStatus> checks = byComponent(service.checkAll());

        assertEquals(HealthStatus.Status.DEGRADED, checks.get("providers").status());
        assertEquals(HealthStatus.Status.DEGRADED, checks.get("database").status());
        assertEquals(HealthStatus.Status.DOWN, checks.get("reference").status());
        assertEquals(HealthStatus.Status.DOWN, checks.get("tools").status());
    }

    @Test
    @DisplayName("database connection errors are DOWN")
    void databaseError() throws SQLException {
        DataSource ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("Connection refused"));
        var service = new HealthCheckService(null, null, null, ds);

        Map<String, HealthStatus> checks = byComponent(service.checkAll());

        assertEquals(HealthStatus.Status.DOWN, checks.get("database").status());
        assertTrue(checks.get("database").detail().contains("Connection refused"));
        assertEquals(HealthStatus.Status.DOWN, checks.get("providers").status());
    }
}
