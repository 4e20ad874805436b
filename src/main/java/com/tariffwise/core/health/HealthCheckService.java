package com.tariffwise.core.health;

import com.tariffwise.core.llm.ModelProviders;
import com.tariffwise.core.reference.ReferenceDataset;
import com.tariffwise.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ModelProviders providers;
    private final ReferenceDataset referenceDataset;
    private final ToolRegistry toolRegistry;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) ModelProviders providers,
            @Autowired(required = false) ReferenceDataset referenceDataset,
            @Autowired(required = false) ToolRegistry toolRegistry,
            @Autowired(required = false) DataSource dataSource) {
        this.providers = providers;
        this.referenceDataset = referenceDataset;
        this.toolRegistry = toolRegistry;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProviders());
        results.add(checkDatabase());
        results.add(checkReferenceDataset());
        results.add(checkTools());
        return results;
    }

    private HealthStatus checkProviders() {
        if (providers == null) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No model provider configured", Map.of());
        }
        if (!providers.hasSecondary()) {
            return new HealthStatus("providers", HealthStatus.Status.DEGRADED,
                    "Primary only; failover disabled", Map.of("primary", providers.primary().name()));
        }
        return new HealthStatus("providers", HealthStatus.Status.UP,
                "Primary and secondary available",
                Map.of("primary", providers.primary().name(), "secondary", providers.secondary().name()));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; attempt records are in memory", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkReferenceDataset() {
        if (referenceDataset == null) {
            return new HealthStatus("reference", HealthStatus.Status.DOWN,
                    "No reference dataset configured", Map.of());
        }
        try {
            int size = referenceDataset.size();
            if (size == 0) {
                return new HealthStatus("reference", HealthStatus.Status.DOWN,
                        "Reference dataset is empty", Map.of());
            }
            return new HealthStatus("reference", HealthStatus.Status.UP,
                    size + " tariff codes loaded", Map.of("size", String.valueOf(size)));
        } catch (RuntimeException e) {
            log.warn("Reference dataset health check failed: {}", e.getMessage());
            return new HealthStatus("reference", HealthStatus.Status.DOWN,
                    "Reference dataset error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkTools() {
        if (toolRegistry == null || toolRegistry.size() == 0) {
            return new HealthStatus("tools", HealthStatus.Status.DOWN,
                    "No tools registered", Map.of());
        }
        return new HealthStatus("tools", HealthStatus.Status.UP,
                toolRegistry.size() + " tools registered",
                Map.of("names", String.join(",", new TreeSet<>(toolRegistry.names()))));
    }
}
