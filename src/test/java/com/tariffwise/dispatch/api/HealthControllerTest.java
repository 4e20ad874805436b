package com.tariffwise.dispatch.api;

import com.tariffwise.core.health.HealthCheckService;
import com.tariffwise.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns UP when every component is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("providers", HealthStatus.Status.UP, "Primary gemini, secondary claude",
                        Map.of("primary", "gemini", "secondary", "claude")),
                new HealthStatus("reference", HealthStatus.Status.UP, "59 tariff codes loaded", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.providers.metadata.secondary").value("claude"))
                .andExpect(jsonPath("$.components.reference.detail").value("59 tariff codes loaded"))
                .andExpect(jsonPath("$.components.reference.metadata").doesNotExist());
    }

    @Test
    @DisplayName("a degraded component keeps 200 but reports DEGRADED")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("providers", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("database", HealthStatus.Status.DEGRADED, "No DataSource configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("any DOWN component returns 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("database", HealthStatus.Status.DEGRADED, "No DataSource", Map.of()),
                new HealthStatus("reference", HealthStatus.Status.DOWN, "Reference dataset is empty", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.reference.status").value("DOWN"));
    }
}
