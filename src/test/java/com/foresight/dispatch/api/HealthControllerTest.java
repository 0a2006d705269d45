package com.foresight.dispatch.api;

import com.foresight.core.health.HealthCheckService;
import com.foresight.core.health.HealthStatus;
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
    @DisplayName("GET /health reports DEGRADED with 200 when nothing is DOWN")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("host", HealthStatus.Status.DEGRADED, "no capabilities",
                        Map.of("capabilities", "0"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.graph.status").value("UP"))
                .andExpect(jsonPath("$.components.graph.metadata").doesNotExist())
                .andExpect(jsonPath("$.components.host.metadata.capabilities").value("0"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("database", HealthStatus.Status.DOWN, "No DataSource configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.database.detail").value("No DataSource configured"));
    }

    @Test
    @DisplayName("GET /health is UP when every component is UP")
    void up() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "ok", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
