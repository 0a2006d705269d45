package com.foresight.core.health;

import com.foresight.core.graph.AnalysisGraph;
import com.foresight.core.host.HostEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AnalysisGraph analysisGraph;
    private final HostEnvironment host;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) AnalysisGraph analysisGraph,
            @Autowired(required = false) HostEnvironment host,
            @Autowired(required = false) DataSource dataSource) {
        this.analysisGraph = analysisGraph;
        this.host = host;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkDatabase());
        results.add(checkHost());
        return results;
    }

    private HealthStatus checkGraph() {
        if (analysisGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    /**
     * A host with no capabilities still works but cannot produce recommendations.
     */
    private HealthStatus checkHost() {
        if (host == null) {
            return new HealthStatus("host", HealthStatus.Status.DOWN,
                    "No host environment configured", Map.of());
        }
        try {
            int count = host.capabilities().size();
            var metadata = Map.of("capabilities", String.valueOf(count));
            if (count == 0) {
                return new HealthStatus("host", HealthStatus.Status.DEGRADED,
                        "Host environment has no capabilities", metadata);
            }
            return new HealthStatus("host", HealthStatus.Status.UP,
                    count + " capabilities available", metadata);
        } catch (Exception e) {
            log.warn("Host health check failed: {}", e.getMessage());
            return new HealthStatus("host", HealthStatus.Status.DOWN,
                    "Host error: " + e.getMessage(), Map.of());
        }
    }
}
