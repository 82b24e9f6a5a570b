package com.workhub.core.health;

import com.workhub.core.graph.AgentGraph;
import com.workhub.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports the state of the graph, the language model and the database.
 * <p>
 * A missing model or database only degrades the service: the rules and the
 * logging executor keep messages flowing.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentGraph agentGraph;
    private final LlmService llmService;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) AgentGraph agentGraph,
            @Autowired(required = false) LlmService llmService,
            @Autowired(required = false) DataSource dataSource) {
        this.agentGraph = agentGraph;
        this.llmService = llmService;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkModel());
        results.add(checkDatabase());
        return results;
    }

    private HealthStatus checkGraph() {
        if (agentGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkModel() {
        if (llmService != null && llmService.isAvailable()) {
            return new HealthStatus("model", HealthStatus.Status.UP,
                    "Language model configured", Map.of("model", llmService.modelName()));
        }
        return new HealthStatus("model", HealthStatus.Status.DEGRADED,
                "No language model configured, using rule-based classification", Map.of());
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured, actions are only logged", Map.of());
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
}
