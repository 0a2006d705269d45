package com.foresight.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.ErrorKind;
import com.foresight.core.model.ExecutionOutcome;
import com.foresight.core.model.Priority;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link AnalysisRepository} for PostgreSQL.
 * <p>
 * Narrative sections, contributor lists, parameters and result payloads are stored
 * as JSON text. Tables and indexes are created by {@link #createTables()}.
 */
public class JdbcAnalysisRepository implements AnalysisRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAnalysisRepository.class);

    private static final String ANALYSES = "analysis_results";
    private static final String ACTIONS = "recommended_actions";

    private static final List<String> SCHEMA_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS %s (
                id                VARCHAR(64) PRIMARY KEY,
                agent_id          VARCHAR(255) NOT NULL,
                created_at        TIMESTAMP NOT NULL,
                sections          TEXT NOT NULL,
                capabilities_used TEXT NOT NULL,
                execution_time_ms BIGINT NOT NULL
            )
            """.formatted(ANALYSES),
            """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64) PRIMARY KEY,
                analysis_id      VARCHAR(64) NOT NULL REFERENCES %s (id) ON DELETE CASCADE,
                capability_type  VARCHAR(255) NOT NULL,
                owner_name       VARCHAR(255) NOT NULL,
                priority         INTEGER NOT NULL,
                reasoning        TEXT NOT NULL,
                confidence       DOUBLE PRECISION NOT NULL,
                trigger_phrase   TEXT NOT NULL,
                params           TEXT,
                estimated_impact TEXT,
                estimated_gas    TEXT,
                status           VARCHAR(16) NOT NULL,
                decided_at       TIMESTAMP,
                executed_at      TIMESTAMP,
                outcome          TEXT,
                error            TEXT,
                error_kind       VARCHAR(16),
                created_at       TIMESTAMP NOT NULL
            )
            """.formatted(ACTIONS, ANALYSES),
            "CREATE INDEX IF NOT EXISTS idx_analysis_results_agent ON %s (agent_id, created_at)".formatted(ANALYSES),
            "CREATE INDEX IF NOT EXISTS idx_recommended_actions_analysis ON %s (analysis_id)".formatted(ACTIONS),
            "CREATE INDEX IF NOT EXISTS idx_recommended_actions_status ON %s (status)".formatted(ACTIONS),
            "CREATE INDEX IF NOT EXISTS idx_recommended_actions_created ON %s (created_at)".formatted(ACTIONS)
    );

    private static final String INSERT_ANALYSIS_SQL = """
            INSERT INTO %s (id, agent_id, created_at, sections, capabilities_used, execution_time_ms)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(ANALYSES);

    private static final String INSERT_ACTION_SQL = """
            INSERT INTO %s (id, analysis_id, capability_type, owner_name, priority, reasoning, confidence,
                            trigger_phrase, params, estimated_impact, estimated_gas, status,
                            decided_at, executed_at, outcome, error, error_kind, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(ACTIONS);

    private static final String ANALYSIS_COLUMNS =
            "id, agent_id, created_at, sections, capabilities_used, execution_time_ms";

    private static final String SELECT_ANALYSIS_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(ANALYSIS_COLUMNS, ANALYSES);

    private static final String SELECT_BY_AGENT_SQL = """
            SELECT %s FROM %s
            WHERE agent_id = ?
            ORDER BY created_at DESC
            LIMIT ?
            """.formatted(ANALYSIS_COLUMNS, ANALYSES);

    private static final String SELECT_ACTIONS_SQL = """
            SELECT * FROM %s
            WHERE analysis_id = ?
            ORDER BY priority DESC, confidence DESC
            """.formatted(ACTIONS);

    private static final String SELECT_ACTION_SQL = """
            SELECT * FROM %s WHERE id = ?
            """.formatted(ACTIONS);

    private static final String DECIDE_SQL = """
            UPDATE %s SET status = ?, decided_at = ?
            WHERE id = ? AND status = 'pending'
            """.formatted(ACTIONS);

    private static final String COMPLETE_SQL = """
            UPDATE %s SET status = 'completed', outcome = ?, executed_at = ?
            WHERE id = ? AND status = 'executing'
            """.formatted(ACTIONS);

    private static final String FAIL_SQL = """
            UPDATE %s SET status = 'failed', error = ?, error_kind = ?, executed_at = ?
            WHERE id = ? AND status = 'executing'
            """.formatted(ACTIONS);

    private static final String DELETE_ANALYSIS_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(ANALYSES);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcAnalysisRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Creates both tables and their indexes if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SCHEMA_SQL) {
                stmt.execute(sql);
            }
            log.info("Tables '{}' and '{}' ensured", ANALYSES, ACTIONS);
        }
    }

    @Override
    public void saveAnalysis(Analysis analysis, List<Recommendation> recommendations) {
        Objects.requireNonNull(analysis, "analysis");
        var toSave = recommendations == null ? List.<Recommendation>of() : recommendations.stream()
                .filter(Objects::nonNull)
                .filter(Recommendation::isComplete)
                .filter(r -> analysis.id().equals(r.analysisId()))
                .toList();

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_ANALYSIS_SQL)) {
                    stmt.setString(1, analysis.id());
                    stmt.setString(2, analysis.agentId());
                    stmt.setTimestamp(3, Timestamp.from(analysis.createdAt()));
                    stmt.setString(4, toJson(analysis.sections()));
                    stmt.setString(5, toJson(analysis.capabilitiesUsed()));
                    stmt.setLong(6, analysis.executionTimeMs());
                    stmt.executeUpdate();
                }
                if (!toSave.isEmpty()) {
                    try (PreparedStatement stmt = conn.prepareStatement(INSERT_ACTION_SQL)) {
                        for (Recommendation rec : toSave) {
                            bindRecommendation(stmt, rec);
                            stmt.addBatch();
                        }
                        stmt.executeBatch();
                    }
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.info("Saved analysis {} with {} recommendation(s)", analysis.id(), toSave.size());
        } catch (SQLException e) {
            throw new RepositoryException("Failed to save analysis " + analysis.id(), e);
        }
    }

    @Override
    public Optional<AnalysisReport> getById(String analysisId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ANALYSIS_SQL)) {
            stmt.setString(1, analysisId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Analysis analysis = analysisFrom(rs);
                return Optional.of(new AnalysisReport(analysis, listActionsByAnalysis(conn, analysisId)));
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to load analysis " + analysisId, e);
        }
    }

    @Override
    public List<Analysis> listByAgent(String agentId, int limit) {
        var results = new ArrayList<Analysis>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_AGENT_SQL)) {
            stmt.setString(1, agentId);
            stmt.setInt(2, Math.max(0, limit));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(analysisFrom(rs));
                }
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list analyses for agent " + agentId, e);
        }
        return results;
    }

    @Override
    public List<Recommendation> listActionsByAnalysis(String analysisId) {
        try (Connection conn = dataSource.getConnection()) {
            return listActionsByAnalysis(conn, analysisId);
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list actions for analysis " + analysisId, e);
        }
    }

    private List<Recommendation> listActionsByAnalysis(Connection conn, String analysisId) throws SQLException {
        var results = new ArrayList<Recommendation>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIONS_SQL)) {
            stmt.setString(1, analysisId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(recommendationFrom(rs));
                }
            }
        }
        return results;
    }

    @Override
    public Recommendation getActionById(String recommendationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ACTION_SQL)) {
            stmt.setString(1, recommendationId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new RecommendationNotFoundException(recommendationId);
                }
                return recommendationFrom(rs);
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to load action " + recommendationId, e);
        }
    }

    @Override
    public boolean markRejected(String recommendationId, Instant decidedAt) {
        return decide(recommendationId, RecommendationStatus.REJECTED, decidedAt);
    }

    @Override
    public boolean markExecuting(String recommendationId, Instant decidedAt) {
        return decide(recommendationId, RecommendationStatus.EXECUTING, decidedAt);
    }

    private boolean decide(String recommendationId, RecommendationStatus next, Instant decidedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DECIDE_SQL)) {
            stmt.setString(1, next.value());
            stmt.setTimestamp(2, Timestamp.from(decidedAt));
            stmt.setString(3, recommendationId);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to mark action " + recommendationId + " " + next.value(), e);
        }
    }

    @Override
    public boolean markCompleted(String recommendationId, ExecutionOutcome result, Instant executedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COMPLETE_SQL)) {
            stmt.setString(1, toJson(result));
            stmt.setTimestamp(2, Timestamp.from(executedAt));
            stmt.setString(3, recommendationId);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to mark action " + recommendationId + " completed", e);
        }
    }

    @Override
    public boolean markFailed(String recommendationId, String error, ErrorKind errorKind, Instant executedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(FAIL_SQL)) {
            stmt.setString(1, error);
            stmt.setString(2, errorKind.value());
            stmt.setTimestamp(3, Timestamp.from(executedAt));
            stmt.setString(4, recommendationId);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to mark action " + recommendationId + " failed", e);
        }
    }

    @Override
    public boolean deleteAnalysis(String analysisId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_ANALYSIS_SQL)) {
            stmt.setString(1, analysisId);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to delete analysis " + analysisId, e);
        }
    }

    // ── Row mapping ──────────────────────────────────────────────────

    private void bindRecommendation(PreparedStatement stmt, Recommendation rec) throws SQLException {
        stmt.setString(1, rec.id());
        stmt.setString(2, rec.analysisId());
        stmt.setString(3, rec.capabilityType());
        stmt.setString(4, rec.ownerName() != null ? rec.ownerName() : "unknown");
        stmt.setInt(5, rec.priority().ordinalValue());
        stmt.setString(6, rec.reasoning() != null ? rec.reasoning() : "");
        stmt.setDouble(7, rec.confidence());
        stmt.setString(8, rec.triggerPhrase());
        stmt.setString(9, rec.params().isEmpty() ? null : toJson(rec.params()));
        stmt.setString(10, rec.estimatedImpact());
        stmt.setString(11, rec.estimatedGas());
        stmt.setString(12, rec.status().value());
        setInstant(stmt, 13, rec.decidedAt());
        setInstant(stmt, 14, rec.executedAt());
        stmt.setString(15, rec.result() != null ? toJson(rec.result()) : null);
        stmt.setString(16, rec.error());
        stmt.setString(17, rec.errorKind() != null ? rec.errorKind().value() : null);
        stmt.setTimestamp(18, Timestamp.from(rec.createdAt() != null ? rec.createdAt() : Instant.now()));
    }

    private Analysis analysisFrom(ResultSet rs) throws SQLException {
        return new Analysis(
                rs.getString("id"),
                rs.getString("agent_id"),
                rs.getTimestamp("created_at").toInstant(),
                fromJson(rs.getString("sections"), AnalysisSections.class),
                fromJson(rs.getString("capabilities_used"), STRING_LIST),
                rs.getLong("execution_time_ms"));
    }

    private Recommendation recommendationFrom(ResultSet rs) throws SQLException {
        String params = rs.getString("params");
        String outcome = rs.getString("outcome");
        String errorKind = rs.getString("error_kind");
        return new Recommendation(
                rs.getString("id"),
                rs.getString("analysis_id"),
                rs.getString("capability_type"),
                rs.getString("owner_name"),
                Priority.fromOrdinalValue(rs.getInt("priority")),
                rs.getString("reasoning"),
                rs.getDouble("confidence"),
                rs.getString("trigger_phrase"),
                params != null ? fromJson(params, STRING_MAP) : Map.of(),
                rs.getString("estimated_impact"),
                rs.getString("estimated_gas"),
                RecommendationStatus.fromValue(rs.getString("status")),
                getInstant(rs, "decided_at"),
                getInstant(rs, "executed_at"),
                outcome != null ? fromJson(outcome, ExecutionOutcome.class) : null,
                rs.getString("error"),
                errorKind != null ? ErrorKind.fromValue(errorKind) : null,
                rs.getTimestamp("created_at").toInstant());
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP);
        } else {
            stmt.setTimestamp(index, Timestamp.from(value));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Failed to deserialize " + type.getType(), e);
        }
    }
}
