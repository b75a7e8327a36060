package com.mcr.core.performance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcr.core.error.BackendException;
import com.mcr.core.router.InputClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * JDBC-backed {@link PerformanceStore} persisting records to the
 * {@code mcr_performance_results} table, metrics as a JSON column.
 * <p>
 * The table is created by {@link #createTables()}.
 */
public class JdbcPerformanceStore implements PerformanceStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPerformanceStore.class);

    static final String TABLE_NAME = "mcr_performance_results";

    private static final TypeReference<Map<String, Object>> METRICS_TYPE = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                strategy_hash VARCHAR(128) NOT NULL,
                example_id    VARCHAR(255),
                input_type    VARCHAR(32) NOT NULL,
                metrics       TEXT NOT NULL,
                latency_ms    BIGINT,
                cost_tokens   BIGINT,
                model_id      VARCHAR(255),
                created_at    TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (strategy_hash, example_id, input_type, metrics, latency_ms, cost_tokens, model_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT strategy_hash, example_id, input_type, metrics, latency_ms, cost_tokens, model_id, created_at
            FROM %s
            ORDER BY id ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TYPE_SQL = """
            SELECT strategy_hash, example_id, input_type, metrics, latency_ms, cost_tokens, model_id, created_at
            FROM %s
            WHERE input_type = ?
            ORDER BY id ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TYPE_AND_MODEL_SQL = """
            SELECT strategy_hash, example_id, input_type, metrics, latency_ms, cost_tokens, model_id, created_at
            FROM %s
            WHERE input_type = ? AND (model_id = ? OR model_id IS NULL OR model_id = '')
            ORDER BY id ASC
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM %s".formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcPerformanceStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the performance table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Performance table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(PerformanceRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, record.strategyHash());
            stmt.setString(2, record.exampleId());
            stmt.setString(3, record.inputType().value());
            stmt.setString(4, objectMapper.writeValueAsString(record.metrics()));
            setNullableLong(stmt, 5, record.latencyMs());
            setNullableLong(stmt, 6, record.costTokens());
            stmt.setString(7, record.modelId());
            stmt.setTimestamp(8, Timestamp.from(record.createdAt()));
            stmt.executeUpdate();
            log.debug("Appended performance record for strategy {}", record.strategyHash());
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to append performance record for strategy {}", record.strategyHash(), e);
            throw new BackendException("Cannot append performance record: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PerformanceRecord> query(Predicate<PerformanceRecord> filter) {
        return select(SELECT_ALL_SQL).stream().filter(filter).toList();
    }

    @Override
    public List<PerformanceRecord> query(String modelId, InputClass inputType) {
        if (modelId == null) {
            return select(SELECT_BY_TYPE_SQL, inputType.value());
        }
        return select(SELECT_BY_TYPE_AND_MODEL_SQL, inputType.value(), modelId);
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new BackendException("Cannot count performance records: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "jdbc:" + TABLE_NAME;
    }

    private List<PerformanceRecord> select(String sql, String... params) {
        List<PerformanceRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to read performance records", e);
            throw new BackendException("Cannot read performance records: " + e.getMessage(), e);
        }
        return records;
    }

    private PerformanceRecord fromResultSet(ResultSet rs) throws SQLException, JsonProcessingException {
        Map<String, Object> metrics = objectMapper.readValue(rs.getString("metrics"), METRICS_TYPE);
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new PerformanceRecord(
                rs.getString("strategy_hash"),
                rs.getString("example_id"),
                InputClass.fromValue(rs.getString("input_type")),
                metrics,
                nullableLong(rs, "latency_ms"),
                nullableLong(rs, "cost_tokens"),
                rs.getString("model_id"),
                createdAt == null ? null : createdAt.toInstant());
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
