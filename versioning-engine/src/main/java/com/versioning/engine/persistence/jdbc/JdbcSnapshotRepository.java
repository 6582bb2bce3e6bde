package com.versioning.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.versioning.core.model.ResourceSnapshot;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.SnapshotRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of SnapshotRepository.
 * Rows are insert-only.
 */
@Repository("jdbcSnapshotRepository")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcSnapshotRepository implements SnapshotRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SnapshotRowMapper rowMapper;

    public JdbcSnapshotRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new SnapshotRowMapper();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ResourceSnapshot save(ResourceSnapshot snapshot) {
        String sql = """
            INSERT INTO resource_snapshots (
                resource_id, resource_type, user_id, created_on, description, snapshot_data
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb)
            RETURNING resource_snapshot_id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
            snapshot.resourceId(),
            snapshot.resourceType().dbName(),
            snapshot.creatorId(),
            Timestamp.from(snapshot.createdOn()),
            snapshot.description(),
            toJson(snapshot.data())
        );
        return snapshot.withId(id);
    }

    @Override
    public Optional<ResourceSnapshot> findById(long snapshotId) {
        String sql = "SELECT * FROM resource_snapshots WHERE resource_snapshot_id = ?";
        List<ResourceSnapshot> results = jdbcTemplate.query(sql, rowMapper, snapshotId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean exists(long snapshotId) {
        String sql = "SELECT EXISTS (SELECT 1 FROM resource_snapshots WHERE resource_snapshot_id = ?)";
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, snapshotId));
    }

    @Override
    public boolean belongsTo(long resourceId, long snapshotId) {
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM resource_snapshots
                WHERE resource_snapshot_id = ? AND resource_id = ?
            )
            """;
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, snapshotId, resourceId));
    }

    @Override
    public List<ResourceSnapshot> findByResource(long resourceId) {
        String sql = """
            SELECT * FROM resource_snapshots
            WHERE resource_id = ?
            ORDER BY created_on, resource_snapshot_id
            """;
        return jdbcTemplate.query(sql, rowMapper, resourceId);
    }

    private String toJson(JsonNode data) {
        if (data == null) return null;
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot data", e);
        }
    }

    private class SnapshotRowMapper implements RowMapper<ResourceSnapshot> {
        @Override
        public ResourceSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            String data = rs.getString("snapshot_data");
            try {
                return new ResourceSnapshot(
                    rs.getLong("resource_snapshot_id"),
                    rs.getLong("resource_id"),
                    ResourceType.fromDbName(rs.getString("resource_type")),
                    rs.getLong("user_id"),
                    rs.getTimestamp("created_on").toInstant(),
                    rs.getString("description"),
                    data != null ? objectMapper.readTree(data) : null
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map snapshot data", e);
            }
        }
    }
}
