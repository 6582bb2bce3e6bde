package com.versioning.engine.persistence.jdbc;

import com.versioning.core.model.*;
import com.versioning.core.repository.ResourceRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.*;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of ResourceRepository.
 * Deletion and read-only flags are derived from resource_locks in the same query.
 */
@Repository("jdbcResourceRepository")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcResourceRepository implements ResourceRepository {

    private static final String SELECT_RESOURCE = """
        SELECT r.resource_id, r.resource_type, r.group_id, r.created_on, r.latest_snapshot_id,
               EXISTS (SELECT 1 FROM resource_locks l
                       WHERE l.resource_id = r.resource_id AND l.resource_lock_type = 'delete') AS is_deleted,
               EXISTS (SELECT 1 FROM resource_locks l
                       WHERE l.resource_id = r.resource_id AND l.resource_lock_type = 'readonly') AS is_readonly
        FROM resources r
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ResourceRowMapper rowMapper;

    public JdbcResourceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = new ResourceRowMapper();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Resource save(Resource resource) {
        String sql = """
            INSERT INTO resources (resource_type, group_id, created_on, latest_snapshot_id)
            VALUES (?, ?, ?, ?)
            RETURNING resource_id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
            resource.resourceType().dbName(),
            resource.groupId(),
            Timestamp.from(resource.createdOn()),
            resource.latestSnapshotId()
        );
        return resource.withId(id);
    }

    @Override
    public Optional<Resource> findById(long resourceId, DeletionPolicy deletionPolicy) {
        List<Resource> results = jdbcTemplate.query(SELECT_RESOURCE + " WHERE r.resource_id = ?", rowMapper, resourceId);
        return results.stream()
            .filter(r -> deletionPolicy.accepts(r.deleted()))
            .findFirst();
    }

    @Override
    public ExistenceResult existence(long resourceId) {
        return findById(resourceId, DeletionPolicy.ANY)
            .map(r -> r.deleted() ? ExistenceResult.DELETED : ExistenceResult.EXISTS)
            .orElse(ExistenceResult.DOES_NOT_EXIST);
    }

    @Override
    public Optional<ParentCandidate> findParentCandidate(long resourceId, ResourceType childType) {
        String sql = """
            SELECT r.resource_id, r.resource_type,
                   EXISTS (SELECT 1 FROM resource_locks l
                           WHERE l.resource_id = r.resource_id AND l.resource_lock_type = 'delete') AS is_deleted,
                   EXISTS (SELECT 1 FROM resource_dependency_types d
                           WHERE d.parent_resource_type = r.resource_type
                             AND d.child_resource_type = ?) AS is_legal
            FROM resources r
            WHERE r.resource_id = ?
            """;

        List<ParentCandidate> results = jdbcTemplate.query(sql, (rs, rowNum) -> new ParentCandidate(
            rs.getLong("resource_id"),
            ResourceType.fromDbName(rs.getString("resource_type")),
            rs.getBoolean("is_deleted"),
            rs.getBoolean("is_legal")
        ), childType.dbName(), resourceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void updateLatestSnapshot(long resourceId, long snapshotId) {
        jdbcTemplate.update("UPDATE resources SET latest_snapshot_id = ? WHERE resource_id = ?",
            snapshotId, resourceId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void addDependency(DependencyEdge edge) {
        String sql = """
            INSERT INTO resource_dependencies (parent_resource_id, child_resource_id)
            VALUES (?, ?)
            ON CONFLICT (parent_resource_id, child_resource_id) DO NOTHING
            """;
        jdbcTemplate.update(sql, edge.parentResourceId(), edge.childResourceId());
    }

    @Override
    public List<Resource> findChildren(long parentResourceId, DeletionPolicy deletionPolicy) {
        String sql = SELECT_RESOURCE + """
             JOIN resource_dependencies d ON d.child_resource_id = r.resource_id
            WHERE d.parent_resource_id = ?
            ORDER BY r.resource_id
            """;
        return jdbcTemplate.query(sql, rowMapper, parentResourceId).stream()
            .filter(r -> deletionPolicy.accepts(r.deleted()))
            .collect(Collectors.toList());
    }

    private static class ResourceRowMapper implements RowMapper<Resource> {
        @Override
        public Resource mapRow(ResultSet rs, int rowNum) throws SQLException {
            long latest = rs.getLong("latest_snapshot_id");
            Long latestSnapshotId = rs.wasNull() ? null : latest;
            return new Resource(
                rs.getLong("resource_id"),
                ResourceType.fromDbName(rs.getString("resource_type")),
                rs.getLong("group_id"),
                rs.getTimestamp("created_on").toInstant(),
                latestSnapshotId,
                rs.getBoolean("is_deleted"),
                rs.getBoolean("is_readonly")
            );
        }
    }
}
