package com.versioning.engine.persistence.jdbc;

import com.versioning.core.exception.LockConflictException;
import com.versioning.core.model.LockType;
import com.versioning.core.model.ResourceLock;
import com.versioning.core.repository.ResourceLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;

/**
 * PostgreSQL-backed implementation of ResourceLockRepository.
 * The (resource_id, resource_lock_type) primary key turns a racing duplicate into a conflict.
 */
@Repository("jdbcResourceLockRepository")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcResourceLockRepository implements ResourceLockRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResourceLockRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcResourceLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void add(ResourceLock lock) {
        String sql = """
            INSERT INTO resource_locks (resource_id, resource_lock_type, created_on)
            VALUES (?, ?, ?)
            ON CONFLICT (resource_id, resource_lock_type) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            lock.resourceId(),
            lock.lockType().dbName(),
            Timestamp.from(lock.createdOn())
        );

        if (rows == 0) {
            log.debug("Lock already present: {} on resource {}", lock.lockType(), lock.resourceId());
            throw new LockConflictException(lock.resourceId(), lock.lockType().dbName());
        }
    }

    @Override
    public boolean hasLock(long resourceId, LockType lockType) {
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM resource_locks WHERE resource_id = ? AND resource_lock_type = ?
            )
            """;
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, resourceId, lockType.dbName()));
    }

    @Override
    public List<ResourceLock> findByResource(long resourceId) {
        String sql = "SELECT * FROM resource_locks WHERE resource_id = ? ORDER BY created_on";
        return jdbcTemplate.query(sql, (rs, rowNum) -> new ResourceLock(
            rs.getLong("resource_id"),
            LockType.fromDbName(rs.getString("resource_lock_type")),
            rs.getTimestamp("created_on").toInstant()
        ), resourceId);
    }
}
