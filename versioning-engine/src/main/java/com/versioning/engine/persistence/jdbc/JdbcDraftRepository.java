package com.versioning.engine.persistence.jdbc;

import com.versioning.core.codec.DraftPayloadCodec;
import com.versioning.core.exception.DraftAlreadyExistsException;
import com.versioning.core.model.Draft;
import com.versioning.core.model.DraftType;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.DraftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

/**
 * PostgreSQL-backed implementation of DraftRepository.
 * The payload is stored as a jsonb object; the partial unique index on
 * (payload resource_id, user_id) backs the one-modification-per-user rule.
 */
@Repository("jdbcDraftRepository")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDraftRepository implements DraftRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDraftRepository.class);

    private static final String RESOURCE_ID_EXPR = "(payload->>'resource_id')::bigint";

    private final JdbcTemplate jdbcTemplate;
    private final DraftPayloadCodec payloadCodec;
    private final DraftRowMapper rowMapper;

    public JdbcDraftRepository(JdbcTemplate jdbcTemplate, DraftPayloadCodec payloadCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.payloadCodec = payloadCodec;
        this.rowMapper = new DraftRowMapper();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Draft save(Draft draft) {
        // a primary key clash would abort the transaction, so explicit ids are checked first
        if (draft.draftId() != null && existsById(draft.draftId())) {
            throw new DraftAlreadyExistsException("draft", draft.draftId());
        }

        String sql = """
            INSERT INTO draft_resources (
                draft_resource_id, resource_type, group_id, user_id,
                payload, created_on, last_modified_on
            ) VALUES (
                COALESCE(?::bigint, nextval(pg_get_serial_sequence('draft_resources', 'draft_resource_id'))),
                ?, ?, ?, ?::jsonb, ?, ?
            )
            ON CONFLICT (((payload->>'resource_id')::bigint), user_id)
                WHERE payload->>'resource_id' IS NOT NULL
                DO NOTHING
            RETURNING draft_resource_id
            """;

        List<Long> ids = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1),
            draft.draftId(),
            draft.resourceType().dbName(),
            draft.targetOwnerGroupId(),
            draft.creatorId(),
            payloadCodec.toJsonString(draft.payload()),
            toTimestamp(draft.createdOn()),
            toTimestamp(draft.lastModifiedOn())
        );

        if (ids.isEmpty()) {
            log.debug("Draft insert skipped by the one-modification-per-user index: user={} resource={}",
                draft.creatorId(), draft.payload().resourceId());
            throw new DraftAlreadyExistsException(draft.resourceType().dbName(), draft.payload().resourceId());
        }
        if (draft.draftId() != null) {
            advanceIdSequence();
        }
        return draft.withId(ids.get(0));
    }

    /**
     * Moves the id sequence past the highest stored id so generated ids
     * never collide with explicitly assigned ones.
     */
    private void advanceIdSequence() {
        String sql = """
            SELECT setval(
                pg_get_serial_sequence('draft_resources', 'draft_resource_id'),
                (SELECT MAX(draft_resource_id) FROM draft_resources)
            )
            """;
        jdbcTemplate.queryForObject(sql, Long.class);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean update(Draft draft) {
        String sql = """
            UPDATE draft_resources SET
                payload = ?::jsonb,
                last_modified_on = ?
            WHERE draft_resource_id = ?
            """;

        int rows = jdbcTemplate.update(sql,
            payloadCodec.toJsonString(draft.payload()),
            toTimestamp(draft.lastModifiedOn()),
            draft.draftId()
        );
        return rows > 0;
    }

    @Override
    public Optional<Draft> findById(long draftId) {
        String sql = "SELECT * FROM draft_resources WHERE draft_resource_id = ?";
        List<Draft> results = jdbcTemplate.query(sql, rowMapper, draftId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Draft> find(long draftId, ResourceType resourceType, Long creatorId) {
        StringBuilder sql = new StringBuilder("SELECT * FROM draft_resources WHERE draft_resource_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(draftId);
        if (resourceType != null) {
            sql.append(" AND resource_type = ?");
            args.add(resourceType.dbName());
        }
        if (creatorId != null) {
            sql.append(" AND user_id = ?");
            args.add(creatorId);
        }
        List<Draft> results = jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean existsById(long draftId) {
        String sql = "SELECT EXISTS (SELECT 1 FROM draft_resources WHERE draft_resource_id = ?)";
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, draftId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean deleteById(long draftId) {
        return jdbcTemplate.update("DELETE FROM draft_resources WHERE draft_resource_id = ?", draftId) > 0;
    }

    @Override
    public Optional<Draft> findModificationByUser(long userId, long resourceId) {
        String sql = "SELECT * FROM draft_resources WHERE " + RESOURCE_ID_EXPR + " = ? AND user_id = ?";
        List<Draft> results = jdbcTemplate.query(sql, rowMapper, resourceId, userId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public int countModifications(long resourceId, Long exceptUserId) {
        String sql = "SELECT COUNT(*) FROM draft_resources WHERE " + RESOURCE_ID_EXPR + " = ?";
        Integer count = exceptUserId == null
            ? jdbcTemplate.queryForObject(sql, Integer.class, resourceId)
            : jdbcTemplate.queryForObject(sql + " AND user_id <> ?", Integer.class, resourceId, exceptUserId);
        return count != null ? count : 0;
    }

    @Override
    public long countByFilter(DraftFilter filter) {
        FilterClause where = whereClause(filter);
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM draft_resources " + where.sql(), Long.class, where.args().toArray());
        return count != null ? count : 0L;
    }

    @Override
    public List<Draft> findByFilter(DraftFilter filter, int pageStart, int pageLength) {
        FilterClause where = whereClause(filter);
        List<Object> args = new ArrayList<>(where.args());
        StringBuilder sql = new StringBuilder("SELECT * FROM draft_resources ")
            .append(where.sql())
            .append(" ORDER BY draft_resource_id OFFSET ?");
        args.add(pageStart);
        if (pageLength > 0) {
            sql.append(" LIMIT ?");
            args.add(pageLength);
        }
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    public Set<Long> findResourceIdsWithModifications(Collection<Long> resourceIds, Long userId) {
        if (resourceIds.isEmpty()) {
            return Set.of();
        }
        List<Object> args = new ArrayList<>(resourceIds);
        StringBuilder sql = new StringBuilder("SELECT DISTINCT ")
            .append(RESOURCE_ID_EXPR)
            .append(" FROM draft_resources WHERE ")
            .append(RESOURCE_ID_EXPR)
            .append(" IN (")
            .append(String.join(", ", Collections.nCopies(resourceIds.size(), "?")))
            .append(")");
        if (userId != null) {
            sql.append(" AND user_id = ?");
            args.add(userId);
        }
        return new HashSet<>(jdbcTemplate.query(sql.toString(), (rs, rowNum) -> rs.getLong(1), args.toArray()));
    }

    @Override
    public boolean existsModification(long resourceId, Long userId) {
        String sql = "SELECT EXISTS (SELECT 1 FROM draft_resources WHERE " + RESOURCE_ID_EXPR + " = ?"
            + (userId != null ? " AND user_id = ?" : "") + ")";
        Boolean exists = userId != null
            ? jdbcTemplate.queryForObject(sql, Boolean.class, resourceId, userId)
            : jdbcTemplate.queryForObject(sql, Boolean.class, resourceId);
        return Boolean.TRUE.equals(exists);
    }

    // ========== Helper Methods ==========

    private FilterClause whereClause(DraftFilter filter) {
        StringBuilder sql = new StringBuilder("WHERE user_id = ? AND resource_type = ?");
        List<Object> args = new ArrayList<>();
        args.add(filter.userId());
        args.add(filter.resourceType().dbName());

        if (filter.groupId() != null) {
            sql.append(" AND group_id = ?");
            args.add(filter.groupId());
        }
        if (filter.baseResourceId() != null) {
            sql.append(" AND (payload->>'base_resource_id')::bigint = ?");
            args.add(filter.baseResourceId());
        }
        if (filter.draftType() == DraftType.RESOURCE) {
            sql.append(" AND payload->>'resource_id' IS NULL");
        } else if (filter.draftType() == DraftType.MODIFICATION) {
            sql.append(" AND payload->>'resource_id' IS NOT NULL");
        }
        return new FilterClause(sql.toString(), args);
    }

    private Timestamp toTimestamp(java.time.Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private record FilterClause(String sql, List<Object> args) {}

    private class DraftRowMapper implements RowMapper<Draft> {
        @Override
        public Draft mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Draft(
                rs.getLong("draft_resource_id"),
                ResourceType.fromDbName(rs.getString("resource_type")),
                rs.getLong("group_id"),
                rs.getLong("user_id"),
                payloadCodec.fromJsonString(rs.getString("payload")),
                rs.getTimestamp("created_on").toInstant(),
                rs.getTimestamp("last_modified_on").toInstant()
            );
        }
    }
}
