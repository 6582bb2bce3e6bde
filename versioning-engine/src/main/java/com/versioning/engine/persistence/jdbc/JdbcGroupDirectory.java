package com.versioning.engine.persistence.jdbc;

import com.versioning.core.model.ExistenceResult;
import com.versioning.core.repository.GroupDirectory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads users, groups and memberships maintained by the surrounding platform.
 * A user or group is deleted when it carries a 'delete' lock.
 */
@Repository("jdbcGroupDirectory")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcGroupDirectory implements GroupDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcGroupDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public ExistenceResult userExists(long userId) {
        String sql = """
            SELECT EXISTS (SELECT 1 FROM user_locks l
                           WHERE l.user_id = u.user_id AND l.user_lock_type = 'delete') AS is_deleted
            FROM users u
            WHERE u.user_id = ?
            """;
        return existence(jdbcTemplate.queryForList(sql, Boolean.class, userId));
    }

    @Override
    public ExistenceResult groupExists(long groupId) {
        String sql = """
            SELECT EXISTS (SELECT 1 FROM group_locks l
                           WHERE l.group_id = g.group_id AND l.group_lock_type = 'delete') AS is_deleted
            FROM groups g
            WHERE g.group_id = ?
            """;
        return existence(jdbcTemplate.queryForList(sql, Boolean.class, groupId));
    }

    @Override
    public boolean isMember(long userId, long groupId) {
        String sql = "SELECT EXISTS (SELECT 1 FROM group_members WHERE user_id = ? AND group_id = ?)";
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, userId, groupId));
    }

    private static ExistenceResult existence(List<Boolean> deletedFlags) {
        if (deletedFlags.isEmpty()) {
            return ExistenceResult.DOES_NOT_EXIST;
        }
        return ExistenceResult.of(true, Boolean.TRUE.equals(deletedFlags.get(0)));
    }
}
