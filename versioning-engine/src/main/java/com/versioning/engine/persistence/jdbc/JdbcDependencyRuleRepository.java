package com.versioning.engine.persistence.jdbc;

import com.versioning.core.model.DependencyRule;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.DependencyRuleRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads the resource_dependency_types table.
 */
@Repository("jdbcDependencyRuleRepository")
@ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDependencyRuleRepository implements DependencyRuleRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcDependencyRuleRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isLegal(ResourceType parentType, ResourceType childType) {
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM resource_dependency_types
                WHERE parent_resource_type = ? AND child_resource_type = ?
            )
            """;
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class,
            parentType.dbName(), childType.dbName()));
    }

    @Override
    public Set<DependencyRule> findAll() {
        String sql = "SELECT parent_resource_type, child_resource_type FROM resource_dependency_types";
        return new HashSet<>(jdbcTemplate.query(sql, (rs, rowNum) -> new DependencyRule(
            ResourceType.fromDbName(rs.getString("parent_resource_type")),
            ResourceType.fromDbName(rs.getString("child_resource_type"))
        )));
    }
}
