package com.parish.governance.infrastructure.persistence;

import com.parish.governance.domain.model.Branch;
import com.parish.governance.domain.ports.BranchRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Branch rows. {@code active_name_key} holds the lower-cased name while the branch is
 * active and NULL once archived, so the unique constraint only covers active names.
 */
@Repository
public class JdbcBranchRepository implements BranchRepository {

    private static final String SELECT_BRANCH =
            "SELECT id, tenant_id, name, location, is_active, created_at FROM branches";

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcBranchRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public List<Branch> findByTenant(String tenantId, boolean includeArchived, Collection<String> branchIds) {
        StringBuilder sql = new StringBuilder(SELECT_BRANCH).append(" WHERE tenant_id = :tenantId");
        MapSqlParameterSource params = new MapSqlParameterSource("tenantId", tenantId);
        if (!includeArchived) {
            sql.append(" AND is_active = TRUE");
        }
        if (!branchIds.isEmpty()) {
            sql.append(" AND id IN (:ids)");
            params.addValue("ids", branchIds);
        }
        sql.append(" ORDER BY name, id");
        return jdbc.query(sql.toString(), params, JdbcBranchRepository::mapBranch);
    }

    @Override
    public Optional<Branch> findById(String tenantId, String branchId) {
        List<Branch> rows = jdbc.query(SELECT_BRANCH + " WHERE tenant_id = :tenantId AND id = :id",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", branchId),
                JdbcBranchRepository::mapBranch);
        return rows.stream().findFirst();
    }

    @Override
    public List<String> findExistingIds(String tenantId, Collection<String> branchIds) {
        if (branchIds.isEmpty()) {
            return List.of();
        }
        return jdbc.queryForList("SELECT id FROM branches WHERE tenant_id = :tenantId AND id IN (:ids)",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("ids", branchIds),
                String.class);
    }

    @Override
    public List<String> findActiveIds(String tenantId, Collection<String> branchIds) {
        if (branchIds.isEmpty()) {
            return List.of();
        }
        return jdbc.queryForList(
                "SELECT id FROM branches WHERE tenant_id = :tenantId AND is_active = TRUE AND id IN (:ids)",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("ids", branchIds),
                String.class);
    }

    @Override
    public long countActive(String tenantId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM branches WHERE tenant_id = :tenantId AND is_active = TRUE",
                Map.of("tenantId", tenantId), Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public boolean activeNameExists(String tenantId, String name, String excludingBranchId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("nameKey", JdbcSupport.nameKey(name))
                .addValue("excluding", excludingBranchId == null ? "" : excludingBranchId);
        Long count = jdbc.queryForObject("""
                        SELECT COUNT(*) FROM branches
                        WHERE tenant_id = :tenantId AND active_name_key = :nameKey AND id <> :excluding
                        """,
                params, Long.class);
        return count != null && count > 0;
    }

    @Override
    public void insert(Branch branch) {
        jdbc.update("""
                        INSERT INTO branches (id, tenant_id, name, location, is_active, active_name_key, created_at, updated_at)
                        VALUES (:id, :tenantId, :name, :location, :active, :activeNameKey, :createdAt, :createdAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", branch.id())
                        .addValue("tenantId", branch.tenantId())
                        .addValue("name", branch.name())
                        .addValue("location", branch.location())
                        .addValue("active", branch.active())
                        .addValue("activeNameKey", branch.active() ? JdbcSupport.nameKey(branch.name()) : null)
                        .addValue("createdAt", JdbcSupport.timestamp(branch.createdAt())));
    }

    @Override
    public void update(Branch branch) {
        jdbc.update("""
                        UPDATE branches
                        SET name = :name, location = :location, active_name_key = :activeNameKey, updated_at = :now
                        WHERE id = :id
                        """,
                new MapSqlParameterSource()
                        .addValue("id", branch.id())
                        .addValue("name", branch.name())
                        .addValue("location", branch.location())
                        .addValue("activeNameKey", branch.active() ? JdbcSupport.nameKey(branch.name()) : null)
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    @Override
    public void setActive(Branch branch, boolean active) {
        jdbc.update("""
                        UPDATE branches SET is_active = :active, active_name_key = :activeNameKey, updated_at = :now
                        WHERE id = :id
                        """,
                new MapSqlParameterSource()
                        .addValue("id", branch.id())
                        .addValue("active", active)
                        .addValue("activeNameKey", active ? JdbcSupport.nameKey(branch.name()) : null)
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    @Override
    public List<String> findUsersRestrictedToOnly(String tenantId, String branchId) {
        return jdbc.queryForList("""
                        SELECT u.email FROM users u
                        JOIN user_branch_access a ON a.user_id = u.id AND a.branch_id = :branchId
                        WHERE u.tenant_id = :tenantId
                          AND u.branch_scope_mode = 'RESTRICTED'
                          AND NOT EXISTS (
                              SELECT 1 FROM user_branch_access o
                              JOIN branches b ON b.id = o.branch_id
                              WHERE o.user_id = u.id AND o.branch_id <> :branchId AND b.is_active = TRUE)
                        ORDER BY u.email
                        """,
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("branchId", branchId),
                String.class);
    }

    @Override
    public int deleteGrants(String branchId) {
        return jdbc.update("DELETE FROM user_branch_access WHERE branch_id = :branchId", Map.of("branchId", branchId));
    }

    @Override
    public int clearDefaultBranch(String branchId) {
        return jdbc.update("""
                        UPDATE users SET default_branch_id = NULL, updated_at = :now
                        WHERE default_branch_id = :branchId
                        """,
                new MapSqlParameterSource()
                        .addValue("branchId", branchId)
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    private static Branch mapBranch(ResultSet rs, int rowNum) throws SQLException {
        return new Branch(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("location"),
                rs.getBoolean("is_active"),
                JdbcSupport.instant(rs, "created_at"));
    }
}
