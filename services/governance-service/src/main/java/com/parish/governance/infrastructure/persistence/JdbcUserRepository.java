package com.parish.governance.infrastructure.persistence;

import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.model.UserQuery;
import com.parish.governance.domain.ports.UserRepository;
import com.parish.security.BranchScopeMode;
import com.parish.security.SystemRole;
import com.parish.security.UserStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * Tenant users joined with their tenant and role, plus their branch grants.
 */
@Repository
public class JdbcUserRepository implements UserRepository {

    private static final String SELECT_USER = """
            SELECT u.id, u.tenant_id, t.name AS tenant_name, u.email, u.name, u.role_id, r.name AS role_name,
                   u.status, u.branch_scope_mode, u.default_branch_id, u.invited_at, u.activated_at,
                   u.last_login_at, u.last_sign_in_provider, u.created_at
            FROM users u
            JOIN tenants t ON t.id = u.tenant_id
            JOIN roles r ON r.id = u.role_id
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcUserRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<TenantUser> findById(String tenantId, String userId) {
        return findOne(SELECT_USER + " WHERE u.tenant_id = :tenantId AND u.id = :id",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", userId));
    }

    @Override
    public Optional<TenantUser> findAnyById(String userId) {
        return findOne(SELECT_USER + " WHERE u.id = :id", new MapSqlParameterSource("id", userId));
    }

    @Override
    public Optional<TenantUser> findByEmail(String normalizedEmail) {
        return findOne(SELECT_USER + " WHERE u.email = :email", new MapSqlParameterSource("email", normalizedEmail));
    }

    @Override
    public PageResult<TenantUser> find(UserQuery query, PageRequest page) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (query.tenantId() != null) {
            where.append(" AND u.tenant_id = :tenantId");
            params.addValue("tenantId", query.tenantId());
        }
        if (query.status() != null) {
            where.append(" AND u.status = :status");
            params.addValue("status", query.status().value());
        }
        if (query.roleId() != null && !query.roleId().isBlank()) {
            where.append(" AND u.role_id = :roleId");
            params.addValue("roleId", query.roleId());
        }
        String pattern = JdbcSupport.likePattern(query.search());
        if (pattern != null) {
            where.append(" AND (LOWER(u.email) LIKE :search OR LOWER(u.name) LIKE :search)");
            params.addValue("search", pattern);
        }

        Long total = jdbc.queryForObject(
                "SELECT COUNT(*) FROM users u" + where, params, Long.class);
        params.addValue("limit", page.limit()).addValue("offset", page.offset());
        List<TenantUser> users = withBranchIds(jdbc.query(
                SELECT_USER + where + " ORDER BY u.created_at DESC, u.id LIMIT :limit OFFSET :offset",
                params, JdbcUserRepository::mapRow));
        return PageResult.of(users, page, total == null ? 0 : total);
    }

    @Override
    public void insert(TenantUser user) {
        jdbc.update("""
                        INSERT INTO users (id, tenant_id, email, name, role_id, status, branch_scope_mode,
                                           default_branch_id, invited_at, activated_at, last_login_at,
                                           last_sign_in_provider, created_at, updated_at)
                        VALUES (:id, :tenantId, :email, :name, :roleId, :status, :branchScopeMode,
                                :defaultBranchId, :invitedAt, :activatedAt, :lastLoginAt,
                                :lastSignInProvider, :createdAt, :createdAt)
                        """,
                columns(user).addValue("email", user.email())
                        .addValue("createdAt", JdbcSupport.timestamp(user.createdAt())));
    }

    @Override
    public void update(TenantUser user) {
        jdbc.update("""
                        UPDATE users
                        SET tenant_id = :tenantId, name = :name, role_id = :roleId, status = :status,
                            branch_scope_mode = :branchScopeMode, default_branch_id = :defaultBranchId,
                            invited_at = :invitedAt, activated_at = :activatedAt, last_login_at = :lastLoginAt,
                            last_sign_in_provider = :lastSignInProvider, updated_at = :now
                        WHERE id = :id
                        """,
                columns(user).addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    @Override
    public void replaceBranchAccess(String userId, List<String> branchIds) {
        jdbc.update("DELETE FROM user_branch_access WHERE user_id = :userId", Map.of("userId", userId));
        if (branchIds.isEmpty()) {
            return;
        }
        // grant order is kept through created_at, so each row gets a distinct instant
        var base = clock.instant();
        List<SqlParameterSource> batch = new ArrayList<>();
        for (int i = 0; i < branchIds.size(); i++) {
            batch.add(new MapSqlParameterSource()
                    .addValue("userId", userId)
                    .addValue("branchId", branchIds.get(i))
                    .addValue("createdAt", JdbcSupport.timestamp(base.plusMillis(i))));
        }
        jdbc.batchUpdate("""
                        INSERT INTO user_branch_access (user_id, branch_id, created_at)
                        VALUES (:userId, :branchId, :createdAt)
                        """,
                batch.toArray(SqlParameterSource[]::new));
    }

    @Override
    public long countActiveOwners(String tenantId) {
        Long count = jdbc.queryForObject("""
                        SELECT COUNT(*) FROM users u
                        JOIN roles r ON r.id = u.role_id
                        WHERE u.tenant_id = :tenantId
                          AND r.is_system = TRUE
                          AND r.name_key = :ownerKey
                          AND u.status <> :suspended
                        """,
                new MapSqlParameterSource()
                        .addValue("tenantId", tenantId)
                        .addValue("ownerKey", SystemRole.OWNER.displayName().toLowerCase(Locale.ROOT))
                        .addValue("suspended", UserStatus.SUSPENDED.value()),
                Long.class);
        return count == null ? 0 : count;
    }

    private Optional<TenantUser> findOne(String sql, MapSqlParameterSource params) {
        List<TenantUser> rows = withBranchIds(jdbc.query(sql, params, JdbcUserRepository::mapRow));
        return rows.stream().findFirst();
    }

    private List<TenantUser> withBranchIds(List<TenantUser> users) {
        if (users.isEmpty()) {
            return users;
        }
        Map<String, List<String>> grants = new HashMap<>();
        jdbc.query("""
                        SELECT user_id, branch_id FROM user_branch_access
                        WHERE user_id IN (:ids)
                        ORDER BY created_at, branch_id
                        """,
                new MapSqlParameterSource("ids", users.stream().map(TenantUser::id).toList()),
                rs -> {
                    grants.computeIfAbsent(rs.getString("user_id"), k -> new ArrayList<>())
                            .add(rs.getString("branch_id"));
                });
        return users.stream()
                .map(user -> new TenantUser(user.id(), user.tenantId(), user.tenantName(), user.email(),
                        user.name(), user.roleId(), user.roleName(), user.status(), user.branchScopeMode(),
                        user.defaultBranchId(), grants.getOrDefault(user.id(), List.of()), user.invitedAt(),
                        user.activatedAt(), user.lastLoginAt(), user.lastSignInProvider(), user.createdAt()))
                .toList();
    }

    private static MapSqlParameterSource columns(TenantUser user) {
        return new MapSqlParameterSource()
                .addValue("id", user.id())
                .addValue("tenantId", user.tenantId())
                .addValue("name", user.name())
                .addValue("roleId", user.roleId())
                .addValue("status", user.status().value())
                .addValue("branchScopeMode", user.branchScopeMode().name())
                .addValue("defaultBranchId", user.defaultBranchId())
                .addValue("invitedAt", JdbcSupport.timestamp(user.invitedAt()))
                .addValue("activatedAt", JdbcSupport.timestamp(user.activatedAt()))
                .addValue("lastLoginAt", JdbcSupport.timestamp(user.lastLoginAt()))
                .addValue("lastSignInProvider", user.lastSignInProvider());
    }

    static TenantUser mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new TenantUser(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("tenant_name"),
                rs.getString("email"),
                rs.getString("name"),
                rs.getString("role_id"),
                rs.getString("role_name"),
                UserStatus.fromString(rs.getString("status")).orElse(UserStatus.INVITED),
                BranchScopeMode.fromString(rs.getString("branch_scope_mode")),
                rs.getString("default_branch_id"),
                List.of(),
                JdbcSupport.instant(rs, "invited_at"),
                JdbcSupport.instant(rs, "activated_at"),
                JdbcSupport.instant(rs, "last_login_at"),
                rs.getString("last_sign_in_provider"),
                JdbcSupport.instant(rs, "created_at"));
    }
}
