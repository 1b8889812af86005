package com.parish.governance.infrastructure.persistence;

import com.parish.security.BranchScopeMode;
import com.parish.security.LinkedAccount;
import com.parish.security.TenantDirectory;
import com.parish.security.TenantRef;
import com.parish.security.UserStatus;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Session-resolution view of the store.
 *
 * <p>Only grants on active branches of the user's own tenant are reported. A default
 * branch that is archived, foreign, or outside the grants of a restricted user is reported
 * as absent.
 */
@Repository
public class JdbcTenantDirectory implements TenantDirectory {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTenantDirectory(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<LinkedAccount> findLinkedAccount(String normalizedEmail) {
        List<AccountRow> rows = jdbc.query("""
                        SELECT u.id, u.tenant_id, t.name AS tenant_name, u.email, u.status, u.role_id,
                               r.name AS role_name, u.branch_scope_mode, u.default_branch_id
                        FROM users u
                        JOIN tenants t ON t.id = u.tenant_id
                        JOIN roles r ON r.id = u.role_id
                        WHERE u.email = :email
                        """,
                Map.of("email", normalizedEmail),
                (rs, rowNum) -> new AccountRow(
                        rs.getString("id"),
                        rs.getString("tenant_id"),
                        rs.getString("tenant_name"),
                        rs.getString("email"),
                        UserStatus.fromString(rs.getString("status")).orElse(UserStatus.INVITED),
                        rs.getString("role_id"),
                        rs.getString("role_name"),
                        BranchScopeMode.fromString(rs.getString("branch_scope_mode")),
                        rs.getString("default_branch_id")));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        AccountRow row = rows.get(0);

        List<String> permissions = jdbc.queryForList(
                "SELECT permission FROM role_permissions WHERE role_id = :roleId",
                Map.of("roleId", row.roleId()), String.class);
        List<String> grants = jdbc.queryForList("""
                        SELECT a.branch_id FROM user_branch_access a
                        JOIN branches b ON b.id = a.branch_id
                        WHERE a.user_id = :userId AND b.tenant_id = :tenantId AND b.is_active = TRUE
                        ORDER BY a.created_at, a.branch_id
                        """,
                new MapSqlParameterSource().addValue("userId", row.userId()).addValue("tenantId", row.tenantId()),
                String.class);

        return Optional.of(new LinkedAccount(
                row.userId(),
                row.tenantId(),
                row.tenantName(),
                row.email(),
                row.status(),
                row.roleId(),
                row.roleName(),
                new HashSet<>(permissions),
                row.mode(),
                grants,
                usableDefaultBranch(row, grants)));
    }

    @Override
    public Optional<TenantRef> findTenant(String tenantId) {
        List<TenantRef> rows = jdbc.query("SELECT id, name, status FROM tenants WHERE id = :id",
                Map.of("id", tenantId),
                (rs, rowNum) -> new TenantRef(rs.getString("id"), rs.getString("name"), rs.getString("status")));
        return rows.stream().findFirst();
    }

    private String usableDefaultBranch(AccountRow row, List<String> grants) {
        String defaultBranchId = row.defaultBranchId();
        if (defaultBranchId == null) {
            return null;
        }
        if (row.mode() == BranchScopeMode.RESTRICTED) {
            return grants.contains(defaultBranchId) ? defaultBranchId : null;
        }
        List<String> active = jdbc.queryForList(
                "SELECT id FROM branches WHERE id = :id AND tenant_id = :tenantId AND is_active = TRUE",
                new MapSqlParameterSource().addValue("id", defaultBranchId).addValue("tenantId", row.tenantId()),
                String.class);
        return active.isEmpty() ? null : defaultBranchId;
    }

    private record AccountRow(String userId, String tenantId, String tenantName, String email, UserStatus status,
                              String roleId, String roleName, BranchScopeMode mode, String defaultBranchId) {
    }
}
