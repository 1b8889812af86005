package com.parish.governance.infrastructure.persistence;

import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.ports.RoleRepository;
import com.parish.security.Permissions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRoleRepository implements RoleRepository {

    private static final String SELECT_ROLE = "SELECT id, tenant_id, name, is_system FROM roles";

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcRoleRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public List<Role> findByTenant(String tenantId) {
        List<RoleRow> rows = jdbc.query(SELECT_ROLE + " WHERE tenant_id = :tenantId ORDER BY is_system DESC, name",
                Map.of("tenantId", tenantId), JdbcRoleRepository::mapRow);
        Map<String, List<String>> permissions = new HashMap<>();
        jdbc.query("""
                        SELECT rp.role_id, rp.permission FROM role_permissions rp
                        JOIN roles r ON r.id = rp.role_id
                        WHERE r.tenant_id = :tenantId
                        """,
                Map.of("tenantId", tenantId),
                rs -> {
                    permissions.computeIfAbsent(rs.getString("role_id"), k -> new ArrayList<>())
                            .add(rs.getString("permission"));
                });
        return rows.stream()
                .map(row -> row.toRole(permissions.getOrDefault(row.id(), List.of())))
                .toList();
    }

    @Override
    public Optional<Role> findById(String tenantId, String roleId) {
        return findOne(SELECT_ROLE + " WHERE tenant_id = :tenantId AND id = :id",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", roleId));
    }

    @Override
    public Optional<Role> findByName(String tenantId, String name) {
        return findOne(SELECT_ROLE + " WHERE tenant_id = :tenantId AND name_key = :nameKey",
                new MapSqlParameterSource()
                        .addValue("tenantId", tenantId)
                        .addValue("nameKey", JdbcSupport.nameKey(name)));
    }

    @Override
    public void insert(Role role) {
        jdbc.update("""
                        INSERT INTO roles (id, tenant_id, name, name_key, is_system, created_at, updated_at)
                        VALUES (:id, :tenantId, :name, :nameKey, :system, :now, :now)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", role.id())
                        .addValue("tenantId", role.tenantId())
                        .addValue("name", role.name())
                        .addValue("nameKey", JdbcSupport.nameKey(role.name()))
                        .addValue("system", role.system())
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
        writePermissions(role);
    }

    @Override
    public void update(Role role) {
        jdbc.update("UPDATE roles SET name = :name, name_key = :nameKey, updated_at = :now WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", role.id())
                        .addValue("name", role.name())
                        .addValue("nameKey", JdbcSupport.nameKey(role.name()))
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
        jdbc.update("DELETE FROM role_permissions WHERE role_id = :id", Map.of("id", role.id()));
        writePermissions(role);
    }

    @Override
    public void delete(String roleId) {
        jdbc.update("DELETE FROM role_permissions WHERE role_id = :id", Map.of("id", roleId));
        jdbc.update("DELETE FROM roles WHERE id = :id", Map.of("id", roleId));
    }

    @Override
    public Map<String, Long> countUsersByRole(String tenantId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query("SELECT role_id, COUNT(*) AS user_count FROM users WHERE tenant_id = :tenantId GROUP BY role_id",
                Map.of("tenantId", tenantId),
                rs -> {
                    counts.put(rs.getString("role_id"), rs.getLong("user_count"));
                });
        return counts;
    }

    @Override
    public long countUsers(String roleId) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users WHERE role_id = :id",
                Map.of("id", roleId), Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public int reassignUsers(String fromRoleId, String toRoleId) {
        return jdbc.update("UPDATE users SET role_id = :to, updated_at = :now WHERE role_id = :from",
                new MapSqlParameterSource()
                        .addValue("from", fromRoleId)
                        .addValue("to", toRoleId)
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    private Optional<Role> findOne(String sql, SqlParameterSource params) {
        List<RoleRow> rows = jdbc.query(sql, params, JdbcRoleRepository::mapRow);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        RoleRow row = rows.get(0);
        List<String> permissions = jdbc.queryForList(
                "SELECT permission FROM role_permissions WHERE role_id = :id",
                Map.of("id", row.id()), String.class);
        return Optional.of(row.toRole(permissions));
    }

    private void writePermissions(Role role) {
        List<String> permissions = role.permissions();
        if (permissions.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = permissions.stream()
                .map(permission -> new MapSqlParameterSource()
                        .addValue("roleId", role.id())
                        .addValue("permission", permission))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate("INSERT INTO role_permissions (role_id, permission) VALUES (:roleId, :permission)", batch);
    }

    private static RoleRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new RoleRow(rs.getString("id"), rs.getString("tenant_id"), rs.getString("name"),
                rs.getBoolean("is_system"));
    }

    private record RoleRow(String id, String tenantId, String name, boolean system) {

        Role toRole(List<String> permissions) {
            return new Role(id, tenantId, name, system, Permissions.normalize(permissions));
        }
    }
}
