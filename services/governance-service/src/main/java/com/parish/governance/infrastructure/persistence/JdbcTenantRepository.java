package com.parish.governance.infrastructure.persistence;

import com.parish.governance.domain.model.Plan;
import com.parish.governance.domain.model.Tenant;
import com.parish.governance.domain.model.TenantStatus;
import com.parish.governance.domain.ports.TenantRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTenantRepository implements TenantRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcTenantRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        List<Tenant> rows = jdbc.query(
                "SELECT id, name, status, plan_id, created_at FROM tenants WHERE id = :id",
                Map.of("id", tenantId), JdbcTenantRepository::mapTenant);
        return rows.stream().findFirst();
    }

    @Override
    public boolean lockForUpdate(String tenantId) {
        List<String> ids = jdbc.queryForList(
                "SELECT id FROM tenants WHERE id = :id FOR UPDATE", Map.of("id", tenantId), String.class);
        return !ids.isEmpty();
    }

    @Override
    public void updateStatus(String tenantId, TenantStatus status) {
        jdbc.update("UPDATE tenants SET status = :status, updated_at = :now WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", tenantId)
                        .addValue("status", status.value())
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    @Override
    public void updatePlan(String tenantId, String planId) {
        jdbc.update("UPDATE tenants SET plan_id = :planId, updated_at = :now WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", tenantId)
                        .addValue("planId", planId)
                        .addValue("now", JdbcSupport.timestamp(clock.instant())));
    }

    @Override
    public Optional<Plan> findPlan(String planId) {
        List<Plan> rows = jdbc.query("SELECT id, name FROM plans WHERE id = :id", Map.of("id", planId),
                (rs, rowNum) -> new Plan(rs.getString("id"), rs.getString("name")));
        return rows.stream().findFirst();
    }

    private static Tenant mapTenant(ResultSet rs, int rowNum) throws SQLException {
        return new Tenant(
                rs.getString("id"),
                rs.getString("name"),
                TenantStatus.fromString(rs.getString("status")).orElse(TenantStatus.ACTIVE),
                rs.getString("plan_id"),
                JdbcSupport.instant(rs, "created_at"));
    }
}
