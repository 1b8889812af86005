package com.parish.governance.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parish.governance.domain.model.AuditLogQuery;
import com.parish.governance.domain.model.AuditLogRecord;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.ports.AuditLogRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAuditLogRepository implements AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLogRepository.class);

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private static final String SELECT_AUDIT =
            "SELECT id, tenant_id, action, resource, details, actor_email, created_at FROM audit_logs";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcAuditLogRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public PageResult<AuditLogRecord> find(AuditLogQuery query, PageRequest page) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (query.tenantId() != null && !query.tenantId().isBlank()) {
            where.append(" AND tenant_id = :tenantId");
            params.addValue("tenantId", query.tenantId());
        }
        String action = JdbcSupport.likePattern(query.action());
        if (action != null) {
            where.append(" AND LOWER(action) LIKE :action");
            params.addValue("action", action);
        }
        if (query.actionPrefix() != null) {
            where.append(" AND action LIKE :actionPrefix");
            params.addValue("actionPrefix", query.actionPrefix().replace("_", "\\_") + "%");
        }
        if (query.from() != null) {
            where.append(" AND created_at >= :from");
            params.addValue("from", JdbcSupport.timestamp(query.from()));
        }
        if (query.to() != null) {
            where.append(" AND created_at <= :to");
            params.addValue("to", JdbcSupport.timestamp(query.to()));
        }
        String search = JdbcSupport.likePattern(query.search());
        if (search != null) {
            where.append(" AND (LOWER(action) LIKE :search OR LOWER(resource) LIKE :search"
                    + " OR LOWER(actor_email) LIKE :search)");
            params.addValue("search", search);
        }

        Long total = jdbc.queryForObject("SELECT COUNT(*) FROM audit_logs" + where, params, Long.class);
        params.addValue("limit", page.limit()).addValue("offset", page.offset());
        List<AuditLogRecord> rows = jdbc.query(
                SELECT_AUDIT + where + " ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset",
                params, this::mapRecord);
        return PageResult.of(rows, page, total == null ? 0 : total);
    }

    @Override
    public Optional<AuditLogRecord> findById(String id) {
        List<AuditLogRecord> rows = jdbc.query(SELECT_AUDIT + " WHERE id = :id", Map.of("id", id), this::mapRecord);
        return rows.stream().findFirst();
    }

    private AuditLogRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new AuditLogRecord(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("action"),
                rs.getString("resource"),
                readDetails(rs.getString("id"), rs.getString("details")),
                rs.getString("actor_email"),
                JdbcSupport.instant(rs, "created_at"));
    }

    private Map<String, Object> readDetails(String id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit details for entry {}", id, e);
            return Map.of("raw", json);
        }
    }
}
