package com.parish.governance.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parish.observability.MetricFactory;
import com.parish.security.audit.AuditEntry;
import com.parish.security.audit.AuditSink;
import io.micrometer.core.instrument.Counter;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Appends audit entries to {@code audit_logs}.
 *
 * <p>Inside a transaction the insert is deferred until after commit and runs in its own
 * transaction, so a rolled-back mutation leaves no audit row and a failing audit insert
 * cannot undo a committed mutation. Deferred failures are logged and counted. Outside a
 * transaction the insert runs immediately and failures reach the caller.
 *
 * <p>{@link #appendNow} never defers: it joins the current transaction, if any, and
 * failures always reach the caller.
 */
@Component
public class JdbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;
    private final Counter deferredFailures;

    public JdbcAuditSink(NamedParameterJdbcTemplate jdbc,
                         ObjectMapper objectMapper,
                         PlatformTransactionManager transactionManager,
                         MetricFactory metrics) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.deferredFailures = metrics.counter("parish.audit.write.failures",
                "Audit entries lost after the business transaction committed", "mode", "after-commit");
    }

    @Override
    public void append(AuditEntry entry) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            insert(entry);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    requiresNew.executeWithoutResult(status -> insert(entry));
                } catch (RuntimeException e) {
                    deferredFailures.increment();
                    log.warn("Deferred audit write failed: action={}, tenantId={}",
                            entry.action(), entry.tenantId(), e);
                }
            }
        });
    }

    @Override
    public void appendNow(AuditEntry entry) {
        insert(entry);
    }

    private void insert(AuditEntry entry) {
        jdbc.update("""
                        INSERT INTO audit_logs (id, tenant_id, action, resource, details, actor_email, created_at)
                        VALUES (:id, :tenantId, :action, :resource, :details, :actorEmail, :createdAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", UUID.randomUUID().toString())
                        .addValue("tenantId", entry.tenantId())
                        .addValue("action", entry.action().name())
                        .addValue("resource", entry.resource())
                        .addValue("details", toJson(entry))
                        .addValue("actorEmail", entry.actorEmail())
                        .addValue("createdAt", JdbcSupport.timestamp(entry.createdAt())));
    }

    private String toJson(AuditEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.details());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit details are not serializable: " + entry.action(), e);
        }
    }
}
