package com.parish.security.audit;

import com.parish.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Writes audit entries for privileged mutations.
 * <p>
 * {@link #record} is best effort: a failing sink is logged and the business mutation
 * stands. {@link #recordRequired} is used where the audit entry is part of the operation's
 * contract (impersonation start and stop) and propagates the failure.
 * Details are redacted before they reach the sink.
 */
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditSink sink;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public AuditRecorder(AuditSink sink, SensitiveDataRedactor redactor, Clock clock) {
        this.sink = sink;
        this.redactor = redactor;
        this.clock = clock;
    }

    /**
     * Records an entry, logging and swallowing any sink failure.
     *
     * @param tenantId   affected tenant, null for platform-scope events
     * @param action     action tag
     * @param resource   resource kind
     * @param details    structured details (before/after values)
     * @param actorEmail actor
     */
    public void record(String tenantId, AuditAction action, String resource,
                       Map<String, ?> details, String actorEmail) {
        AuditEntry entry = build(tenantId, action, resource, details, actorEmail);
        try {
            sink.append(entry);
        } catch (RuntimeException e) {
            log.warn("Audit write failed: action={}, tenantId={}, resource={}", action, tenantId, resource, e);
        }
    }

    /**
     * Records an entry immediately and propagates any sink failure to the caller.
     */
    public void recordRequired(String tenantId, AuditAction action, String resource,
                               Map<String, ?> details, String actorEmail) {
        sink.appendNow(build(tenantId, action, resource, details, actorEmail));
    }

    private AuditEntry build(String tenantId, AuditAction action, String resource,
                             Map<String, ?> details, String actorEmail) {
        return new AuditEntry(tenantId, action, resource, redactor.redact(details), actorEmail, clock.instant());
    }
}
