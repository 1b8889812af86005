package com.parish.security.testing;

import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditEntry;
import com.parish.security.audit.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit sink that keeps entries in memory. Can be switched into a failing mode to
 * exercise audit-failure paths.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void append(AuditEntry entry) {
        if (failing) {
            throw new IllegalStateException("audit store unavailable");
        }
        entries.add(entry);
    }

    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> entries(AuditAction action) {
        return entries.stream().filter(entry -> entry.action() == action).toList();
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public void clear() {
        entries.clear();
    }
}
