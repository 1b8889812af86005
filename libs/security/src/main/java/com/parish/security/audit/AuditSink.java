package com.parish.security.audit;

/**
 * Port to the append-only audit store.
 */
public interface AuditSink {

    /**
     * Appends an entry. Implementations never update or delete existing entries.
     *
     * @param entry the entry to store
     */
    void append(AuditEntry entry);

    /**
     * Appends an entry before returning and fails if it cannot be stored. Sinks that
     * defer {@link #append} must override this.
     *
     * @param entry the entry to store
     */
    default void appendNow(AuditEntry entry) {
        append(entry);
    }
}
