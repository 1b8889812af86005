package com.parish.governance.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Billing status of a tenant.
 */
public enum TenantStatus {

    ACTIVE("Active"),
    PAST_DUE("Past Due"),
    SUSPENDED("Suspended"),
    CANCELLED("Cancelled");

    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<TenantStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.strip();
        for (TenantStatus status : values()) {
            if (status.value.equalsIgnoreCase(candidate) || status.name().equalsIgnoreCase(candidate)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
