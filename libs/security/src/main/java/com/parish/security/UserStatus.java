package com.parish.security;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Lifecycle status of a tenant user.
 */
public enum UserStatus {

    INVITED("Invited"),
    ACTIVE("Active"),
    SUSPENDED("Suspended");

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    /** The stored and displayed representation (e.g. "Active"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Looks up a status by its stored value, ignoring case and surrounding whitespace.
     *
     * @param value the string to match
     * @return the matching status, or empty if not found
     */
    public static Optional<UserStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.strip();
        for (UserStatus status : values()) {
            if (status.value.equalsIgnoreCase(candidate) || status.name().equalsIgnoreCase(candidate)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
