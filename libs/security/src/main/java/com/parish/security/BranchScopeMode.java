package com.parish.security;

/**
 * Whether a user sees every branch of their tenant or only the branches granted to them.
 */
public enum BranchScopeMode {

    ALL,
    RESTRICTED;

    /**
     * Parses a stored value. Anything other than {@code RESTRICTED} means {@link #ALL}.
     */
    public static BranchScopeMode fromString(String value) {
        return value != null && RESTRICTED.name().equalsIgnoreCase(value.strip()) ? RESTRICTED : ALL;
    }
}
