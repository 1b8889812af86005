package com.parish.security;

/**
 * The three mutually exclusive shapes a resolved {@link SecurityContext} can take.
 */
public enum SessionKind {

    /** A user linked to exactly one tenant through a user record. */
    TENANT_USER,

    /** A platform operator from the allow-list. Has no tenant and no permissions. */
    PLATFORM_ADMIN,

    /** A platform operator acting inside one tenant through a signed, time-boxed grant. */
    IMPERSONATION
}
