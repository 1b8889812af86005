package com.parish.security.audit;

/**
 * Action tags written to the audit trail. Stored by {@link #name()}.
 */
public enum AuditAction {

    ROLE_CREATED,
    ROLE_UPDATED,
    ROLE_DELETED,

    BRANCH_CREATED,
    BRANCH_UPDATED,
    BRANCH_ARCHIVED,
    BRANCH_UNARCHIVED,

    USER_INVITED,
    USER_INVITE_RESENT,
    USER_UPDATED,
    USER_CLAIMED,

    PLATFORM_USER_STATUS_UPDATED,
    PLATFORM_USER_ROLE_UPDATED,
    PLATFORM_USER_ACCESS_RESET,

    TENANT_STATUS_UPDATED,
    TENANT_PLAN_UPDATED,

    IMPERSONATION_STARTED,
    IMPERSONATION_ENDED;

    /** Prefix shared by every impersonation action. */
    public static final String IMPERSONATION_PREFIX = "IMPERSONATION_";
}
