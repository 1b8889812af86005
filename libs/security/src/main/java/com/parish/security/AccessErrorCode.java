package com.parish.security;

/**
 * Machine-readable outcome of a rejected request, with the HTTP status it maps to.
 */
public enum AccessErrorCode {

    UNAUTHENTICATED(401),
    ACCOUNT_NOT_LINKED(403),
    ACCOUNT_SUSPENDED(403),
    NO_BRANCH_ACCESS(403),
    FORBIDDEN(403),
    BAD_REQUEST(400),
    NOT_FOUND(404);

    private final int httpStatus;

    AccessErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
