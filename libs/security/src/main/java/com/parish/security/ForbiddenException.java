package com.parish.security;

/**
 * The caller is authenticated but not allowed to perform the operation: a missing
 * permission, a branch outside their grants, or the wrong kind of session for the route.
 */
public class ForbiddenException extends AccessControlException {

    public ForbiddenException(String message) {
        super(AccessErrorCode.FORBIDDEN, message);
    }
}
