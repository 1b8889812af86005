package com.parish.security;

/**
 * The credential is missing, malformed, expired, revoked or could not be verified.
 * <p>
 * The message is for logs only; clients receive a generic body.
 */
public class UnauthenticatedException extends AccessControlException {

    public UnauthenticatedException(String reason) {
        super(AccessErrorCode.UNAUTHENTICATED, reason);
    }

    public UnauthenticatedException(String reason, Throwable cause) {
        super(AccessErrorCode.UNAUTHENTICATED, reason, cause);
    }
}
