package com.parish.security;

/**
 * Base type of every rejection raised by the authorization core.
 * <p>
 * Rejections are never retried and never downgraded: handlers let them propagate and the
 * web layer maps {@link #code()} to a response.
 */
public abstract class AccessControlException extends RuntimeException {

    private final AccessErrorCode code;

    protected AccessControlException(AccessErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected AccessControlException(AccessErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AccessErrorCode code() {
        return code;
    }
}
