package com.parish.security;

/**
 * The request violates a business rule (e.g. removing the last active Owner, archiving
 * the last active branch, a restricted write without a branch).
 */
public class BadRequestException extends AccessControlException {

    public BadRequestException(String message) {
        super(AccessErrorCode.BAD_REQUEST, message);
    }
}
