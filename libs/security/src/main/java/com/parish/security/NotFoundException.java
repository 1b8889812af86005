package com.parish.security;

/**
 * The referenced resource does not exist within the caller's tenant. Resources of other
 * tenants are reported the same way so their existence is not revealed.
 */
public class NotFoundException extends AccessControlException {

    public NotFoundException(String message) {
        super(AccessErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String resource, String id) {
        return new NotFoundException("%s '%s' not found".formatted(resource, id));
    }
}
