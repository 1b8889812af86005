package com.parish.security;

/**
 * The identity is valid but no tenant user is registered under its email.
 */
public class AccountNotLinkedException extends AccessControlException {

    public AccountNotLinkedException() {
        super(AccessErrorCode.ACCOUNT_NOT_LINKED,
                "Your account is not linked to a church workspace. Ask your administrator for an invitation.");
    }
}
