package com.parish.security;

public class AccountSuspendedException extends AccessControlException {

    public AccountSuspendedException() {
        super(AccessErrorCode.ACCOUNT_SUSPENDED,
                "Your account has been suspended. Contact your church administrator.");
    }
}
