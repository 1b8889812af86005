package com.parish.security;

/**
 * A branch-restricted user has no grant on any active branch of their tenant.
 */
public class NoBranchAccessException extends AccessControlException {

    public NoBranchAccessException() {
        super(AccessErrorCode.NO_BRANCH_ACCESS,
                "Your account has no branch access assigned. Contact your church administrator.");
    }
}
