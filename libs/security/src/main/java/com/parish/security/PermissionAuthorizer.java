package com.parish.security;

import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a context holds the permissions an operation declares.
 * <p>
 * Plain set containment: no hierarchy between permissions, no caching. A context holding
 * {@value #WILDCARD} satisfies every requirement.
 */
public final class PermissionAuthorizer {

    /** Permission that grants everything. Only impersonation contexts carry it. */
    public static final String WILDCARD = "*";

    private PermissionAuthorizer() {
        // utility class
    }

    /**
     * Rejects the request unless the context holds every required permission.
     *
     * @param context  resolved context
     * @param required permissions declared by the operation (empty means no requirement)
     * @throws ForbiddenException naming the missing permissions
     */
    public static void authorize(SecurityContext context, Set<String> required) {
        Set<String> missing = missing(context, required);
        if (!missing.isEmpty()) {
            throw new ForbiddenException("Missing permission: " + String.join(", ", missing));
        }
    }

    public static boolean isAuthorized(SecurityContext context, Set<String> required) {
        return missing(context, required).isEmpty();
    }

    /**
     * Returns the required permissions the context lacks, sorted.
     */
    public static Set<String> missing(SecurityContext context, Set<String> required) {
        if (required == null || required.isEmpty()) {
            return Set.of();
        }
        Set<String> granted = context.permissions();
        if (granted.contains(WILDCARD)) {
            return Set.of();
        }
        Set<String> missing = new TreeSet<>(required);
        missing.removeAll(granted);
        return missing;
    }
}
