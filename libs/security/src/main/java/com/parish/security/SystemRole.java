package com.parish.security;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.parish.security.Permissions.*;

/**
 * The four roles seeded into every tenant, with their permission templates.
 * <p>
 * Seeded roles are flagged as system roles in the store: they cannot be deleted or
 * renamed, so {@link #OWNER} is always found by name when the owner-retention rule runs.
 */
public enum SystemRole {

    OWNER("Owner", List.of(
            BRANCHES_MANAGE, USERS_MANAGE, ROLES_MANAGE, MEMBERS_MANAGE, SERVICES_MANAGE,
            ATTENDANCE_MANAGE, GIVING_MANAGE, EVENTS_MANAGE, GROUPS_MANAGE, WEBSITE_MANAGE,
            REPORTS_VIEW)),
    ADMIN("Admin", List.of(
            BRANCHES_MANAGE, USERS_MANAGE, MEMBERS_MANAGE, SERVICES_MANAGE,
            ATTENDANCE_MANAGE, GIVING_MANAGE, EVENTS_MANAGE, GROUPS_MANAGE, WEBSITE_MANAGE,
            REPORTS_VIEW)),
    STAFF("Staff", List.of(
            MEMBERS_MANAGE, SERVICES_MANAGE, ATTENDANCE_MANAGE, GIVING_MANAGE,
            EVENTS_MANAGE, GROUPS_MANAGE, WEBSITE_MANAGE, REPORTS_VIEW)),
    VIEWER("Viewer", List.of(
            MEMBERS_VIEW, SERVICES_VIEW, ATTENDANCE_VIEW, GIVING_VIEW,
            EVENTS_VIEW, GROUPS_VIEW, REPORTS_VIEW));

    private final String displayName;
    private final List<String> permissions;

    SystemRole(String displayName, List<String> permissions) {
        this.displayName = displayName;
        this.permissions = permissions;
    }

    /** The role name stored per tenant (e.g. "Owner"). */
    public String displayName() {
        return displayName;
    }

    /** Template permissions in catalog order. */
    public List<String> permissions() {
        return Permissions.normalize(permissions);
    }

    /**
     * Looks up a system role by its stored name, ignoring case.
     *
     * @param name the role name to match
     * @return the matching system role, or empty if the name is not a system role
     */
    public static Optional<SystemRole> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = name.strip().toLowerCase(Locale.ROOT);
        for (SystemRole role : values()) {
            if (role.displayName.toLowerCase(Locale.ROOT).equals(candidate)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isOwner(String roleName) {
        return fromName(roleName).filter(role -> role == OWNER).isPresent();
    }
}
