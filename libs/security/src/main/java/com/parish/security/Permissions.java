package com.parish.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed permission catalog. Roles may only hold permissions listed here.
 */
public final class Permissions {

    public static final String BRANCHES_MANAGE = "branches.manage";
    public static final String USERS_MANAGE = "users.manage";
    public static final String ROLES_MANAGE = "roles.manage";
    public static final String MEMBERS_MANAGE = "members.manage";
    public static final String MEMBERS_VIEW = "members.view";
    public static final String SERVICES_MANAGE = "services.manage";
    public static final String SERVICES_VIEW = "services.view";
    public static final String ATTENDANCE_MANAGE = "attendance.manage";
    public static final String ATTENDANCE_VIEW = "attendance.view";
    public static final String GIVING_MANAGE = "giving.manage";
    public static final String GIVING_VIEW = "giving.view";
    public static final String EVENTS_MANAGE = "events.manage";
    public static final String EVENTS_VIEW = "events.view";
    public static final String GROUPS_MANAGE = "groups.manage";
    public static final String GROUPS_VIEW = "groups.view";
    public static final String WEBSITE_MANAGE = "website.manage";
    public static final String REPORTS_VIEW = "reports.view";

    /** Catalog in display order. */
    public static final List<String> CATALOG = List.of(
            BRANCHES_MANAGE, USERS_MANAGE, ROLES_MANAGE,
            MEMBERS_MANAGE, MEMBERS_VIEW,
            SERVICES_MANAGE, SERVICES_VIEW,
            ATTENDANCE_MANAGE, ATTENDANCE_VIEW,
            GIVING_MANAGE, GIVING_VIEW,
            EVENTS_MANAGE, EVENTS_VIEW,
            GROUPS_MANAGE, GROUPS_VIEW,
            WEBSITE_MANAGE, REPORTS_VIEW
    );

    private static final Set<String> KNOWN = Set.copyOf(CATALOG);

    private Permissions() {
        // utility class
    }

    public static boolean isKnown(String permission) {
        return permission != null && KNOWN.contains(permission);
    }

    /**
     * Trims the requested permissions, drops anything outside the catalog and duplicates,
     * and returns the rest in catalog order.
     *
     * @param requested raw permission strings (may be null)
     * @return the normalized permissions, possibly empty
     */
    public static List<String> normalize(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String permission : requested) {
            if (permission != null) {
                wanted.add(permission.strip());
            }
        }
        return CATALOG.stream().filter(wanted::contains).toList();
    }
}
