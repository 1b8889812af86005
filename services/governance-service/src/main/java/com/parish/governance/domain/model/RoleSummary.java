package com.parish.governance.domain.model;

import java.util.List;

/**
 * A role as listed to tenant administrators, with the number of users holding it.
 */
public record RoleSummary(String id, String name, boolean system, List<String> permissions, long userCount) {

    public static RoleSummary of(Role role, long userCount) {
        return new RoleSummary(role.id(), role.name(), role.system(), role.permissions(), userCount);
    }
}
