package com.parish.governance.domain.model;

import java.util.List;

/**
 * A tenant role and its permissions, in catalog order.
 *
 * @param id          role identifier
 * @param tenantId    owning tenant
 * @param name        display name, unique per tenant ignoring case
 * @param system      true for the seeded Owner, Admin, Staff and Viewer roles
 * @param permissions granted permissions
 */
public record Role(String id, String tenantId, String name, boolean system, List<String> permissions) {

    public Role {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public Role withName(String newName) {
        return new Role(id, tenantId, newName, system, permissions);
    }

    public Role withPermissions(List<String> newPermissions) {
        return new Role(id, tenantId, name, system, newPermissions);
    }
}
