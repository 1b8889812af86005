package com.parish.governance.domain.ports;

import com.parish.governance.domain.model.Role;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface RoleRepository {

    List<Role> findByTenant(String tenantId);

    Optional<Role> findById(String tenantId, String roleId);

    /** Case-insensitive lookup. */
    Optional<Role> findByName(String tenantId, String name);

    void insert(Role role);

    /** Writes name and permissions. */
    void update(Role role);

    void delete(String roleId);

    /** User count per role id; roles without users are absent. */
    Map<String, Long> countUsersByRole(String tenantId);

    long countUsers(String roleId);

    int reassignUsers(String fromRoleId, String toRoleId);
}
