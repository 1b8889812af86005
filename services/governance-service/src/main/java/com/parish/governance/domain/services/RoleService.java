package com.parish.governance.domain.services;

import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.model.RoleSummary;
import com.parish.governance.domain.ports.RoleRepository;
import com.parish.security.BadRequestException;
import com.parish.security.NotFoundException;
import com.parish.security.Permissions;
import com.parish.security.SecurityContext;
import com.parish.security.SystemRole;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant roles: listing with lazy seeding of the system roles, and custom role management.
 */
@Service
public class RoleService {

    static final String AUDIT_RESOURCE = "Role";
    static final int MAX_NAME_LENGTH = 100;

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final RoleRepository roles;
    private final TenantLocks tenantLocks;
    private final AuditRecorder auditRecorder;

    public RoleService(RoleRepository roles, TenantLocks tenantLocks, AuditRecorder auditRecorder) {
        this.roles = roles;
        this.tenantLocks = tenantLocks;
        this.auditRecorder = auditRecorder;
    }

    @Transactional
    public List<RoleSummary> list(SecurityContext context) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        ensureSystemRoles(tenantId);
        Map<String, Long> counts = roles.countUsersByRole(tenantId);
        return roles.findByTenant(tenantId).stream()
                .map(role -> RoleSummary.of(role, counts.getOrDefault(role.id(), 0L)))
                .toList();
    }

    /**
     * Seeds any missing system role from its template. Idempotent: runs under the tenant
     * lock and only inserts roles that are still missing.
     */
    @Transactional
    public void ensureSystemRoles(String tenantId) {
        Set<String> present = roles.findByTenant(tenantId).stream()
                .filter(Role::system)
                .map(Role::name)
                .collect(Collectors.toSet());
        if (present.size() >= SystemRole.values().length) {
            return;
        }
        tenantLocks.lock(tenantId);
        for (SystemRole systemRole : SystemRole.values()) {
            if (roles.findByName(tenantId, systemRole.displayName()).isEmpty()) {
                roles.insert(new Role(UUID.randomUUID().toString(), tenantId, systemRole.displayName(), true,
                        systemRole.permissions()));
                log.info("Seeded system role {} for tenant {}", systemRole.displayName(), tenantId);
            }
        }
    }

    @Transactional
    public Role create(SecurityContext context, String name, Collection<String> permissions) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        String roleName = requireName(name);
        if (roles.findByName(tenantId, roleName).isPresent() || SystemRole.fromName(roleName).isPresent()) {
            throw new BadRequestException("A role with this name already exists.");
        }
        Role role = new Role(UUID.randomUUID().toString(), tenantId, roleName, false, catalogPermissions(permissions));
        roles.insert(role);

        auditRecorder.record(tenantId, AuditAction.ROLE_CREATED, AUDIT_RESOURCE,
                AuditDetails.of("roleId", role.id(), "name", role.name(), "permissions", role.permissions()),
                context.email());
        return role;
    }

    /**
     * Renames a custom role and/or replaces its permissions. Null arguments leave the
     * field unchanged. System roles keep their name.
     */
    @Transactional
    public Role update(SecurityContext context, String roleId, String name, Collection<String> permissions) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        Role current = roles.findById(tenantId, roleId)
                .orElseThrow(() -> NotFoundException.of("Role", roleId));

        Role updated = current;
        if (name != null) {
            String roleName = requireName(name);
            if (!roleName.equals(current.name())) {
                if (current.system()) {
                    throw new BadRequestException("System roles cannot be renamed.");
                }
                boolean taken = roles.findByName(tenantId, roleName)
                        .filter(other -> !other.id().equals(roleId))
                        .isPresent();
                if (taken || SystemRole.fromName(roleName).isPresent()) {
                    throw new BadRequestException("A role with this name already exists.");
                }
                updated = updated.withName(roleName);
            }
        }
        if (permissions != null) {
            updated = updated.withPermissions(catalogPermissions(permissions));
        }
        if (updated.equals(current)) {
            return current;
        }
        roles.update(updated);

        auditRecorder.record(tenantId, AuditAction.ROLE_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "roleId", roleId,
                        "before", AuditDetails.of("name", current.name(), "permissions", current.permissions()),
                        "after", AuditDetails.of("name", updated.name(), "permissions", updated.permissions())),
                context.email());
        return updated;
    }

    /**
     * Deletes a custom role. Users still holding it move to {@code reassignRoleId}, which is
     * mandatory in that case.
     */
    @Transactional
    public void delete(SecurityContext context, String roleId, String reassignRoleId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        tenantLocks.lock(tenantId);
        Role role = roles.findById(tenantId, roleId)
                .orElseThrow(() -> NotFoundException.of("Role", roleId));
        if (role.system()) {
            throw new BadRequestException("System roles cannot be deleted.");
        }

        long assigned = roles.countUsers(roleId);
        Role target = null;
        if (assigned > 0) {
            if (reassignRoleId == null || reassignRoleId.isBlank()) {
                throw new BadRequestException("Role has assigned users. Provide reassignRoleId.");
            }
            if (reassignRoleId.equals(roleId)) {
                throw new BadRequestException("reassignRoleId must differ from the role being deleted.");
            }
            target = roles.findById(tenantId, reassignRoleId)
                    .orElseThrow(() -> new BadRequestException("reassignRoleId is invalid for this tenant."));
            roles.reassignUsers(roleId, target.id());
        }
        roles.delete(roleId);
        log.info("Deleted role {} in tenant {}, reassigned {} users", roleId, tenantId, assigned);

        auditRecorder.record(tenantId, AuditAction.ROLE_DELETED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "roleId", roleId,
                        "name", role.name(),
                        "permissions", role.permissions(),
                        "reassignedTo", target == null ? null : target.id(),
                        "reassignedUsers", assigned),
                context.email());
    }

    private static String requireName(String name) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw new BadRequestException("Role name is required.");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new BadRequestException("Role name must be at most " + MAX_NAME_LENGTH + " characters.");
        }
        return trimmed;
    }

    private static List<String> catalogPermissions(Collection<String> requested) {
        if (requested == null) {
            return List.of();
        }
        List<String> unknown = new ArrayList<>();
        for (String permission : requested) {
            if (permission == null || !Permissions.isKnown(permission.strip())) {
                unknown.add(String.valueOf(permission));
            }
        }
        if (!unknown.isEmpty()) {
            throw new BadRequestException("Unknown permissions: " + String.join(", ", unknown));
        }
        return Permissions.normalize(requested);
    }
}
