package com.parish.governance.domain.services;

import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.model.UserChanges;
import com.parish.governance.domain.model.UserInvitation;
import com.parish.governance.domain.model.UserQuery;
import com.parish.governance.domain.ports.BranchRepository;
import com.parish.governance.domain.ports.RoleRepository;
import com.parish.governance.domain.ports.UserRepository;
import com.parish.security.BadRequestException;
import com.parish.security.BranchScopeMode;
import com.parish.security.ForbiddenException;
import com.parish.security.NotFoundException;
import com.parish.security.PlatformAdminAllowList;
import com.parish.security.SecurityContext;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.UserStatus;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant user administration: invitations, role and branch access changes, suspension.
 *
 * <p>Every mutation runs under the tenant lock and passes through
 * {@link OwnerRetentionPolicy} before it is written. Branch grants and default branches
 * are validated against the active branches of the user's tenant.
 */
@Service
public class UserService {

    static final String AUDIT_RESOURCE = "User";
    static final String INVALID_BRANCHES = "One or more branch IDs are invalid for this tenant.";
    static final String RESTRICTED_WITHOUT_GRANTS =
            "Restricted users must have at least one branch access assignment.";

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository users;
    private final RoleRepository roles;
    private final BranchRepository branches;
    private final TenantLocks tenantLocks;
    private final OwnerRetentionPolicy ownerRetention;
    private final PlatformAdminAllowList platformAdmins;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public UserService(UserRepository users,
                       RoleRepository roles,
                       BranchRepository branches,
                       TenantLocks tenantLocks,
                       OwnerRetentionPolicy ownerRetention,
                       PlatformAdminAllowList platformAdmins,
                       AuditRecorder auditRecorder,
                       Clock clock) {
        this.users = users;
        this.roles = roles;
        this.branches = branches;
        this.tenantLocks = tenantLocks;
        this.ownerRetention = ownerRetention;
        this.platformAdmins = platformAdmins;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PageResult<TenantUser> list(SecurityContext context, UserStatus status, String roleId, String search,
                                       PageRequest page) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        return users.find(new UserQuery(tenantId, status, roleId, search), page);
    }

    @Transactional(readOnly = true)
    public TenantUser get(SecurityContext context, String userId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        return requireUser(tenantId, userId);
    }

    /**
     * Invites a person into the caller's tenant. Inviting an email that already belongs to
     * this tenant re-invites that user with the new role and access.
     */
    @Transactional
    public TenantUser invite(SecurityContext context, UserInvitation invitation) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        tenantLocks.lock(tenantId);

        String email = PlatformAdminAllowList.normalize(invitation.email());
        String name = invitation.name() == null ? "" : invitation.name().strip();
        if (email.isEmpty() || name.isEmpty()) {
            throw new BadRequestException("Name and email are required.");
        }
        if (platformAdmins.contains(email)) {
            throw new BadRequestException("Platform administrators cannot be invited as tenant users.");
        }
        Role role = requireRole(tenantId, invitation.roleId());
        Access access = resolveAccess(context, tenantId, invitation.branchScopeMode(), invitation.branchIds(),
                invitation.defaultBranchId(), null);

        Instant now = clock.instant();
        TenantUser existing = users.findByEmail(email).orElse(null);
        TenantUser invited;
        if (existing != null) {
            if (!tenantId.equals(existing.tenantId())) {
                throw new BadRequestException("This email already belongs to a different tenant.");
            }
            ownerRetention.assertRetained(existing, role, UserStatus.INVITED);
            invited = existing.withName(name)
                    .withRole(role)
                    .withStatus(UserStatus.INVITED)
                    .withAccess(access.mode(), access.branchIds(), access.defaultBranchId())
                    .withInvitedAt(now);
            users.update(invited);
        } else {
            invited = new TenantUser(UUID.randomUUID().toString(), tenantId, context.tenantName(), email, name,
                    role.id(), role.name(), UserStatus.INVITED, access.mode(), access.defaultBranchId(),
                    access.branchIds(), now, null, null, null, now);
            users.insert(invited);
        }
        users.replaceBranchAccess(invited.id(), access.branchIds());
        log.info("Invited user {} into tenant {} as {}", invited.id(), tenantId, role.name());

        Map<String, Object> details = snapshot(invited);
        details.put("reinvited", existing != null);
        auditRecorder.record(tenantId, AuditAction.USER_INVITED, AUDIT_RESOURCE, details, context.email());
        return requireUser(tenantId, invited.id());
    }

    /**
     * Applies a partial update to a user of the caller's tenant.
     */
    @Transactional
    public TenantUser update(SecurityContext context, String userId, UserChanges changes) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        tenantLocks.lock(tenantId);
        TenantUser current = requireUser(tenantId, userId);

        TenantUser updated = current;
        if (changes.name() != null) {
            String name = changes.name().strip();
            if (name.isEmpty()) {
                throw new BadRequestException("Name cannot be blank.");
            }
            updated = updated.withName(name);
        }
        Role nextRole = changes.roleId() != null
                ? requireRole(tenantId, changes.roleId())
                : currentRole(current);
        updated = updated.withRole(nextRole);
        if (changes.status() != null) {
            updated = updated.withStatus(changes.status());
        }
        if (changes.touchesAccess()) {
            BranchScopeMode mode = changes.branchScopeMode() != null
                    ? changes.branchScopeMode()
                    : current.branchScopeMode();
            List<String> grants = changes.branchIds() != null ? changes.branchIds() : current.branchIds();
            Access access = resolveAccess(context, tenantId, mode, grants, changes.defaultBranchId(),
                    current.defaultBranchId());
            updated = updated.withAccess(access.mode(), access.branchIds(), access.defaultBranchId());
        }

        ownerRetention.assertRetained(current, nextRole, updated.status());
        if (updated.equals(current)) {
            return current;
        }
        users.update(updated);
        if (!updated.branchIds().equals(current.branchIds())) {
            users.replaceBranchAccess(userId, updated.branchIds());
        }

        auditRecorder.record(tenantId, AuditAction.USER_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", userId,
                        "email", current.email(),
                        "before", snapshot(current),
                        "after", snapshot(updated)),
                context.email());
        return requireUser(tenantId, userId);
    }

    @Transactional
    public TenantUser updateRole(SecurityContext context, String userId, String roleId) {
        if (roleId == null || roleId.isBlank()) {
            throw new BadRequestException("roleId is required.");
        }
        return update(context, userId, UserChanges.role(roleId));
    }

    @Transactional
    public TenantUser updateBranches(SecurityContext context, String userId, BranchScopeMode mode,
                                     List<String> branchIds, String defaultBranchId) {
        if (mode == null) {
            throw new BadRequestException("branchScopeMode is required.");
        }
        return update(context, userId,
                UserChanges.access(mode, branchIds == null ? List.of() : branchIds, defaultBranchId));
    }

    @Transactional
    public TenantUser suspend(SecurityContext context, String userId) {
        return update(context, userId, UserChanges.status(UserStatus.SUSPENDED));
    }

    @Transactional
    public TenantUser reactivate(SecurityContext context, String userId) {
        return update(context, userId, UserChanges.status(UserStatus.ACTIVE));
    }

    /**
     * Refreshes the invitation time of a user who has not signed in yet.
     */
    @Transactional
    public TenantUser resendInvite(SecurityContext context, String userId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        TenantUser user = requireUser(tenantId, userId);
        if (user.status() != UserStatus.INVITED) {
            throw new BadRequestException("Only invited users can be sent a new invitation.");
        }
        TenantUser reinvited = user.withInvitedAt(clock.instant());
        users.update(reinvited);

        auditRecorder.record(tenantId, AuditAction.USER_INVITE_RESENT, AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", userId,
                        "email", user.email(),
                        "previousInvitedAt", user.invitedAt() == null ? null : user.invitedAt().toString(),
                        "invitedAt", reinvited.invitedAt().toString()),
                context.email());
        return reinvited;
    }

    // platform operations: the caller is a platform admin, the user may belong to any tenant

    @Transactional(readOnly = true)
    public PageResult<TenantUser> platformList(UserQuery query, PageRequest page) {
        return users.find(query, page);
    }

    @Transactional(readOnly = true)
    public TenantUser platformGet(String userId) {
        return users.findAnyById(userId).orElseThrow(() -> NotFoundException.of("User", userId));
    }

    @Transactional
    public TenantUser platformUpdateStatus(SecurityContext actor, String userId, UserStatus status) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        if (status == null) {
            throw new BadRequestException("status is required.");
        }
        TenantUser current = lockAndLoad(userId);
        ownerRetention.assertRetained(current, currentRole(current), status);
        if (current.status() == status) {
            return current;
        }
        TenantUser updated = current.withStatus(status);
        users.update(updated);

        auditRecorder.record(current.tenantId(), AuditAction.PLATFORM_USER_STATUS_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", userId,
                        "email", current.email(),
                        "previousStatus", current.status().value(),
                        "status", status.value()),
                actor.email());
        return updated;
    }

    @Transactional
    public TenantUser platformUpdateRole(SecurityContext actor, String userId, String roleId) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        TenantUser current = lockAndLoad(userId);
        Role role = roles.findById(current.tenantId(), roleId == null ? "" : roleId)
                .orElseThrow(() -> new BadRequestException("Role does not belong to the user's tenant."));
        ownerRetention.assertRetained(current, role, current.status());
        if (role.id().equals(current.roleId())) {
            return current;
        }
        TenantUser updated = current.withRole(role);
        users.update(updated);

        auditRecorder.record(current.tenantId(), AuditAction.PLATFORM_USER_ROLE_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", userId,
                        "email", current.email(),
                        "previousRoleId", current.roleId(),
                        "previousRoleName", current.roleName(),
                        "roleId", role.id(),
                        "roleName", role.name()),
                actor.email());
        return updated;
    }

    /**
     * Restores a locked-out user: active status, access to every branch, no default branch.
     */
    @Transactional
    public TenantUser platformResetAccess(SecurityContext actor, String userId) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        TenantUser current = lockAndLoad(userId);
        TenantUser updated = current.withStatus(UserStatus.ACTIVE)
                .withAccess(BranchScopeMode.ALL, List.of(), null);
        users.update(updated);
        users.replaceBranchAccess(userId, List.of());

        auditRecorder.record(current.tenantId(), AuditAction.PLATFORM_USER_ACCESS_RESET, AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", userId,
                        "email", current.email(),
                        "before", snapshot(current),
                        "after", snapshot(updated)),
                actor.email());
        return updated;
    }

    private TenantUser lockAndLoad(String userId) {
        TenantUser user = platformGet(userId);
        tenantLocks.lock(user.tenantId());
        // re-read under the lock
        return platformGet(userId);
    }

    private TenantUser requireUser(String tenantId, String userId) {
        return users.findById(tenantId, userId).orElseThrow(() -> NotFoundException.of("User", userId));
    }

    private Role requireRole(String tenantId, String roleId) {
        if (roleId == null || roleId.isBlank()) {
            throw new BadRequestException("roleId is required.");
        }
        return roles.findById(tenantId, roleId)
                .orElseThrow(() -> new BadRequestException("roleId is invalid for this tenant."));
    }

    private Role currentRole(TenantUser user) {
        return roles.findById(user.tenantId(), user.roleId())
                .orElseThrow(() -> new IllegalStateException("User " + user.id() + " references a missing role"));
    }

    /**
     * Validates requested branch access against the tenant's active branches and, for a
     * branch-restricted caller, against the caller's own grants.
     *
     * @param requestedDefault default branch asked for: null keeps {@code currentDefault}
     *                         when it is still valid, blank clears it
     */
    private Access resolveAccess(SecurityContext actor, String tenantId, BranchScopeMode mode,
                                 List<String> requestedIds, String requestedDefault, String currentDefault) {
        BranchScopeMode scopeMode = mode == null ? BranchScopeMode.ALL : mode;
        List<String> grants = scopeMode == BranchScopeMode.RESTRICTED ? distinct(requestedIds) : List.of();

        if (!grants.isEmpty() && branches.findActiveIds(tenantId, grants).size() != grants.size()) {
            throw new BadRequestException(INVALID_BRANCHES);
        }
        if (scopeMode == BranchScopeMode.RESTRICTED && grants.isEmpty()) {
            throw new BadRequestException(RESTRICTED_WITHOUT_GRANTS);
        }
        if (actor.isRestricted()) {
            if (scopeMode != BranchScopeMode.RESTRICTED) {
                throw new ForbiddenException("Branch-restricted accounts can only assign restricted access.");
            }
            for (String branchId : grants) {
                if (!actor.allowedBranchIds().contains(branchId)) {
                    throw new ForbiddenException("Branch is outside your allowed scope: " + branchId);
                }
            }
        }

        String defaultBranchId;
        if (requestedDefault == null) {
            defaultBranchId = currentDefault;
            if (defaultBranchId != null && scopeMode == BranchScopeMode.RESTRICTED && !grants.contains(defaultBranchId)) {
                defaultBranchId = null;
            }
        } else if (requestedDefault.isBlank()) {
            defaultBranchId = null;
        } else {
            defaultBranchId = requestedDefault.strip();
            if (branches.findActiveIds(tenantId, List.of(defaultBranchId)).isEmpty()) {
                throw new BadRequestException("Default branch is invalid for this tenant.");
            }
            if (scopeMode == BranchScopeMode.RESTRICTED && !grants.contains(defaultBranchId)) {
                throw new BadRequestException("Default branch must be one of the assigned branches.");
            }
        }
        return new Access(scopeMode, grants, defaultBranchId);
    }

    private static List<String> distinct(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                unique.add(id.strip());
            }
        }
        return new ArrayList<>(unique);
    }

    private static Map<String, Object> snapshot(TenantUser user) {
        return AuditDetails.of(
                "userId", user.id(),
                "email", user.email(),
                "name", user.name(),
                "roleId", user.roleId(),
                "roleName", user.roleName(),
                "status", user.status().value(),
                "branchScopeMode", user.branchScopeMode().name(),
                "branchIds", user.branchIds(),
                "defaultBranchId", user.defaultBranchId());
    }

    private record Access(BranchScopeMode mode, List<String> branchIds, String defaultBranchId) {

        Access {
            Objects.requireNonNull(mode, "mode");
            branchIds = List.copyOf(branchIds);
        }
    }
}
