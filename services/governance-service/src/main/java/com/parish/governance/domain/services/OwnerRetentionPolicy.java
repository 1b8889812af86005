package com.parish.governance.domain.services;

import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.ports.UserRepository;
import com.parish.security.BadRequestException;
import com.parish.security.SystemRole;
import com.parish.security.UserStatus;
import org.springframework.stereotype.Component;

/**
 * Keeps at least one non-suspended Owner in every tenant.
 *
 * <p>Callers must hold the tenant row lock ({@code TenantRepository#lockForUpdate}) in the
 * same transaction as the mutation, otherwise two concurrent demotions can both pass.
 */
@Component
public class OwnerRetentionPolicy {

    static final String LAST_OWNER = "Cannot remove or suspend the last active Owner in this tenant.";

    private final UserRepository users;

    public OwnerRetentionPolicy(UserRepository users) {
        this.users = users;
    }

    /**
     * @param user       the user as currently stored
     * @param nextRole   the role the user will hold
     * @param nextStatus the status the user will have
     * @throws BadRequestException if the change removes the tenant's last active Owner
     */
    public void assertRetained(TenantUser user, Role nextRole, UserStatus nextStatus) {
        boolean countedNow = SystemRole.isOwner(user.roleName()) && user.status() != UserStatus.SUSPENDED;
        if (!countedNow) {
            return;
        }
        boolean countedAfter = nextRole.system() && SystemRole.isOwner(nextRole.name())
                && nextStatus != UserStatus.SUSPENDED;
        if (countedAfter) {
            return;
        }
        if (users.countActiveOwners(user.tenantId()) <= 1) {
            throw new BadRequestException(LAST_OWNER);
        }
    }
}
