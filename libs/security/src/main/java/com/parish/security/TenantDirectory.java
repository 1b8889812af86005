package com.parish.security;

import java.util.Optional;

/**
 * Read-only lookups the core needs from the record store.
 */
public interface TenantDirectory {

    /**
     * Finds the tenant user registered under the given normalized email.
     *
     * @param normalizedEmail trimmed, lower-cased email
     * @return the linked account, or empty if the email is not linked to any tenant
     */
    Optional<LinkedAccount> findLinkedAccount(String normalizedEmail);

    /**
     * Finds a tenant by id.
     *
     * @param tenantId tenant identifier
     * @return the tenant, or empty if it does not exist
     */
    Optional<TenantRef> findTenant(String tenantId);
}
