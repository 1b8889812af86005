/**
 * Domain layer: tenant governance records, the rules that protect them, and the ports the
 * infrastructure implements.
 *
 * <ul>
 *   <li>{@code model/} immutable records for tenants, roles, branches, users and audit rows
 *   <li>{@code ports/} repository interfaces implemented by JDBC adapters
 *   <li>{@code services/} transactional services enforcing owner retention, branch archive
 *       rules and branch scope, and writing the audit trail
 * </ul>
 *
 * <p>Domain code depends on the authorization core ({@code com.parish.security}) and on its
 * own ports, never on the {@code infrastructure} or {@code api} packages.
 */
package com.parish.governance.domain;
