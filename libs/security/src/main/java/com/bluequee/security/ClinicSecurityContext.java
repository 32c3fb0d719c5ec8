package com.bluequee.security;

/**
 * Security context for one request, as forwarded by the gateway.
 *
 * <p>WHY a record: immutable, thread-safe, travels with every request. This is the single source
 * of truth for ownership and scope checks within a request.
 *
 * @param user authenticated user information
 * @param tenant current organization
 * @param role the user's platform role
 * @param roleId id of the organization-defined role the user is assigned to, nullable
 * @param correlationId trace correlation ID for this request
 */
public record ClinicSecurityContext(
        AuthenticatedUser user,
        TenantContext tenant,
        Role role,
        Long roleId,
        String correlationId) {}
