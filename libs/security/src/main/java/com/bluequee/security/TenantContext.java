package com.bluequee.security;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Organization (tenant) the request is acting within.
 *
 * <p>A clinician can belong to several organizations; the gateway resolves the current one. The id
 * is {@code null} when no organization could be resolved, which consumers treat as a degraded,
 * organization-less request.
 *
 * @param organizationId current organization identifier, nullable
 * @param organizationName optional human-readable organization name
 */
public record TenantContext(Long organizationId, String organizationName) {

    /** Whether an organization was resolved for this request. */
    @JsonIgnore
    public boolean isResolved() {
        return organizationId != null;
    }
}
