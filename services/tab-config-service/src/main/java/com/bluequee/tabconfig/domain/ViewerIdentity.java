package com.bluequee.tabconfig.domain;

import com.bluequee.security.ClinicSecurityContext;
import com.bluequee.security.RoleChecker;

/**
 * Who is looking at (or changing) the tab configuration.
 *
 * @param organizationId current organization; null when the gateway could not resolve one
 * @param roleId organization-defined role the user is assigned to, nullable
 * @param userId authenticated user, nullable for service callers
 * @param administrator whether the caller may change organization-wide settings
 */
public record ViewerIdentity(Long organizationId, Long roleId, Long userId, boolean administrator) {

    public static ViewerIdentity from(ClinicSecurityContext context) {
        Long organizationId = context.tenant() == null ? null : context.tenant().organizationId();
        Long userId = context.user() == null ? null : context.user().userId();
        return new ViewerIdentity(
                organizationId, context.roleId(), userId, RoleChecker.isAdministrator(context));
    }

    public boolean hasOrganization() {
        return organizationId != null;
    }

    /**
     * The id that owns records this viewer writes at {@code scope}: the organization, the role or
     * the user. Null for system scope, which no viewer owns.
     */
    public Long ownerIdFor(TabScope scope) {
        return switch (scope) {
            case SYSTEM -> null;
            case ORGANIZATION -> organizationId;
            case ROLE -> roleId;
            case USER -> userId;
        };
    }
}
