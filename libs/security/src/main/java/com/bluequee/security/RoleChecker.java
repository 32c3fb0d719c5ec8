package com.bluequee.security;

/**
 * Role-based access checks with hierarchy support.
 *
 * <p>WHY a utility class: "is this user an admin" used to be spelled as string comparisons
 * against two or three role names. Centralising it keeps the hierarchy in {@link Role}.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the context's role satisfies the required role (directly or via hierarchy).
     *
     * <p>Example: a SUPER_ADMIN satisfies {@code hasRole(ctx, ADMIN)}.
     */
    public static boolean hasRole(ClinicSecurityContext context, Role required) {
        return context.role() != null && context.role().implies(required);
    }

    /** Checks if the context's role satisfies ANY of the required roles. */
    public static boolean hasAnyRole(ClinicSecurityContext context, Role... required) {
        for (Role role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    /** Whether the caller holds the administrative capability within its organization. */
    public static boolean isAdministrator(ClinicSecurityContext context) {
        return context.role() != null && context.role().isAdministrative();
    }
}
