package com.bluequee.security.testing;

import com.bluequee.security.AuthenticatedUser;
import com.bluequee.security.ClinicSecurityContext;
import com.bluequee.security.Role;
import com.bluequee.security.TenantContext;
import java.util.UUID;

/**
 * Factory for {@link ClinicSecurityContext} instances in tests.
 *
 * <p>WHY in src/main: other modules import it in their test scope through a regular Maven
 * dependency, without test-jars. The {@code testing} package signals "for tests only."
 */
public final class TestSecurityContextFactory {

    public static final long DEFAULT_USER_ID = 101L;
    public static final long DEFAULT_ORGANIZATION_ID = 1L;
    public static final long DEFAULT_ROLE_ID = 11L;

    private TestSecurityContextFactory() {
        // utility class
    }

    /** A doctor in the default organization, assigned to the default role. */
    public static ClinicSecurityContext create() {
        return create(DEFAULT_USER_ID, DEFAULT_ORGANIZATION_ID, Role.DOCTOR, DEFAULT_ROLE_ID);
    }

    /** A user of the default organization with the given platform role. */
    public static ClinicSecurityContext createWithRole(Role role) {
        return create(DEFAULT_USER_ID, DEFAULT_ORGANIZATION_ID, role, DEFAULT_ROLE_ID);
    }

    /** A doctor acting within the given organization. */
    public static ClinicSecurityContext createForOrganization(long organizationId) {
        return create(DEFAULT_USER_ID, organizationId, Role.DOCTOR, DEFAULT_ROLE_ID);
    }

    /** A request for which the gateway could not resolve an organization. */
    public static ClinicSecurityContext createWithoutOrganization() {
        return create(DEFAULT_USER_ID, null, Role.DOCTOR, null);
    }

    /** Fully-customized context. {@code organizationId} and {@code roleId} may be null. */
    public static ClinicSecurityContext create(
            long userId, Long organizationId, Role role, Long roleId) {
        return new ClinicSecurityContext(
                new AuthenticatedUser(userId, "user" + userId, "Test User " + userId),
                new TenantContext(
                        organizationId,
                        organizationId == null ? null : "Test Clinic " + organizationId),
                role,
                roleId,
                "test-correlation-" + UUID.randomUUID());
    }
}
