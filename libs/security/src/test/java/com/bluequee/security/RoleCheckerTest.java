package com.bluequee.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.bluequee.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for RoleChecker.
 *
 * <p>WHY: organization-wide tab changes are gated on the administrative capability; a wrong answer
 * here lets a receptionist hide tabs for the whole clinic.
 */
@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("hasRole()")
    class HasRole {

        @Test
        @DisplayName("returns true for the exact role")
        void exactRole() {
            var ctx = TestSecurityContextFactory.createWithRole(Role.NURSE);
            assertThat(RoleChecker.hasRole(ctx, Role.NURSE)).isTrue();
        }

        @Test
        @DisplayName("SUPER_ADMIN satisfies ADMIN via hierarchy")
        void superAdminSatisfiesAdmin() {
            var ctx = TestSecurityContextFactory.createWithRole(Role.SUPER_ADMIN);
            assertThat(RoleChecker.hasRole(ctx, Role.ADMIN)).isTrue();
        }

        @Test
        @DisplayName("returns false when the context carries no role")
        void noRole() {
            var ctx = TestSecurityContextFactory.create(5L, 1L, null, null);
            assertThat(RoleChecker.hasRole(ctx, Role.USER)).isFalse();
        }
    }

    @Nested
    @DisplayName("hasAnyRole()")
    class HasAnyRole {

        @Test
        @DisplayName("returns true when one role matches")
        void oneMatches() {
            var ctx = TestSecurityContextFactory.createWithRole(Role.PHARMACIST);
            assertThat(RoleChecker.hasAnyRole(ctx, Role.DOCTOR, Role.PHARMACIST)).isTrue();
        }

        @Test
        @DisplayName("returns false when none match")
        void noneMatch() {
            var ctx = TestSecurityContextFactory.createWithRole(Role.PHARMACIST);
            assertThat(RoleChecker.hasAnyRole(ctx, Role.DOCTOR, Role.ADMIN)).isFalse();
        }
    }

    @Nested
    @DisplayName("isAdministrator()")
    class IsAdministrator {

        @Test
        @DisplayName("admins and super admins are administrators")
        void admins() {
            assertThat(RoleChecker.isAdministrator(TestSecurityContextFactory.createWithRole(Role.ADMIN)))
                    .isTrue();
            assertThat(RoleChecker.isAdministrator(
                            TestSecurityContextFactory.createWithRole(Role.SUPER_ADMIN)))
                    .isTrue();
        }

        @Test
        @DisplayName("clinical roles are not administrators")
        void clinicalRoles() {
            assertThat(RoleChecker.isAdministrator(TestSecurityContextFactory.create())).isFalse();
        }
    }
}
