package com.bluequee.tabconfig.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.error.SystemDefaultImmutableException;
import com.bluequee.tabconfig.domain.error.UnauthorizedTabAccessException;
import com.bluequee.tabconfig.testing.TabRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for OwnershipValidator.
 *
 * <p>WHY: Ownership is the tenant boundary for writes. A record from another organization, role or
 * user must never be writable, and system defaults never at all.
 */
@DisplayName("OwnershipValidator")
class OwnershipValidatorTest {

    private static final ViewerIdentity NURSE = new ViewerIdentity(1L, 11L, 101L, false);
    private static final ViewerIdentity ADMIN = new ViewerIdentity(1L, 12L, 102L, true);

    @Nested
    @DisplayName("canModify")
    class CanModify {

        @Test
        @DisplayName("system records are never modifiable, even by admins")
        void systemNever() {
            assertThat(OwnershipValidator.canModify(TabRecords.system("lab", 30), ADMIN)).isFalse();
        }

        @Test
        @DisplayName("organization record requires the caller's organization")
        void organization() {
            var own = TabRecords.override("lab", TabScope.ORGANIZATION, 1L, 1L, false, 30);
            var foreign = TabRecords.override("lab", TabScope.ORGANIZATION, 2L, 2L, false, 30);

            assertThat(OwnershipValidator.canModify(own, NURSE)).isTrue();
            assertThat(OwnershipValidator.canModify(foreign, NURSE)).isFalse();
        }

        @Test
        @DisplayName("role record requires the caller's role inside the caller's organization")
        void role() {
            var own = TabRecords.override("lab", TabScope.ROLE, 11L, 1L, false, 30);
            var otherRole = TabRecords.override("lab", TabScope.ROLE, 12L, 1L, false, 30);
            var otherOrganization = TabRecords.override("lab", TabScope.ROLE, 11L, 2L, false, 30);

            assertThat(OwnershipValidator.canModify(own, NURSE)).isTrue();
            assertThat(OwnershipValidator.canModify(otherRole, NURSE)).isFalse();
            assertThat(OwnershipValidator.canModify(otherOrganization, NURSE)).isFalse();
        }

        @Test
        @DisplayName("user record requires the caller")
        void user() {
            var own = TabRecords.override("lab", TabScope.USER, 101L, 1L, false, 30);
            var colleague = TabRecords.override("lab", TabScope.USER, 102L, 1L, false, 30);

            assertThat(OwnershipValidator.canModify(own, NURSE)).isTrue();
            assertThat(OwnershipValidator.canModify(colleague, NURSE)).isFalse();
        }
    }

    @Nested
    @DisplayName("canWriteScope")
    class CanWriteScope {

        @Test
        @DisplayName("only administrators write organization-wide records")
        void organizationNeedsAdmin() {
            assertThat(OwnershipValidator.canWriteScope(TabScope.ORGANIZATION, ADMIN)).isTrue();
            assertThat(OwnershipValidator.canWriteScope(TabScope.ORGANIZATION, NURSE)).isFalse();
        }

        @Test
        @DisplayName("role scope needs a role id")
        void roleNeedsRoleId() {
            assertThat(OwnershipValidator.canWriteScope(TabScope.ROLE, NURSE)).isTrue();
            assertThat(OwnershipValidator.canWriteScope(TabScope.ROLE, new ViewerIdentity(1L, null, 101L, false)))
                    .isFalse();
        }

        @Test
        @DisplayName("nothing is writable without an organization, and system never")
        void noOrganizationOrSystem() {
            var detached = new ViewerIdentity(null, 11L, 101L, true);

            assertThat(OwnershipValidator.canWriteScope(TabScope.USER, detached)).isFalse();
            assertThat(OwnershipValidator.canWriteScope(TabScope.SYSTEM, ADMIN)).isFalse();
        }
    }

    @Nested
    @DisplayName("requireModifiable")
    class RequireModifiable {

        @Test
        @DisplayName("system default fails as immutable before ownership is considered")
        void systemDefault() {
            assertThatThrownBy(() -> OwnershipValidator.requireModifiable(TabRecords.system("lab", 30), ADMIN))
                    .isInstanceOf(SystemDefaultImmutableException.class);
        }

        @Test
        @DisplayName("foreign record fails as unauthorized")
        void foreign() {
            var foreign = TabRecords.override("lab", TabScope.USER, 999L, 2L, false, 30);

            assertThatThrownBy(() -> OwnershipValidator.requireModifiable(foreign, NURSE))
                    .isInstanceOf(UnauthorizedTabAccessException.class);
        }

        @Test
        @DisplayName("own record passes")
        void own() {
            var own = TabRecords.override("lab", TabScope.USER, 101L, 1L, false, 30);

            assertThatCode(() -> OwnershipValidator.requireModifiable(own, NURSE)).doesNotThrowAnyException();
        }
    }
}
