package com.bluequee.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.bluequee.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextValidator")
class SecurityContextValidatorTest {

    @Test
    @DisplayName("accepts a complete context")
    void acceptsComplete() {
        assertThat(SecurityContextValidator.validate(TestSecurityContextFactory.create()).valid())
                .isTrue();
    }

    @Test
    @DisplayName("accepts a context without organization")
    void acceptsWithoutOrganization() {
        var result =
                SecurityContextValidator.validate(TestSecurityContextFactory.createWithoutOrganization());
        assertThat(result.valid()).isTrue();
    }

    @Test
    @DisplayName("reports every missing field at once")
    void reportsAllErrors() {
        var ctx = new ClinicSecurityContext(null, null, null, -3L, "c");

        var result = SecurityContextValidator.validate(ctx);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
                .containsExactly(
                        "user must not be null",
                        "tenant must not be null",
                        "role must not be null",
                        "roleId must be positive when present");
    }

    @Test
    @DisplayName("rejects a user without id")
    void rejectsUserWithoutId() {
        var ctx =
                new ClinicSecurityContext(
                        new AuthenticatedUser(null, "ghost", null),
                        new TenantContext(1L, "Clinic"),
                        Role.DOCTOR,
                        null,
                        "c");

        assertThat(SecurityContextValidator.validate(ctx).errors())
                .containsExactly("user.userId must not be null");
    }
}
