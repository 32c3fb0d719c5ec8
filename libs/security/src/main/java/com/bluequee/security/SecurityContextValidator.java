package com.bluequee.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates that a {@link ClinicSecurityContext} received from the gateway is structurally
 * complete.
 *
 * <p>WHY manual validation: returns all errors at once and needs no annotation processing. Note
 * that a missing organization id is NOT an error; organization-less requests are legal and served
 * in a degraded mode by consumers.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * Validates that all required fields of the security context are present.
     *
     * @param context the security context to validate
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(ClinicSecurityContext context) {
        List<String> errors = new ArrayList<>();

        if (context.user() == null) {
            errors.add("user must not be null");
        } else if (context.user().userId() == null) {
            errors.add("user.userId must not be null");
        }

        if (context.tenant() == null) {
            errors.add("tenant must not be null");
        }

        if (context.role() == null) {
            errors.add("role must not be null");
        }

        if (context.roleId() != null && context.roleId() <= 0) {
            errors.add("roleId must be positive when present");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }
}
