package com.bluequee.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles carried on every user account.
 *
 * <p>WHY an enum with hierarchy: the administrative capability (SUPER_ADMIN implies ADMIN) is
 * encoded once here instead of comparing raw role strings in every handler. This is distinct from
 * the organization-defined role a user is assigned to ({@link ClinicSecurityContext#roleId()}),
 * which is data, not code.
 */
public enum Role {

    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    DOCTOR("doctor"),
    NURSE("nurse"),
    PHARMACIST("pharmacist"),
    PHYSIOTHERAPIST("physiotherapist"),
    RECEPTIONIST("receptionist"),
    LAB_TECHNICIAN("lab_technician"),
    USER("user");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "super_admin"). */
    public String value() {
        return value;
    }

    /** Roles this role implies. Only SUPER_ADMIN implies anything (ADMIN). */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case SUPER_ADMIN -> EnumSet.of(ADMIN);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /** Checks whether this role implies the given role, directly or through the hierarchy. */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /** Whether holders of this role may change organization-wide settings. */
    public boolean isAdministrative() {
        return implies(ADMIN);
    }

    /**
     * Looks up a Role by its string value. Matching is case-insensitive and accepts the legacy
     * spelling {@code "superadmin"} still present in older accounts.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if ("superadmin".equals(normalized)) {
            return Optional.of(SUPER_ADMIN);
        }
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
