package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.error.SystemDefaultImmutableException;
import com.bluequee.tabconfig.domain.error.UnauthorizedTabAccessException;
import java.util.Objects;

/**
 * Decides whether a caller may write a record or write at a scope.
 *
 * <ul>
 *   <li>system: never
 *   <li>organization: the record's owner is the caller's organization
 *   <li>role: the record's owner is the caller's role, inside the caller's organization
 *   <li>user: the record's owner is the caller
 * </ul>
 */
public final class OwnershipValidator {

    private OwnershipValidator() {
        // utility class
    }

    public static boolean canModify(TabRecord record, ViewerIdentity caller) {
        if (record.systemDefault()) {
            return false;
        }
        return switch (record.scope()) {
            case SYSTEM -> false;
            case ORGANIZATION -> caller.organizationId() != null
                    && caller.organizationId().equals(record.scopeOwnerId());
            case ROLE -> caller.roleId() != null
                    && caller.roleId().equals(record.scopeOwnerId())
                    && Objects.equals(caller.organizationId(), record.organizationId());
            case USER -> caller.userId() != null && caller.userId().equals(record.scopeOwnerId());
        };
    }

    /**
     * Whether the caller may create records at {@code scope}. Organization-wide records are
     * reserved for administrators; role records need a role assignment.
     */
    public static boolean canWriteScope(TabScope scope, ViewerIdentity caller) {
        if (!caller.hasOrganization()) {
            return false;
        }
        return switch (scope) {
            case SYSTEM -> false;
            case ORGANIZATION -> caller.administrator();
            case ROLE -> caller.roleId() != null;
            case USER -> caller.userId() != null;
        };
    }

    /**
     * @throws SystemDefaultImmutableException for system defaults
     * @throws UnauthorizedTabAccessException if the caller does not own the record
     */
    public static void requireModifiable(TabRecord record, ViewerIdentity caller) {
        if (record.systemDefault()) {
            throw new SystemDefaultImmutableException(record.key());
        }
        if (!canModify(record, caller)) {
            throw new UnauthorizedTabAccessException(
                    "Not authorized to modify tab configuration " + record.id());
        }
    }

    public static void requireWritableScope(TabScope scope, ViewerIdentity caller) {
        if (!canWriteScope(scope, caller)) {
            throw new UnauthorizedTabAccessException(
                    "Not authorized to write tab configuration at " + scope.value() + " scope");
        }
    }
}
