package com.bluequee.tabconfig.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read filter understood by every {@link com.bluequee.tabconfig.domain.port.TabConfigStore}.
 *
 * <p>A record matches when it matches ANY of the selectors and, if {@code key} is set, has that
 * key. A {@link TabScope#SYSTEM} selector matches system defaults only.
 *
 * @param anyOf scope selectors, at least one
 * @param key optional key restriction
 */
public record TabFilter(List<ScopeSelector> anyOf, String key) {

    public TabFilter {
        if (anyOf == null || anyOf.isEmpty()) {
            throw new IllegalArgumentException("anyOf must contain at least one selector");
        }
        anyOf = List.copyOf(anyOf);
    }

    /** Only the seeded system defaults. */
    public static TabFilter systemDefaults() {
        return new TabFilter(List.of(ScopeSelector.system()), null);
    }

    /**
     * Every record that can contribute to the viewer's merged view: system defaults, then the
     * viewer's organization, role and user records where those ids are known. Without an
     * organization only the system defaults apply.
     */
    public static TabFilter candidatesFor(ViewerIdentity viewer) {
        if (!viewer.hasOrganization()) {
            return systemDefaults();
        }
        List<ScopeSelector> selectors = new ArrayList<>();
        selectors.add(ScopeSelector.system());
        selectors.add(new ScopeSelector(TabScope.ORGANIZATION, viewer.organizationId()));
        if (viewer.roleId() != null) {
            selectors.add(new ScopeSelector(TabScope.ROLE, viewer.roleId()));
        }
        if (viewer.userId() != null) {
            selectors.add(new ScopeSelector(TabScope.USER, viewer.userId()));
        }
        return new TabFilter(selectors, null);
    }

    /** Same selectors, restricted to one key. */
    public TabFilter forKey(String tabKey) {
        return new TabFilter(anyOf, tabKey);
    }

    public boolean matches(TabRecord record) {
        if (key != null && !key.equals(record.key())) {
            return false;
        }
        return anyOf.stream().anyMatch(selector -> selector.matches(record));
    }

    /**
     * One (scope, owner) pair.
     *
     * @param scope scope to match
     * @param ownerId owner to match; ignored for system scope
     */
    public record ScopeSelector(TabScope scope, Long ownerId) {

        public ScopeSelector {
            Objects.requireNonNull(scope, "scope");
            if (scope != TabScope.SYSTEM && ownerId == null) {
                throw new IllegalArgumentException(scope.value() + " selector requires an owner id");
            }
        }

        public static ScopeSelector system() {
            return new ScopeSelector(TabScope.SYSTEM, null);
        }

        public boolean matches(TabRecord record) {
            if (record.scope() != scope) {
                return false;
            }
            return scope == TabScope.SYSTEM
                    ? record.systemDefault()
                    : ownerId.equals(record.scopeOwnerId());
        }
    }
}
