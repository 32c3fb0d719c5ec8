package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.NewTab;
import com.bluequee.tabconfig.domain.OrderChange;
import com.bluequee.tabconfig.domain.TabPatch;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.error.TabNotFoundException;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for the transport layer: tab resolution plus every configuration change.
 *
 * <p>Holds no mutable state; every decision is a function of the store snapshot and the caller
 * identity passed in.
 */
public class TabConfigService {

    /** Scope used when a caller does not name one. */
    public static final TabScope DEFAULT_TARGET_SCOPE = TabScope.USER;

    private final TabConfigStore store;
    private final TabResolver resolver;
    private final OverrideWriter writer;
    private final TabReorderer reorderer;

    public TabConfigService(
            TabConfigStore store, TabResolver resolver, OverrideWriter writer, TabReorderer reorderer) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.reorderer = Objects.requireNonNull(reorderer, "reorderer");
    }

    /** Visible tabs for the viewer in presentation order; system defaults only without an organization. */
    public List<TabRecord> resolveTabs(ViewerIdentity viewer) {
        return resolver.resolve(viewer);
    }

    public TabRecord setVisibility(
            String key, TabScope targetScope, boolean visible, ViewerIdentity caller) {
        return writer.setVisibility(key, scopeOrDefault(targetScope), visible, caller);
    }

    /** Looks the record up by id, then sets visibility for its key at {@code targetScope}. */
    public TabRecord setVisibilityById(
            long id, TabScope targetScope, boolean visible, ViewerIdentity caller) {
        TabRecord record = store.findById(id).orElseThrow(() -> new TabNotFoundException(id));
        return writer.setVisibility(record.key(), scopeOrDefault(targetScope), visible, caller);
    }

    public TabRecord createCustomTab(NewTab tab, ViewerIdentity caller) {
        return writer.createCustomTab(tab, caller);
    }

    public TabRecord updateCustomTab(long id, TabPatch patch, ViewerIdentity caller) {
        return writer.updateCustomTab(id, patch, caller);
    }

    public void deleteCustomTab(long id, ViewerIdentity caller) {
        writer.deleteCustomTab(id, caller);
    }

    public int reorder(List<OrderChange> changes, ViewerIdentity caller) {
        return reorderer.reorder(changes, caller);
    }

    public int resetOverrides(TabScope scope, ViewerIdentity caller) {
        return writer.resetOverrides(scopeOrDefault(scope), caller);
    }

    private static TabScope scopeOrDefault(TabScope scope) {
        return scope != null ? scope : DEFAULT_TARGET_SCOPE;
    }
}
