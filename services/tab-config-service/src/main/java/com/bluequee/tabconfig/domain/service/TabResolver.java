package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.TabFilter;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import java.util.List;
import java.util.Objects;

/** Computes the tab set a viewer sees. Read-only. */
public class TabResolver {

    private final TabConfigStore store;

    public TabResolver(TabConfigStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Every record that takes part in the viewer's merge, unmerged. */
    public List<TabRecord> candidatesFor(ViewerIdentity viewer) {
        return store.find(TabFilter.candidatesFor(viewer));
    }

    public List<TabRecord> candidatesFor(ViewerIdentity viewer, String key) {
        return store.find(TabFilter.candidatesFor(viewer).forKey(key));
    }

    /** Visible effective tabs ordered by display order, then key. */
    public List<TabRecord> resolve(ViewerIdentity viewer) {
        return TabMerger.visibleInOrder(candidatesFor(viewer));
    }
}
