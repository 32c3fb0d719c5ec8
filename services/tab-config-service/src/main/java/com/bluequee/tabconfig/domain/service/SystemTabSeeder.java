package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.TabFilter;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import com.bluequee.tabconfig.domain.service.SystemTabCatalog.SystemTab;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure every catalog tab exists as a system default. Idempotent: only missing keys are
 * inserted and existing system records are never changed.
 */
public class SystemTabSeeder {

    private static final Logger log = LoggerFactory.getLogger(SystemTabSeeder.class);

    private final TabConfigStore store;
    private final SystemTabCatalog catalog;
    private final Set<String> mandatoryKeys;

    public SystemTabSeeder(TabConfigStore store, SystemTabCatalog catalog, Set<String> mandatoryKeys) {
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.mandatoryKeys = Set.copyOf(mandatoryKeys);
    }

    /** @return number of system tabs inserted by this call */
    public int ensureSeeded() {
        return store.inTransaction(
                () -> {
                    Set<String> existing =
                            store.find(TabFilter.systemDefaults()).stream()
                                    .map(TabRecord::key)
                                    .collect(Collectors.toSet());
                    List<SystemTab> missing =
                            catalog.tabs().stream()
                                    .filter(tab -> !existing.contains(tab.key()))
                                    .toList();
                    for (SystemTab tab : missing) {
                        store.insert(tab.toRecord(mandatoryKeys.contains(tab.key())));
                    }
                    log.info(
                            "Seeded {} system tab(s), {} already present",
                            missing.size(),
                            existing.size());
                    return missing.size();
                });
    }
}
