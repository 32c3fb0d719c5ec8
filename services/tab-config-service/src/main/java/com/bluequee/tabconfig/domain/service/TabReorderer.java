package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.OrderChange;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.error.PartialIdSetException;
import com.bluequee.tabconfig.domain.error.SystemDefaultImmutableException;
import com.bluequee.tabconfig.domain.error.UnauthorizedTabAccessException;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a batch of display-order changes, all or nothing.
 *
 * <p>The whole batch is checked (every id exists, none is a system default, the caller owns all of
 * them) before the first update, and the updates run in one transaction.
 */
public class TabReorderer {

    private static final Logger log = LoggerFactory.getLogger(TabReorderer.class);

    private final TabConfigStore store;

    public TabReorderer(TabConfigStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return number of distinct records reordered; 0 for an empty batch
     */
    public int reorder(List<OrderChange> changes, ViewerIdentity caller) {
        if (changes.isEmpty()) {
            return 0;
        }
        if (!caller.hasOrganization()) {
            throw new UnauthorizedTabAccessException("Organization context required");
        }
        // last entry wins when an id is repeated
        Map<Long, Integer> orders = new LinkedHashMap<>();
        changes.forEach(change -> orders.put(change.id(), change.displayOrder()));

        return store.inTransaction(
                () -> {
                    List<TabRecord> records = store.findAllById(orders.keySet());
                    Set<Long> found = records.stream().map(TabRecord::id).collect(Collectors.toSet());
                    List<Long> missing =
                            orders.keySet().stream().filter(id -> !found.contains(id)).toList();
                    if (!missing.isEmpty()) {
                        throw new PartialIdSetException(missing);
                    }
                    for (TabRecord record : records) {
                        if (record.systemDefault()) {
                            throw new SystemDefaultImmutableException(record.key());
                        }
                    }
                    for (TabRecord record : records) {
                        if (!OwnershipValidator.canModify(record, caller)) {
                            throw new UnauthorizedTabAccessException(
                                    "Not authorized to reorder tab configuration " + record.id());
                        }
                    }
                    for (TabRecord record : records) {
                        store.update(record.withDisplayOrder(orders.get(record.id())));
                    }
                    log.info("Reordered {} tab configuration(s)", records.size());
                    return records.size();
                });
    }
}
