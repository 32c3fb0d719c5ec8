package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.TabRecord;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds candidate records into one effective record per key.
 *
 * <p>For each key the record with the most specific scope wins (user over role over organization
 * over system). Among equal scopes the first one seen is kept.
 */
public final class TabMerger {

    /** Display order ascending, ties broken by key. */
    public static final Comparator<TabRecord> PRESENTATION_ORDER =
            Comparator.comparingInt(TabRecord::displayOrder).thenComparing(TabRecord::key);

    private TabMerger() {
        // utility class
    }

    public static Map<String, TabRecord> mergeByKey(Collection<TabRecord> candidates) {
        Map<String, TabRecord> merged = new LinkedHashMap<>();
        for (TabRecord candidate : candidates) {
            merged.merge(
                    candidate.key(),
                    candidate,
                    (kept, challenger) ->
                            challenger.scope().outranks(kept.scope()) ? challenger : kept);
        }
        return merged;
    }

    /** The merged, visible tabs in presentation order. */
    public static List<TabRecord> visibleInOrder(Collection<TabRecord> candidates) {
        return mergeByKey(candidates).values().stream()
                .filter(TabRecord::visible)
                .sorted(PRESENTATION_ORDER)
                .toList();
    }

    public static long countVisible(Collection<TabRecord> candidates) {
        return mergeByKey(candidates).values().stream().filter(TabRecord::visible).count();
    }
}
