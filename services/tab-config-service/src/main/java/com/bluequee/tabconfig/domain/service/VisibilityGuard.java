package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.PendingVisibility;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Simulates a change against a viewer's candidate set and reports whether the viewer would be left
 * with zero visible tabs.
 *
 * <p>The rule is global across the merged tab set: hiding the last visible tab of any key is fine
 * as long as some other key stays visible. Pure; never touches the store.
 */
public final class VisibilityGuard {

    private VisibilityGuard() {
        // utility class
    }

    /**
     * Applies {@code pending} to {@code candidates} (replacing the record in its slot, or adding a
     * new one) and merges.
     *
     * @return true if the merged result has no visible tab. Always false for a show.
     */
    public static boolean wouldLeaveZeroVisible(
            PendingVisibility pending, Collection<TabRecord> candidates) {
        if (pending.visible()) {
            return false;
        }
        List<TabRecord> simulated = new ArrayList<>(candidates.size() + 1);
        TabRecord template = null;
        boolean replaced = false;
        for (TabRecord candidate : candidates) {
            if (candidate.occupies(pending.key(), pending.scope(), pending.ownerId())) {
                simulated.add(candidate.withVisible(false));
                replaced = true;
            } else {
                simulated.add(candidate);
            }
            if (template == null && candidate.key().equals(pending.key())) {
                template = candidate;
            }
        }
        if (!replaced && template != null) {
            simulated.add(
                    template.overrideAt(
                            pending.scope(), pending.ownerId(), template.organizationId(), false, null));
        }
        return TabMerger.countVisible(simulated) == 0;
    }

    /**
     * Whether deleting {@code removed} would take the viewer from at least one visible tab to none.
     */
    public static boolean wouldLeaveZeroVisibleAfterRemoval(
            TabRecord removed, Collection<TabRecord> candidates) {
        List<TabRecord> remaining =
                candidates.stream()
                        .filter(c -> !c.occupies(removed.key(), removed.scope(), removed.scopeOwnerId()))
                        .toList();
        return leavesZeroVisible(candidates, remaining);
    }

    /**
     * Whether removing every override owned by {@code ownerId} at {@code scope} would take the
     * viewer from at least one visible tab to none. System defaults are never removed.
     */
    public static boolean wouldLeaveZeroVisibleAfterReset(
            TabScope scope, long ownerId, Collection<TabRecord> candidates) {
        List<TabRecord> remaining =
                candidates.stream()
                        .filter(
                                c ->
                                        c.systemDefault()
                                                || c.scope() != scope
                                                || !Long.valueOf(ownerId).equals(c.scopeOwnerId()))
                        .toList();
        return leavesZeroVisible(candidates, remaining);
    }

    private static boolean leavesZeroVisible(
            Collection<TabRecord> before, Collection<TabRecord> after) {
        return TabMerger.countVisible(after) == 0 && TabMerger.countVisible(before) > 0;
    }
}
