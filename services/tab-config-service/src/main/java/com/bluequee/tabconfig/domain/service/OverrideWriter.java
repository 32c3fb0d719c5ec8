package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.NewTab;
import com.bluequee.tabconfig.domain.PendingVisibility;
import com.bluequee.tabconfig.domain.TabPatch;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.TabValidator;
import com.bluequee.tabconfig.domain.ValidationResult;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.error.DuplicateTabKeyException;
import com.bluequee.tabconfig.domain.error.InvalidTabException;
import com.bluequee.tabconfig.domain.error.MandatoryTabViolationException;
import com.bluequee.tabconfig.domain.error.TabNotFoundException;
import com.bluequee.tabconfig.domain.error.UnauthorizedTabAccessException;
import com.bluequee.tabconfig.domain.error.WouldHideAllTabsException;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies configuration changes at a target scope without ever touching system defaults.
 *
 * <p>Every mutation validates against a fresh candidate snapshot taken inside
 * {@link TabConfigStore#inKeyTransaction}, so all rejections happen before the first write and two
 * concurrent hides of the last two visible tabs cannot both pass the guard.
 */
public class OverrideWriter {

    private static final Logger log = LoggerFactory.getLogger(OverrideWriter.class);

    private final TabConfigStore store;
    private final TabResolver resolver;

    public OverrideWriter(TabConfigStore store, TabResolver resolver) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Sets the visibility of {@code key} at {@code targetScope} for the caller. Updates the caller's
     * record in that slot if one exists, otherwise clones the currently effective record into it.
     */
    public TabRecord setVisibility(
            String key, TabScope targetScope, boolean visible, ViewerIdentity caller) {
        requireOrganization(caller);
        OwnershipValidator.requireWritableScope(targetScope, caller);
        Long ownerId = caller.ownerIdFor(targetScope);

        return store.inKeyTransaction(
                key,
                () -> {
                    List<TabRecord> candidates = resolver.candidatesFor(caller);
                    TabRecord effective = TabMerger.mergeByKey(candidates).get(key);
                    if (effective == null) {
                        throw new TabNotFoundException(key);
                    }
                    if (!visible) {
                        requireHideable(key, targetScope, ownerId, candidates);
                    }

                    Optional<TabRecord> existing =
                            candidates.stream()
                                    .filter(c -> c.occupies(key, targetScope, ownerId))
                                    .findFirst();
                    if (existing.isPresent()) {
                        return store.update(existing.get().withVisible(visible));
                    }
                    TabRecord created =
                            store.insert(
                                    effective.overrideAt(
                                            targetScope,
                                            ownerId,
                                            caller.organizationId(),
                                            visible,
                                            caller.userId()));
                    log.info(
                            "Created {} override for tab '{}' (owner={}, visible={})",
                            targetScope.value(),
                            key,
                            ownerId,
                            visible);
                    return created;
                });
    }

    /** Creates a caller-owned tab. The scope owner and organization come from the caller. */
    public TabRecord createCustomTab(NewTab tab, ViewerIdentity caller) {
        ValidationResult validation = TabValidator.validate(tab);
        if (!validation.valid()) {
            throw new InvalidTabException(validation.errors());
        }
        requireOrganization(caller);
        OwnershipValidator.requireWritableScope(tab.scope(), caller);
        Long ownerId = caller.ownerIdFor(tab.scope());

        return store.inKeyTransaction(
                tab.key(),
                () -> {
                    List<TabRecord> candidates = resolver.candidatesFor(caller);
                    if (store.findInSlot(tab.key(), tab.scope(), ownerId).isPresent()) {
                        throw new DuplicateTabKeyException(tab.key(), tab.scope(), ownerId);
                    }
                    // a hidden record over an inherited key is a hide
                    if (!tab.visible()) {
                        requireHideable(tab.key(), tab.scope(), ownerId, candidates);
                    }
                    TabRecord created =
                            store.insert(
                                    tab.toRecord(ownerId, caller.organizationId(), caller.userId()));
                    log.info(
                            "Created custom tab '{}' at {} scope (id={})",
                            created.key(),
                            created.scope().value(),
                            created.id());
                    return created;
                });
    }

    public TabRecord updateCustomTab(long id, TabPatch patch, ViewerIdentity caller) {
        ValidationResult validation = TabValidator.validate(patch);
        if (!validation.valid()) {
            throw new InvalidTabException(validation.errors());
        }
        requireOrganization(caller);
        TabRecord record = store.findById(id).orElseThrow(() -> new TabNotFoundException(id));
        OwnershipValidator.requireModifiable(record, caller);

        return store.inKeyTransaction(
                record.key(),
                () -> {
                    TabRecord current =
                            store.findById(id).orElseThrow(() -> new TabNotFoundException(id));
                    OwnershipValidator.requireModifiable(current, caller);
                    if (patch.hides(current)) {
                        requireHideable(
                                current.key(),
                                current.scope(),
                                current.scopeOwnerId(),
                                resolver.candidatesFor(caller));
                    }
                    return store.update(patch.applyTo(current));
                });
    }

    public void deleteCustomTab(long id, ViewerIdentity caller) {
        requireOrganization(caller);
        TabRecord record = store.findById(id).orElseThrow(() -> new TabNotFoundException(id));
        OwnershipValidator.requireModifiable(record, caller);

        store.inKeyTransaction(
                record.key(),
                () -> {
                    TabRecord current =
                            store.findById(id).orElseThrow(() -> new TabNotFoundException(id));
                    if (VisibilityGuard.wouldLeaveZeroVisibleAfterRemoval(
                            current, resolver.candidatesFor(caller))) {
                        throw new WouldHideAllTabsException(current.key());
                    }
                    if (!store.delete(id)) {
                        throw new TabNotFoundException(id);
                    }
                    log.info("Deleted tab configuration {} ('{}')", id, current.key());
                    return null;
                });
    }

    /**
     * Removes every record the caller owns at {@code scope}, restoring inherited values. Rejected
     * when the inherited values would leave the caller with no visible tab.
     */
    public int resetOverrides(TabScope scope, ViewerIdentity caller) {
        requireOrganization(caller);
        OwnershipValidator.requireWritableScope(scope, caller);
        long ownerId = caller.ownerIdFor(scope);
        int deleted =
                store.inTransaction(
                        () -> {
                            if (VisibilityGuard.wouldLeaveZeroVisibleAfterReset(
                                    scope, ownerId, resolver.candidatesFor(caller))) {
                                throw WouldHideAllTabsException.forReset(scope);
                            }
                            return store.deleteOverrides(scope, ownerId);
                        });
        log.info("Reset {} {} override(s) for owner {}", deleted, scope.value(), ownerId);
        return deleted;
    }

    private static void requireOrganization(ViewerIdentity caller) {
        if (!caller.hasOrganization()) {
            throw new UnauthorizedTabAccessException("Organization context required");
        }
    }

    private static void requireHideable(
            String key, TabScope scope, Long ownerId, List<TabRecord> candidates) {
        boolean mandatory =
                candidates.stream().anyMatch(c -> c.key().equals(key) && c.mandatory());
        if (mandatory) {
            throw new MandatoryTabViolationException(key);
        }
        if (VisibilityGuard.wouldLeaveZeroVisible(
                new PendingVisibility(key, scope, ownerId, false), candidates)) {
            throw new WouldHideAllTabsException(key);
        }
    }
}
