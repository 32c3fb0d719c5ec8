package com.bluequee.tabconfig.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One tab configuration entry at one scope.
 *
 * <p>{@code key} is the logical tab identity shared across scopes; at most one record exists per
 * ({@code key}, {@code scope}, {@code scopeOwnerId}). {@code label}, {@code icon},
 * {@code contentType}, {@code category} and {@code settings} are opaque display metadata.
 *
 * @param id store-assigned identifier, null until inserted
 * @param key logical tab identity, e.g. "overview"
 * @param label display label
 * @param icon icon name
 * @param contentType how the client renders the tab, e.g. "builtin_component"
 * @param category grouping such as "clinical" or "administrative"
 * @param settings free-form content settings
 * @param scope level this record is defined at
 * @param scopeOwnerId organization, role or user id owning the record; null at system scope
 * @param organizationId organization the record belongs to; null at system scope
 * @param visible whether the tab is shown
 * @param mandatory whether the tab may never be hidden
 * @param systemDefault immutable seed record
 * @param displayOrder presentation order after merge
 * @param createdBy creating user, null for seeded defaults
 * @param createdAt store-assigned creation time
 * @param updatedAt store-assigned last modification time
 */
public record TabRecord(
        Long id,
        String key,
        String label,
        String icon,
        String contentType,
        String category,
        Map<String, Object> settings,
        TabScope scope,
        Long scopeOwnerId,
        Long organizationId,
        boolean visible,
        boolean mandatory,
        boolean systemDefault,
        int displayOrder,
        Long createdBy,
        Instant createdAt,
        Instant updatedAt) {

    public TabRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(scope, "scope");
        settings =
                settings == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    /** Whether this record occupies the given (key, scope, owner) slot. */
    public boolean occupies(String slotKey, TabScope slotScope, Long slotOwnerId) {
        return key.equals(slotKey) && scope == slotScope && Objects.equals(scopeOwnerId, slotOwnerId);
    }

    /**
     * A new, unsaved override of this record at a more specific scope. Display metadata is copied;
     * the override is never a system default and never mandatory.
     */
    public TabRecord overrideAt(
            TabScope targetScope,
            Long targetOwnerId,
            Long targetOrganizationId,
            boolean overrideVisible,
            Long creator) {
        return new TabRecord(
                null,
                key,
                label,
                icon,
                contentType,
                category,
                settings,
                targetScope,
                targetOwnerId,
                targetOrganizationId,
                overrideVisible,
                false,
                false,
                displayOrder,
                creator,
                null,
                null);
    }

    public TabRecord withVisible(boolean newVisible) {
        return new TabRecord(
                id, key, label, icon, contentType, category, settings, scope, scopeOwnerId,
                organizationId, newVisible, mandatory, systemDefault, displayOrder, createdBy,
                createdAt, updatedAt);
    }

    public TabRecord withDisplayOrder(int newDisplayOrder) {
        return new TabRecord(
                id, key, label, icon, contentType, category, settings, scope, scopeOwnerId,
                organizationId, visible, mandatory, systemDefault, newDisplayOrder, createdBy,
                createdAt, updatedAt);
    }

    public TabRecord withDisplay(String newLabel, String newIcon, Map<String, Object> newSettings) {
        return new TabRecord(
                id, key, newLabel, newIcon, contentType, category, newSettings, scope, scopeOwnerId,
                organizationId, visible, mandatory, systemDefault, displayOrder, createdBy,
                createdAt, updatedAt);
    }

    /** Copy carrying store-assigned identity and timestamps. */
    public TabRecord stored(Long newId, Instant newCreatedAt, Instant newUpdatedAt) {
        return new TabRecord(
                newId, key, label, icon, contentType, category, settings, scope, scopeOwnerId,
                organizationId, visible, mandatory, systemDefault, displayOrder, createdBy,
                newCreatedAt, newUpdatedAt);
    }
}
