package com.bluequee.tabconfig.domain;

import java.util.Map;

/**
 * A custom tab as requested by a caller. Scope owner and organization are derived from the
 * caller's identity, never taken from the request.
 */
public record NewTab(
        String key,
        String label,
        String icon,
        String contentType,
        String category,
        Map<String, Object> settings,
        TabScope scope,
        boolean visible,
        boolean mandatory,
        int displayOrder) {

    /** The unsaved record owned by {@code ownerId} within {@code organizationId}. */
    public TabRecord toRecord(Long ownerId, Long organizationId, Long creator) {
        return new TabRecord(
                null,
                key,
                label,
                icon,
                contentType,
                category,
                settings,
                scope,
                ownerId,
                organizationId,
                visible,
                mandatory,
                false,
                displayOrder,
                creator,
                null,
                null);
    }
}
