package com.bluequee.tabconfig.api.dto;

import com.bluequee.tabconfig.domain.TabRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** Wire shape of a tab configuration record. */
public record TabResponse(
        Long id,
        String key,
        String label,
        String icon,
        String contentType,
        String category,
        Map<String, Object> settings,
        String scope,
        Long scopeOwnerId,
        Long organizationId,
        @JsonProperty("isVisible") boolean visible,
        @JsonProperty("isMandatory") boolean mandatory,
        @JsonProperty("isSystemDefault") boolean systemDefault,
        int displayOrder,
        Long createdBy,
        Instant createdAt,
        Instant updatedAt) {

    public static TabResponse from(TabRecord record) {
        return new TabResponse(
                record.id(),
                record.key(),
                record.label(),
                record.icon(),
                record.contentType(),
                record.category(),
                record.settings(),
                record.scope().value(),
                record.scopeOwnerId(),
                record.organizationId(),
                record.visible(),
                record.mandatory(),
                record.systemDefault(),
                record.displayOrder(),
                record.createdBy(),
                record.createdAt(),
                record.updatedAt());
    }
}
