package com.bluequee.tabconfig.api.dto;

import com.bluequee.tabconfig.domain.NewTab;
import com.bluequee.tabconfig.domain.TabScope;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/tab-configs}. The scope owner is never taken from the body.
 *
 * @param scope "organization", "role" or "user"; defaults to "user"
 */
public record CreateTabRequest(
        @NotBlank String key,
        @NotBlank String label,
        String icon,
        @NotBlank String contentType,
        String category,
        Map<String, Object> settings,
        String scope,
        @JsonProperty("isVisible") Boolean visible,
        @JsonProperty("isMandatory") Boolean mandatory,
        Integer displayOrder) {

    public NewTab toNewTab() {
        return new NewTab(
                key,
                label,
                icon,
                contentType,
                category,
                settings,
                scope == null ? TabScope.USER : TabScope.parse(scope),
                visible == null || visible,
                mandatory != null && mandatory,
                displayOrder == null ? 0 : displayOrder);
    }
}
