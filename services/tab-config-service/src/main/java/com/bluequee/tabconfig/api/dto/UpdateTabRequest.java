package com.bluequee.tabconfig.api.dto;

import com.bluequee.tabconfig.domain.TabPatch;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Body of {@code PATCH /api/v1/tab-configs/{id}}. Absent fields stay unchanged. */
public record UpdateTabRequest(
        String label,
        String icon,
        @JsonProperty("isVisible") Boolean visible,
        Map<String, Object> settings) {

    public TabPatch toPatch() {
        return new TabPatch(label, icon, visible, settings);
    }
}
