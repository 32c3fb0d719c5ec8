package com.bluequee.tabconfig.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Body of the visibility endpoints.
 *
 * @param key tab key; required by {@code PATCH /visibility}, ignored by {@code PATCH /{id}/visibility}
 * @param visible new visibility
 * @param scope target scope, defaults to "user"
 */
public record VisibilityRequest(
        String key, @NotNull @JsonProperty("isVisible") Boolean visible, String scope) {}
