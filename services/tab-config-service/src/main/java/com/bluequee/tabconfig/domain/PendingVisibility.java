package com.bluequee.tabconfig.domain;

/**
 * A visibility change that has been requested but not written: the record in slot
 * ({@code key}, {@code scope}, {@code ownerId}) will have {@code visible}.
 */
public record PendingVisibility(String key, TabScope scope, Long ownerId, boolean visible) {}
