package com.bluequee.tabconfig.domain.error;

/** Stable, machine-readable failure categories returned to API clients as {@code errorKind}. */
public enum TabErrorKind {
    UNAUTHORIZED,
    NOT_FOUND,
    SYSTEM_DEFAULT_IMMUTABLE,
    MANDATORY_TAB_VIOLATION,
    WOULD_HIDE_ALL_TABS,
    DUPLICATE_KEY,
    PARTIAL_ID_SET,
    INVALID_TAB
}
