package com.bluequee.tabconfig.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * The four levels at which a tab can be configured, in increasing specificity.
 *
 * <p>WHY an enum with a fixed priority: the read path (merge) and the write path (guard simulation,
 * override creation) must agree on precedence. Both go through {@link #outranks(TabScope)}.
 */
public enum TabScope {

    SYSTEM("system", 1),
    ORGANIZATION("organization", 2),
    ROLE("role", 3),
    USER("user", 4);

    private final String value;
    private final int priority;

    TabScope(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    /** Wire and storage representation (e.g., "organization"). */
    public String value() {
        return value;
    }

    /** 1 for system up to 4 for user. */
    public int priority() {
        return priority;
    }

    /** Strictly more specific than {@code other}. */
    public boolean outranks(TabScope other) {
        return priority > other.priority;
    }

    public static Optional<TabScope> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (TabScope scope : values()) {
            if (scope.value.equals(normalized)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a wire value.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static TabScope parse(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tab scope: " + value));
    }
}
