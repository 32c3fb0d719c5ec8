package com.bluequee.tabconfig.domain.error;

/**
 * Base class for every rejected tab configuration operation.
 *
 * <p>WHY one hierarchy with a {@link TabErrorKind}: the web layer maps kinds to HTTP statuses in
 * one place, and metrics tag rejections by kind.
 */
public abstract class TabConfigException extends RuntimeException {

    private final TabErrorKind kind;

    protected TabConfigException(TabErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TabConfigException(TabErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TabErrorKind kind() {
        return kind;
    }
}
