package com.bluequee.tabconfig.domain.error;

/** Caller does not own the record or may not write at the requested scope. */
public class UnauthorizedTabAccessException extends TabConfigException {

    public UnauthorizedTabAccessException(String message) {
        super(TabErrorKind.UNAUTHORIZED, message);
    }
}
