package com.bluequee.tabconfig.domain.error;

import com.bluequee.tabconfig.domain.TabScope;

public class DuplicateTabKeyException extends TabConfigException {

    public DuplicateTabKeyException(String key, TabScope scope, Long ownerId) {
        super(TabErrorKind.DUPLICATE_KEY, message(key, scope, ownerId));
    }

    public DuplicateTabKeyException(String key, TabScope scope, Long ownerId, Throwable cause) {
        super(TabErrorKind.DUPLICATE_KEY, message(key, scope, ownerId), cause);
    }

    private static String message(String key, TabScope scope, Long ownerId) {
        return "Tab '" + key + "' already exists at " + scope.value() + " scope for owner " + ownerId;
    }
}
