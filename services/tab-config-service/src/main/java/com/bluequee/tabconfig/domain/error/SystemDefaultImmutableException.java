package com.bluequee.tabconfig.domain.error;

/** System defaults are never updated, deleted or reordered; callers override them instead. */
public class SystemDefaultImmutableException extends TabConfigException {

    public SystemDefaultImmutableException(String key) {
        super(
                TabErrorKind.SYSTEM_DEFAULT_IMMUTABLE,
                "System default tab '" + key + "' cannot be modified; create an override instead");
    }
}
