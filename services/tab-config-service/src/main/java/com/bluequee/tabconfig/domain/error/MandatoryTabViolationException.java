package com.bluequee.tabconfig.domain.error;

public class MandatoryTabViolationException extends TabConfigException {

    public MandatoryTabViolationException(String key) {
        super(TabErrorKind.MANDATORY_TAB_VIOLATION, "Tab '" + key + "' is mandatory and cannot be hidden");
    }
}
