package com.bluequee.tabconfig.domain.error;

public class TabNotFoundException extends TabConfigException {

    public TabNotFoundException(long id) {
        super(TabErrorKind.NOT_FOUND, "Tab configuration " + id + " not found");
    }

    public TabNotFoundException(String key) {
        super(TabErrorKind.NOT_FOUND, "Tab '" + key + "' not found");
    }
}
