package com.bluequee.tabconfig.domain.error;

import com.bluequee.tabconfig.domain.TabScope;

/** The change would leave the viewer with no visible tab at all. */
public class WouldHideAllTabsException extends TabConfigException {

    public WouldHideAllTabsException(String key) {
        super(
                TabErrorKind.WOULD_HIDE_ALL_TABS,
                "Changing tab '" + key + "' would leave no visible tabs; at least one must remain");
    }

    private WouldHideAllTabsException(TabScope resetScope) {
        super(
                TabErrorKind.WOULD_HIDE_ALL_TABS,
                "Resetting " + resetScope.value() + " overrides would leave no visible tabs");
    }

    /** Removing every override at {@code scope} would uncover only hidden tabs. */
    public static WouldHideAllTabsException forReset(TabScope scope) {
        return new WouldHideAllTabsException(scope);
    }
}
