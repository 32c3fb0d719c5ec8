package com.bluequee.tabconfig.domain;

import java.util.Map;

/**
 * Partial update of a custom tab. Null fields are left unchanged.
 *
 * @param label new label
 * @param icon new icon
 * @param visible new visibility
 * @param settings replacement settings
 */
public record TabPatch(String label, String icon, Boolean visible, Map<String, Object> settings) {

    /** Whether applying this patch to {@code current} turns a visible tab into a hidden one. */
    public boolean hides(TabRecord current) {
        return visible != null && !visible && current.visible();
    }

    public TabRecord applyTo(TabRecord current) {
        TabRecord patched =
                current.withDisplay(
                        label != null ? label : current.label(),
                        icon != null ? icon : current.icon(),
                        settings != null ? settings : current.settings());
        return visible != null ? patched.withVisible(visible) : patched;
    }
}
