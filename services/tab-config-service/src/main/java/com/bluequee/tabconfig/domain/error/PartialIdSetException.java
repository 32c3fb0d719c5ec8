package com.bluequee.tabconfig.domain.error;

import java.util.List;

/** A reorder request referenced ids that do not exist. Nothing was applied. */
public class PartialIdSetException extends TabConfigException {

    private final List<Long> missingIds;

    public PartialIdSetException(List<Long> missingIds) {
        super(TabErrorKind.PARTIAL_ID_SET, "Some tabs not found: " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<Long> missingIds() {
        return missingIds;
    }
}
