package com.bluequee.tabconfig.domain.error;

import java.util.List;

public class InvalidTabException extends TabConfigException {

    private final List<String> errors;

    public InvalidTabException(List<String> errors) {
        super(TabErrorKind.INVALID_TAB, "Invalid tab: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
