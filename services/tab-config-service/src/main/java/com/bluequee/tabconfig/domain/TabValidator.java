package com.bluequee.tabconfig.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural validation of custom tabs before they reach the store.
 *
 * <p>WHY manual validation: the domain stays free of Bean Validation, and every error is reported
 * at once in a {@link ValidationResult}.
 */
public final class TabValidator {

    /** Lowercase letters, digits and dashes; must start with a letter or digit. */
    public static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]*");

    public static final int MAX_KEY_LENGTH = 64;

    // column widths of tab_configs
    public static final int MAX_LABEL_LENGTH = 200;
    public static final int MAX_ICON_LENGTH = 100;
    public static final int MAX_CONTENT_TYPE_LENGTH = 50;
    public static final int MAX_CATEGORY_LENGTH = 50;

    private TabValidator() {
        // utility class
    }

    public static ValidationResult validate(NewTab tab) {
        var errors = new ArrayList<String>();

        if (isBlank(tab.key())) {
            errors.add("key must not be null or blank");
        } else {
            if (!KEY_PATTERN.matcher(tab.key()).matches()) {
                errors.add("key must match " + KEY_PATTERN.pattern());
            }
            if (tab.key().length() > MAX_KEY_LENGTH) {
                errors.add("key must be at most " + MAX_KEY_LENGTH + " characters");
            }
        }
        if (isBlank(tab.label())) {
            errors.add("label must not be null or blank");
        }
        checkLength("label", tab.label(), MAX_LABEL_LENGTH, errors);
        checkLength("icon", tab.icon(), MAX_ICON_LENGTH, errors);
        if (isBlank(tab.contentType())) {
            errors.add("contentType must not be null or blank");
        }
        checkLength("contentType", tab.contentType(), MAX_CONTENT_TYPE_LENGTH, errors);
        checkLength("category", tab.category(), MAX_CATEGORY_LENGTH, errors);
        if (tab.scope() == null) {
            errors.add("scope must not be null");
        }
        if (tab.displayOrder() < 0) {
            errors.add("displayOrder must be >= 0");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public static ValidationResult validate(TabPatch patch) {
        var errors = new ArrayList<String>();

        if (patch.label() != null && patch.label().isBlank()) {
            errors.add("label must not be blank");
        }
        checkLength("label", patch.label(), MAX_LABEL_LENGTH, errors);
        checkLength("icon", patch.icon(), MAX_ICON_LENGTH, errors);

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void checkLength(String field, String value, int max, List<String> errors) {
        if (value != null && value.length() > max) {
            errors.add(field + " must be at most " + max + " characters");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
