package com.hyperdesk.vmrequest.domain;

import java.util.regex.Pattern;

/**
 * Validated VM name, usable as a hostname label.
 *
 * <p>3 to 63 characters of lowercase letters, digits and hyphens; must start and end with a letter
 * or digit and may not contain consecutive hyphens.
 */
public record VmName(String value) {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 63;

    private static final Pattern ALLOWED = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");

    public VmName {
        if (value == null) {
            throw new IllegalArgumentException("VM name must not be null");
        }
        if (value.length() < MIN_LENGTH) {
            throw new IllegalArgumentException("VM name must be at least " + MIN_LENGTH + " characters");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("VM name must not exceed " + MAX_LENGTH + " characters");
        }
        if (value.contains("--")) {
            throw new IllegalArgumentException("VM name must not contain consecutive hyphens");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "VM name may only contain lowercase letters, digits and hyphens, "
                            + "and must start and end with a letter or digit: '" + value + "'");
        }
    }

    /** Trims surrounding whitespace, then validates. */
    public static VmName of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("VM name must not be null");
        }
        return new VmName(raw.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
