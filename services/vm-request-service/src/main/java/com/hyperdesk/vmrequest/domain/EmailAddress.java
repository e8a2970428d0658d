package com.hyperdesk.vmrequest.domain;

import java.util.Optional;
import java.util.regex.Pattern;

/** Syntactically plausible e-mail address used for notifications. */
public record EmailAddress(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public EmailAddress {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid e-mail address");
        }
    }

    /** Lenient parse: blank or malformed input gives empty instead of an exception. */
    public static Optional<EmailAddress> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (!FORMAT.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(new EmailAddress(trimmed));
    }

    @Override
    public String toString() {
        return value;
    }
}
