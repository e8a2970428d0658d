package com.hyperdesk.vmrequest.application.vmrequest;

final class CommandPreconditions {

    private CommandPreconditions() {
        // utility class
    }

    static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    static <T> T requirePresent(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    static void requireMaxLength(String value, int max, String name) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException(name + " must not exceed " + max + " characters");
        }
    }
}
