package com.hyperdesk.vmrequest.application.hypervisor;

import java.time.Duration;

/**
 * Closed set of failures a hypervisor adapter may report. Adapters translate every backend
 * exception into exactly one variant; nothing backend-specific crosses the port.
 * <p>
 * {@link #retriable()} is fixed per variant: {@code true} when the same call may succeed later
 * without anyone changing configuration.
 */
public sealed interface HypervisorError {

    String message();

    boolean retriable();

    record AuthenticationFailed(String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return false;
        }
    }

    record AuthorizationFailed(String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return false;
        }
    }

    /** A template, datastore, network or VM the call refers to does not exist. */
    record ResourceNotFound(String resourceType, String resourceId) implements HypervisorError {
        @Override
        public String message() {
            return resourceType + " not found: " + resourceId;
        }

        @Override
        public boolean retriable() {
            return false;
        }
    }

    /** Not enough capacity right now; may succeed once resources free up. */
    record ResourceExhausted(String resourceType, int requested, int available) implements HypervisorError {
        @Override
        public String message() {
            return "Insufficient %s: requested %d, available %d".formatted(resourceType, requested, available);
        }

        @Override
        public boolean retriable() {
            return true;
        }
    }

    record ResourceAlreadyExists(String resourceType, String name) implements HypervisorError {
        @Override
        public String message() {
            return resourceType + " already exists: " + name;
        }

        @Override
        public boolean retriable() {
            return false;
        }
    }

    record OperationNotSupported(String operation, HypervisorType hypervisor) implements HypervisorError {
        @Override
        public String message() {
            return operation + " is not supported by " + hypervisor;
        }

        @Override
        public boolean retriable() {
            return false;
        }
    }

    record OperationFailed(String operation, String details) implements HypervisorError {
        @Override
        public String message() {
            return operation + " failed: " + details;
        }

        @Override
        public boolean retriable() {
            return true;
        }
    }

    record OperationTimeout(String operation, Duration timeout) implements HypervisorError {
        @Override
        public String message() {
            return operation + " timed out after " + timeout.toSeconds() + "s";
        }

        @Override
        public boolean retriable() {
            return true;
        }
    }

    record ConnectionFailed(String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return true;
        }
    }

    record InvalidConfiguration(String field, String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return false;
        }
    }

    record InvalidVmSpec(String field, String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return false;
        }
    }

    record UnknownError(String message) implements HypervisorError {
        @Override
        public boolean retriable() {
            return false;
        }
    }
}
