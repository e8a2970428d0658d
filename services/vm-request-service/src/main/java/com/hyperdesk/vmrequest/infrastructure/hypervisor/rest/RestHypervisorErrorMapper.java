package com.hyperdesk.vmrequest.infrastructure.hypervisor.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Translates failures of the management API into {@link HypervisorError} variants.
 * <p>
 * 401, 403, 404, 409, 400/422 and 507 map to the matching variant; 429 and 5xx become
 * {@code OperationFailed}; read timeouts become {@code OperationTimeout}, other I/O problems
 * {@code ConnectionFailed}. Anything else is {@code UnknownError}.
 */
public class RestHypervisorErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(RestHypervisorErrorMapper.class);

    private static final int INSUFFICIENT_STORAGE = 507;
    private static final int TOO_MANY_REQUESTS = 429;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Duration timeout;

    public RestHypervisorErrorMapper(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @param resourceType what the call addressed, used when the error body does not say
     * @param resourceId   id or name of the addressed resource
     */
    public HypervisorError map(String operation, String resourceType, String resourceId, RuntimeException e) {
        if (e instanceof RestClientResponseException response) {
            return mapResponse(operation, resourceType, resourceId, response);
        }
        if (e instanceof ResourceAccessException) {
            Throwable cause = e.getCause();
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return new HypervisorError.OperationTimeout(operation, timeout);
            }
            return new HypervisorError.ConnectionFailed("Cannot reach hypervisor API: "
                    + (cause != null ? cause.getMessage() : e.getMessage()));
        }
        log.error("Unexpected failure during {}", operation, e);
        return new HypervisorError.UnknownError(operation + " failed: " + e.getClass().getSimpleName());
    }

    private HypervisorError mapResponse(String operation, String resourceType, String resourceId,
                                        RestClientResponseException e) {
        int status = e.getStatusCode().value();
        RestHypervisorApi.ErrorBody body = parseBody(e.getResponseBodyAsString());
        String message = body.message() != null ? body.message() : "HTTP " + status + " from hypervisor API";

        if (status == 401) {
            return new HypervisorError.AuthenticationFailed(message);
        } else if (status == 403) {
            return new HypervisorError.AuthorizationFailed(message);
        } else if (status == 404) {
            return new HypervisorError.ResourceNotFound(
                    orDefault(body.resourceType(), resourceType), orDefault(body.resourceId(), resourceId));
        } else if (status == 409) {
            return new HypervisorError.ResourceAlreadyExists(
                    orDefault(body.resourceType(), resourceType), orDefault(body.resourceId(), resourceId));
        } else if (status == 400 || status == 422) {
            return new HypervisorError.InvalidVmSpec(orDefault(body.field(), "spec"), message);
        } else if (status == INSUFFICIENT_STORAGE) {
            return new HypervisorError.ResourceExhausted(orDefault(body.resourceType(), "capacity"),
                    body.requested() != null ? body.requested() : 0,
                    body.available() != null ? body.available() : 0);
        } else if (status == TOO_MANY_REQUESTS || status >= 500) {
            return new HypervisorError.OperationFailed(operation, "HTTP " + status + ": " + message);
        }
        return new HypervisorError.UnknownError(operation + " failed with HTTP " + status + ": " + message);
    }

    private RestHypervisorApi.ErrorBody parseBody(String raw) {
        var empty = new RestHypervisorApi.ErrorBody(null, null, null, null, null, null);
        if (raw == null || raw.isBlank()) {
            return empty;
        }
        try {
            return objectMapper.readValue(raw, RestHypervisorApi.ErrorBody.class);
        } catch (JsonProcessingException e) {
            log.debug("Hypervisor error body is not JSON: {}", raw);
            return empty;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
