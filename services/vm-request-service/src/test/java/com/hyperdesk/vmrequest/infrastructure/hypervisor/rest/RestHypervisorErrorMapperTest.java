package com.hyperdesk.vmrequest.infrastructure.hypervisor.rest;

import static org.assertj.core.api.Assertions.assertThat;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@DisplayName("RestHypervisorErrorMapper")
class RestHypervisorErrorMapperTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final RestHypervisorErrorMapper mapper = new RestHypervisorErrorMapper(TIMEOUT);

    private static RestClientResponseException response(HttpStatus status, String body) {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        if (status.is5xxServerError()) {
            return HttpServerErrorException.create(status, status.getReasonPhrase(), HttpHeaders.EMPTY, bytes,
                    StandardCharsets.UTF_8);
        }
        return HttpClientErrorException.create(status, status.getReasonPhrase(), HttpHeaders.EMPTY, bytes,
                StandardCharsets.UTF_8);
    }

    private HypervisorError map(RuntimeException e) {
        return mapper.map("createVm", "vm", "web-01", e);
    }

    @ParameterizedTest(name = "HTTP {0} -> {1}")
    @CsvSource({
            "401, AuthenticationFailed, false",
            "403, AuthorizationFailed, false",
            "404, ResourceNotFound, false",
            "409, ResourceAlreadyExists, false",
            "400, InvalidVmSpec, false",
            "422, InvalidVmSpec, false",
            "507, ResourceExhausted, true",
            "429, OperationFailed, true",
            "500, OperationFailed, true",
            "502, OperationFailed, true",
            "418, UnknownError, false"
    })
    @DisplayName("maps HTTP status codes to error variants")
    void mapsStatus(int status, String variant, boolean retriable) {
        var error = map(response(HttpStatus.valueOf(status), null));

        assertThat(error.getClass().getSimpleName()).isEqualTo(variant);
        assertThat(error.retriable()).isEqualTo(retriable);
    }

    @Test
    @DisplayName("uses resource details from the error body when present")
    void usesBodyDetails() {
        var error = map(response(HttpStatus.NOT_FOUND,
                "{\"message\":\"no such template\",\"resourceType\":\"template\",\"resourceId\":\"ubuntu-99\"}"));

        assertThat(error).isEqualTo(new HypervisorError.ResourceNotFound("template", "ubuntu-99"));
    }

    @Test
    @DisplayName("falls back to the addressed resource when the body is not JSON")
    void nonJsonBody() {
        var error = map(response(HttpStatus.CONFLICT, "<html>conflict</html>"));

        assertThat(error).isEqualTo(new HypervisorError.ResourceAlreadyExists("vm", "web-01"));
    }

    @Test
    @DisplayName("carries capacity numbers of an insufficient storage response")
    void capacity() {
        var error = map(response(HttpStatus.INSUFFICIENT_STORAGE,
                "{\"resourceType\":\"cpu\",\"requested\":8,\"available\":2}"));

        assertThat(error).isEqualTo(new HypervisorError.ResourceExhausted("cpu", 8, 2));
    }

    @Test
    @DisplayName("uses the body message and field for validation errors")
    void validation() {
        var error = map(response(HttpStatus.BAD_REQUEST, "{\"message\":\"bad template\",\"field\":\"template\"}"));

        assertThat(error).isEqualTo(new HypervisorError.InvalidVmSpec("template", "bad template"));
    }

    @Test
    @DisplayName("a read timeout becomes OperationTimeout with the configured timeout")
    void timeout() {
        var error = map(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        assertThat(error).isEqualTo(new HypervisorError.OperationTimeout("createVm", TIMEOUT));
    }

    @Test
    @DisplayName("other I/O failures become ConnectionFailed")
    void connection() {
        var error = map(new ResourceAccessException("I/O error", new ConnectException("Connection refused")));

        assertThat(error).isInstanceOf(HypervisorError.ConnectionFailed.class);
        assertThat(error.message()).contains("Connection refused");
    }

    @Test
    @DisplayName("anything else is UnknownError")
    void unknown() {
        assertThat(map(new IllegalStateException("boom"))).isInstanceOf(HypervisorError.UnknownError.class);
    }
}
