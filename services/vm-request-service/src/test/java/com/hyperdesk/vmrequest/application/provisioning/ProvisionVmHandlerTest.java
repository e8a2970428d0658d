package com.hyperdesk.vmrequest.application.provisioning;

import static com.hyperdesk.vmrequest.VmRequestTestData.PROJECT;
import static com.hyperdesk.vmrequest.VmRequestTestData.REQUESTER;
import static com.hyperdesk.vmrequest.VmRequestTestData.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.SpanHelper;
import com.hyperdesk.vmrequest.HandlerFixture;
import com.hyperdesk.vmrequest.VmRequestTestData;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorType;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;
import com.hyperdesk.vmrequest.application.hypervisor.ProvisioningResult;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.MappingError;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMapper;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.TenantResourceMapping;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestFailedHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestProvisioningHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestReadyHandler;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestError;
import com.hyperdesk.vmrequest.domain.VmName;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.VmSize;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import com.hyperdesk.vmrequest.domain.events.VmRequestProvisioningFailed;
import com.hyperdesk.vmrequest.domain.events.VmRequestReady;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("ProvisionVmHandler")
class ProvisionVmHandlerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:15:00Z");
    private static final TenantResourceMapping MAPPING = new TenantResourceMapping(TENANT, "cluster-a", "ds-01",
            "ubuntu-22.04", Map.of("default", "net-100"), "default");
    private static final ProvisioningResult CREATED =
            new ProvisioningResult("vm-42", "10.0.0.5", "web-01", NOW, null);

    private HandlerFixture fixture;
    private HypervisorPort hypervisor;
    private Map<String, TenantResourceMapping> mappings;
    private ProvisionVmHandler handler;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        hypervisor = mock(HypervisorPort.class);
        when(hypervisor.type()).thenReturn(HypervisorType.SIMULATED);
        mappings = new HashMap<>(Map.of(TENANT, MAPPING));
        handler = new ProvisionVmHandler(
                new MarkVmRequestProvisioningHandler(fixture.eventStream, fixture.ports, fixture.instrumentation),
                new MarkVmRequestReadyHandler(fixture.eventStream, fixture.ports, fixture.instrumentation),
                new MarkVmRequestFailedHandler(fixture.eventStream, fixture.ports, fixture.instrumentation),
                tenantId -> Optional.ofNullable(mappings.get(tenantId)),
                new ResourceMapper(),
                new ResilientProvisioningService(hypervisor,
                        new ProvisioningRetryPolicy(3, Duration.ofMillis(10), 1.0, Duration.ofMillis(10))),
                new SpanHelper(OpenTelemetry.noop().getTracer("test")),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ProvisionVmCommand command(VmRequestAggregate request) {
        return new ProvisionVmCommand(TENANT, request.id(), PROJECT, REQUESTER, request.vmName(), request.size(),
                null, "corr-prov");
    }

    private VmRequestEvent lastEvent(VmRequestId id) {
        List<VmRequestEvent> history = fixture.eventStream.history(id).value();
        return history.get(history.size() - 1);
    }

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("creates the VM and marks the request ready")
        void provisionsApprovedRequest() {
            var request = fixture.seed(VmRequestTestData.approvedRequest());
            when(hypervisor.createVm(any())).thenReturn(Result.success(CREATED));

            var result = handler.handle(command(request));

            assertThat(result.value().vm()).isEqualTo(CREATED);
            assertThat(result.value().version()).isEqualTo(4);
            assertThat(lastEvent(request.id())).isInstanceOfSatisfying(VmRequestReady.class, ready -> {
                assertThat(ready.hypervisorVmId()).isEqualTo("vm-42");
                assertThat(ready.metadata().userId()).isEqualTo(ProvisionVmHandler.SYSTEM_USER);
            });
        }

        @Test
        @DisplayName("passes the mapped VM definition to the hypervisor")
        void mapsSpec() {
            var request = fixture.seed(VmRequestTestData.approvedRequest());
            when(hypervisor.createVm(any())).thenReturn(Result.success(CREATED));

            handler.handle(command(request));

            var spec = ArgumentCaptor.forClass(HypervisorVmSpec.class);
            verify(hypervisor).createVm(spec.capture());
            assertThat(spec.getValue().computeTarget()).isEqualTo("cluster-a");
            assertThat(spec.getValue().networkId()).isEqualTo("net-100");
            assertThat(spec.getValue().cpuCores()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("duplicate deliveries")
    class Duplicates {

        @Test
        @DisplayName("a request already provisioning is skipped without calling the hypervisor")
        void alreadyProvisioning() {
            var request = fixture.seed(VmRequestTestData.provisioningRequest());

            var result = handler.handle(command(request));

            assertThat(result.error()).isEqualTo(new ProvisionVmError.AlreadyInProgress(
                    request.id(), VmRequestStatus.PROVISIONING));
            verify(hypervisor, never()).createVm(any());
        }

        @Test
        @DisplayName("a second run after success is skipped")
        void secondRun() {
            var request = fixture.seed(VmRequestTestData.approvedRequest());
            when(hypervisor.createVm(any())).thenReturn(Result.success(CREATED));
            handler.handle(command(request));

            var again = handler.handle(command(request));

            assertThat(again.error()).isInstanceOf(ProvisionVmError.AlreadyInProgress.class);
            verify(hypervisor).createVm(any());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a tenant without mapping fails the request as invalid configuration")
        void missingMapping() {
            mappings.clear();
            var request = fixture.seed(VmRequestTestData.approvedRequest());

            var result = handler.handle(command(request));

            assertThat(result.error()).isEqualTo(new ProvisionVmError.MappingFailed(
                    new MappingError.MissingMapping(TENANT)));
            assertThat(lastEvent(request.id())).isInstanceOfSatisfying(VmRequestProvisioningFailed.class, failed -> {
                assertThat(failed.errorCode()).isEqualTo(ProvisioningErrorCode.VM_CONFIG_INVALID.name());
                assertThat(failed.retriable()).isFalse();
                assertThat(failed.retryCount()).isZero();
            });
            verify(hypervisor, never()).createVm(any());
        }

        @Test
        @DisplayName("exhausted retries fail the request with attempt count and time")
        void exhaustedRetries() {
            var request = fixture.seed(VmRequestTestData.approvedRequest());
            when(hypervisor.createVm(any()))
                    .thenReturn(Result.failure(new HypervisorError.ConnectionFailed("refused")));

            var result = handler.handle(command(request));

            assertThat(result.error()).isEqualTo(new ProvisionVmError.HypervisorFailed(
                    new HypervisorError.ConnectionFailed("refused"), 3));
            assertThat(lastEvent(request.id())).isInstanceOfSatisfying(VmRequestProvisioningFailed.class, failed -> {
                assertThat(failed.errorCode()).isEqualTo("CONNECTION_FAILED");
                assertThat(failed.reason()).isEqualTo(ProvisioningErrorCode.CONNECTION_FAILED.userMessage());
                assertThat(failed.retriable()).isTrue();
                assertThat(failed.retryCount()).isEqualTo(3);
                assertThat(failed.lastAttemptAt()).isEqualTo(NOW);
            });
            assertThat(fixture.eventStream.load(request.id()).value().status()).isEqualTo(VmRequestStatus.FAILED);
        }

        @Test
        @DisplayName("a permanent error fails after one attempt")
        void permanentError() {
            var request = fixture.seed(VmRequestTestData.approvedRequest());
            when(hypervisor.createVm(any()))
                    .thenReturn(Result.failure(new HypervisorError.ResourceAlreadyExists("vm", "web-01")));

            var result = handler.handle(command(request));

            assertThat(result.error()).isInstanceOfSatisfying(ProvisionVmError.HypervisorFailed.class, failed -> {
                assertThat(failed.attempts()).isEqualTo(1);
                assertThat(failed.retriable()).isFalse();
            });
            assertThat(lastEvent(request.id())).isInstanceOfSatisfying(VmRequestProvisioningFailed.class,
                    failed -> assertThat(failed.errorCode()).isEqualTo("NAME_CONFLICT"));
        }

        @Test
        @DisplayName("an unknown request is reported as a request failure")
        void unknownRequest() {
            var id = VmRequestId.generate();
            var command = new ProvisionVmCommand(TENANT, id, PROJECT, REQUESTER,
                    new VmName("web-01"), VmSize.S,
                    null, "corr-x");

            var result = handler.handle(command);

            assertThat(result.error()).isEqualTo(new ProvisionVmError.RequestFailed(new VmRequestError.NotFound(id)));
        }
    }
}
