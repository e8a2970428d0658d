package com.hyperdesk.vmrequest.application.vmrequest;

import static com.hyperdesk.vmrequest.VmRequestTestData.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.hyperdesk.vmrequest.HandlerFixture;
import com.hyperdesk.vmrequest.VmRequestTestData;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("MarkVmRequestReadyHandler")
class MarkVmRequestReadyHandlerTest {

    private static final Instant PROVISIONED_AT = Instant.parse("2026-01-01T10:10:00Z");

    private HandlerFixture fixture;
    private MarkVmRequestReadyHandler handler;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        handler = new MarkVmRequestReadyHandler(fixture.eventStream, fixture.ports, fixture.instrumentation);
    }

    private MarkVmRequestReadyCommand ready(VmRequestId id, String ipAddress) {
        return new MarkVmRequestReadyCommand(TENANT, "system:provisioning", id, "vm-42", ipAddress, "web-01",
                PROVISIONED_AT, null, "corr-r");
    }

    @Test
    @DisplayName("records VM details on the projection")
    void recordsDetails() {
        var request = fixture.seed(VmRequestTestData.provisioningRequest());

        var result = handler.handle(ready(request.id(), "10.0.0.5"));

        assertThat(result.value().version()).isEqualTo(4);
        assertThat(fixture.eventStream.load(request.id()).value().status()).isEqualTo(VmRequestStatus.READY);
        var details = ArgumentCaptor.forClass(VmDetailsUpdate.class);
        verify(fixture.projections).updateVmDetails(details.capture());
        assertThat(details.getValue().hypervisorVmId()).isEqualTo("vm-42");
        assertThat(details.getValue().ipAddress()).isEqualTo("10.0.0.5");
        assertThat(details.getValue().provisionedAt()).isEqualTo(PROVISIONED_AT);
        assertThat(details.getValue().errorMessage()).isNull();
    }

    @Test
    @DisplayName("mentions a missing IP address on the timeline")
    void missingIpOnTimeline() {
        var request = fixture.seed(VmRequestTestData.provisioningRequest());

        handler.handle(ready(request.id(), null));

        var timeline = ArgumentCaptor.forClass(NewTimelineEvent.class);
        verify(fixture.timeline).addTimelineEvent(timeline.capture());
        assertThat(timeline.getValue().details()).isEqualTo("VM web-01 is ready (no IP address yet)");
    }

    @Test
    @DisplayName("a repeated ready is a successful no-op")
    void idempotent() {
        var request = fixture.seed(VmRequestTestData.provisioningRequest());
        handler.handle(ready(request.id(), "10.0.0.5"));

        var again = handler.handle(ready(request.id(), "10.0.0.5"));

        assertThat(again.value().stateChanged()).isFalse();
        verify(fixture.publisher, times(1)).publish(any());
    }

    @Test
    @DisplayName("an approved request that never started provisioning is an invalid state")
    void requiresProvisioning() {
        var request = fixture.seed(VmRequestTestData.approvedRequest());

        var result = handler.handle(ready(request.id(), "10.0.0.5"));

        assertThat(result.error()).isInstanceOf(VmRequestError.InvalidState.class);
    }
}
